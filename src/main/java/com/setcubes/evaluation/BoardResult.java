package com.setcubes.evaluation;

import com.setcubes.card.CardSet;

/**
 * What the board shows for the two lines currently placed.
 *
 * @param matches          cards named by the set-name line, within the active cards
 * @param flipped          cards flipped out of play by the restriction line
 * @param restrictionValid whether the restriction line is valid (an empty line is)
 * @param setNameValid     whether the set-name line is valid (an empty line is)
 * @param setNameEmpty     whether the set-name line has no tokens
 */
public record BoardResult(
        CardSet matches,
        CardSet flipped,
        boolean restrictionValid,
        boolean setNameValid,
        boolean setNameEmpty
) {
    /**
     * Cards still in play after the restriction.
     */
    public CardSet active() {
        return flipped.complementWithin(CardSet.all());
    }

    /**
     * Whether these lines can be submitted as a solution for the goal.
     */
    public boolean solves(int goal) {
        return restrictionValid && setNameValid && !setNameEmpty && matches.size() == goal;
    }
}
