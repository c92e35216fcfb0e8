package com.setcubes.solver;

import com.setcubes.card.CardSet;
import com.setcubes.line.Line;

/**
 * A concrete arrangement that reaches the goal.
 *
 * @param restriction restriction line, empty when none is used
 * @param setName     set-name line
 * @param matches     cards named by the set-name line after the restriction
 */
public record Solution(Line restriction, Line setName, CardSet matches) {

    public int tokenCount() {
        return restriction.size() + setName.size();
    }

    @Override
    public String toString() {
        return restriction.isEmpty()
                ? setName.notation() + " -> " + matches
                : restriction.notation() + " | " + setName.notation() + " -> " + matches;
    }
}
