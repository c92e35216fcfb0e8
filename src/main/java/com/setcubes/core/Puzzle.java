package com.setcubes.core;

import com.setcubes.card.Universe;
import com.setcubes.exception.IntegrationException;
import com.setcubes.token.TokenPool;

/**
 * The input of every solvability query: the round's cards, its token pool and the goal.
 *
 * @param universe the round's eight cards
 * @param pool     tokens available to the player
 * @param goal     number of cards the set-name line has to match
 */
public record Puzzle(Universe universe, TokenPool pool, int goal) {

    public Puzzle {
        if (universe == null || pool == null) {
            throw new IntegrationException("Puzzle requires a universe and a pool");
        }
        if (goal < 0 || goal > Universe.SIZE) {
            throw new IntegrationException("Goal must be between 0 and " + Universe.SIZE + ", got " + goal);
        }
    }
}
