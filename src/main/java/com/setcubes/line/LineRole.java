package com.setcubes.line;

/**
 * The two lines of a round's solution.
 */
public enum LineRole {
    /** Compares two sets and flips the cards that violate the comparison. */
    RESTRICTION,
    /** Names the set of cards that is counted against the goal. */
    SET_NAME
}
