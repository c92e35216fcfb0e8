package com.setcubes.solver;

/**
 * Answer of a bounded existence query.
 */
public enum SearchOutcome {
    FOUND,
    NOT_FOUND,
    /** The budget ran out before the search could decide. */
    UNKNOWN
}
