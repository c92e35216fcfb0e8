package com.setcubes.solver;

import java.util.OptionalInt;

/**
 * Aggregate figures over all solutions of a puzzle, used to rate difficulty.
 *
 * @param solutionCount       number of structurally distinct solutions
 * @param shortestLength      fewest tokens used by a solution, 0 if none
 * @param longestLength       most tokens used by a solution, 0 if none
 * @param complete            false if the budget stopped the search early
 * @param candidatesEvaluated number of arrangements evaluated
 */
public record SolutionStats(
        long solutionCount,
        int shortestLength,
        int longestLength,
        boolean complete,
        long candidatesEvaluated
) {
    public boolean hasSolutions() {
        return solutionCount > 0;
    }

    public OptionalInt shortest() {
        return hasSolutions() ? OptionalInt.of(shortestLength) : OptionalInt.empty();
    }

    public OptionalInt longest() {
        return hasSolutions() ? OptionalInt.of(longestLength) : OptionalInt.empty();
    }
}
