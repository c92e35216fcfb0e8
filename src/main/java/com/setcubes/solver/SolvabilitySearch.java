package com.setcubes.solver;

import com.setcubes.core.Puzzle;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Answers whether, and how, a puzzle's pool can reach its goal.
 * Implementations are stateless; concurrent calls do not interfere.
 */
public interface SolvabilitySearch {

    /**
     * Whether any arrangement of the pool reaches the goal. Searches without limit.
     */
    default boolean existsSolution(Puzzle puzzle) {
        return existsSolution(puzzle, SearchBudget.unlimited()) == SearchOutcome.FOUND;
    }

    /**
     * Bounded existence check, for interactive callers.
     */
    default SearchOutcome existsSolution(Puzzle puzzle, SearchBudget budget) {
        return shortestSolution(puzzle, budget).outcome();
    }

    /**
     * A shortest arrangement reaching the goal, if one exists.
     */
    default Optional<Solution> findSolution(Puzzle puzzle) {
        return shortestSolution(puzzle, SearchBudget.unlimited()).solution();
    }

    /**
     * Fewest tokens any solution uses, across both lines.
     */
    default OptionalInt shortestSolutionLength(Puzzle puzzle) {
        return shortestSolution(puzzle, SearchBudget.unlimited()).length();
    }

    /**
     * Search by ascending token count and stop at the first solution.
     *
     * @param puzzle puzzle to search
     * @param budget work limit
     * @return outcome and, when found, a shortest witness
     */
    ShortestSolution shortestSolution(Puzzle puzzle, SearchBudget budget);

    /**
     * Count all structurally distinct solutions without limit.
     */
    default SolutionStats solutionStats(Puzzle puzzle) {
        return solutionStats(puzzle, SearchBudget.unlimited());
    }

    /**
     * Count solutions and record the shortest and longest lengths.
     *
     * @param puzzle puzzle to search
     * @param budget work limit; when exhausted the stats are marked incomplete
     * @return aggregated figures
     */
    SolutionStats solutionStats(Puzzle puzzle, SearchBudget budget);
}
