package com.setcubes.solver;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Result of a shortest-solution query.
 *
 * @param outcome whether a solution was found, ruled out, or the budget ran out
 * @param witness a shortest solution when found, otherwise null
 */
public record ShortestSolution(SearchOutcome outcome, Solution witness) {

    public static ShortestSolution found(Solution witness) {
        return new ShortestSolution(SearchOutcome.FOUND, witness);
    }

    public static ShortestSolution notFound() {
        return new ShortestSolution(SearchOutcome.NOT_FOUND, null);
    }

    public static ShortestSolution unknown() {
        return new ShortestSolution(SearchOutcome.UNKNOWN, null);
    }

    public Optional<Solution> solution() {
        return Optional.ofNullable(witness);
    }

    public OptionalInt length() {
        return witness == null ? OptionalInt.empty() : OptionalInt.of(witness.tokenCount());
    }
}
