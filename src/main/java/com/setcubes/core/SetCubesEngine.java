package com.setcubes.core;

import com.setcubes.card.Universe;
import com.setcubes.evaluation.BoardEvaluator;
import com.setcubes.evaluation.BoardResult;
import com.setcubes.line.Line;
import com.setcubes.solver.SearchBudget;
import com.setcubes.solver.SearchOutcome;
import com.setcubes.solver.ShortestSolution;
import com.setcubes.solver.Solution;
import com.setcubes.solver.SolutionStats;
import com.setcubes.solver.SolvabilitySearch;
import com.setcubes.token.PlacedToken;
import com.setcubes.token.TokenPool;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for the game layer: live board evaluation and solvability queries.
 * <p>
 * Interactive queries run under the configured budget; the {@link SolvabilitySearch}
 * is exposed for offline callers that need exact answers.
 */
public class SetCubesEngine {

    private final BoardEvaluator boardEvaluator;
    private final SolvabilitySearch search;
    private final SearchBudget budget;

    public SetCubesEngine(BoardEvaluator boardEvaluator, SolvabilitySearch search, SearchBudget budget) {
        this.boardEvaluator = boardEvaluator;
        this.search = search;
        this.budget = budget;
    }

    /**
     * Evaluate the tokens a player has placed on the two rows.
     */
    public BoardResult evaluateBoard(Puzzle puzzle, List<PlacedToken> restriction, List<PlacedToken> setName) {
        return evaluateBoard(puzzle.universe(), puzzle.pool(), restriction, setName);
    }

    public BoardResult evaluateBoard(Universe universe, TokenPool pool,
                                     List<PlacedToken> restriction, List<PlacedToken> setName) {
        return boardEvaluator.evaluate(universe, pool, restriction, setName);
    }

    public BoardResult evaluateBoard(Universe universe, Line restriction, Line setName) {
        return boardEvaluator.evaluate(universe, restriction, setName);
    }

    /**
     * Whether the placed tokens solve the puzzle.
     */
    public boolean isSolved(Puzzle puzzle, List<PlacedToken> restriction, List<PlacedToken> setName) {
        return evaluateBoard(puzzle, restriction, setName).solves(puzzle.goal());
    }

    public SearchOutcome existsSolution(Puzzle puzzle) {
        return search.existsSolution(puzzle, budget);
    }

    public ShortestSolution shortestSolution(Puzzle puzzle) {
        return search.shortestSolution(puzzle, budget);
    }

    /**
     * A hint: a shortest solution, if the budget allows finding one.
     */
    public Optional<Solution> findSolution(Puzzle puzzle) {
        return shortestSolution(puzzle).solution();
    }

    public SolutionStats solutionStats(Puzzle puzzle) {
        return search.solutionStats(puzzle, budget);
    }

    public SolvabilitySearch search() {
        return search;
    }

    public SearchBudget budget() {
        return budget;
    }
}
