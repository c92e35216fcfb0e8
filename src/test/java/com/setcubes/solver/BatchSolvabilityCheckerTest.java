package com.setcubes.solver;

import com.setcubes.card.Universe;
import com.setcubes.config.notation.TokenNotation;
import com.setcubes.core.Puzzle;
import com.setcubes.evaluation.DefaultExpressionEvaluator;
import com.setcubes.evaluation.ExpressionEvaluator;
import com.setcubes.evaluation.RestrictionEvaluator;
import com.setcubes.syntax.SyntaxValidator;
import com.setcubes.token.TokenPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BatchSolvabilityCheckerTest {

    private static final Universe UNIVERSE = Universe.of(1, 2, 3, 4, 5, 8, 9, 10);

    private SolvabilitySearch search;
    private BatchSolvabilityChecker checker;

    @BeforeEach
    void setUp() {
        SyntaxValidator validator = new SyntaxValidator();
        ExpressionEvaluator evaluator = new DefaultExpressionEvaluator(validator);
        search = new ExhaustiveSolvabilitySearch(validator, evaluator, new RestrictionEvaluator(validator, evaluator));
    }

    @AfterEach
    void tearDown() {
        if (checker != null && !checker.isShutdown()) {
            checker.shutdown();
        }
    }

    private static Puzzle puzzle(String pool, int goal) {
        return new Puzzle(UNIVERSE, TokenPool.of(TokenNotation.parseTokens(pool), false), goal);
    }

    @Test
    @DisplayName("Should return one outcome per puzzle in input order")
    void shouldKeepInputOrder() {
        checker = new BatchSolvabilityChecker(search, SearchBudget.unlimited(), 3);
        List<Puzzle> puzzles = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            puzzles.add(puzzle("red blue ∪", 5));
            puzzles.add(puzzle("red blue", 5));
        }

        List<SearchOutcome> outcomes = checker.check(puzzles);

        assertEquals(puzzles.size(), outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            SearchOutcome expected = i % 2 == 0 ? SearchOutcome.FOUND : SearchOutcome.NOT_FOUND;
            assertEquals(expected, outcomes.get(i), "puzzle " + i);
        }
    }

    @Test
    @DisplayName("Should apply the budget to every puzzle")
    void shouldApplyBudget() {
        checker = new BatchSolvabilityChecker(search, SearchBudget.ofSteps(10), 2);

        List<SearchOutcome> outcomes = checker.check(List.of(
                puzzle("red", 3),
                puzzle("red blue green gold ∪ ∩ − ′", 8)));

        assertEquals(List.of(SearchOutcome.FOUND, SearchOutcome.UNKNOWN), outcomes);
    }

    @Test
    @DisplayName("Should shut down its workers")
    void shouldShutDown() throws InterruptedException {
        checker = new BatchSolvabilityChecker(search, SearchBudget.unlimited(), 1);
        assertEquals(List.of(), checker.check(List.of()));

        checker.shutdown();

        assertTrue(checker.isShutdown());
        assertTrue(checker.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should require at least one thread")
    void shouldRequireThreads() {
        assertThrows(IllegalArgumentException.class,
                () -> new BatchSolvabilityChecker(search, SearchBudget.unlimited(), 0));
    }
}
