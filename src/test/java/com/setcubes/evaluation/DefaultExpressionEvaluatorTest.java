package com.setcubes.evaluation;

import com.setcubes.card.CardSet;
import com.setcubes.card.Universe;
import com.setcubes.config.notation.TokenNotation;
import com.setcubes.syntax.SyntaxValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DefaultExpressionEvaluatorTest {

    // red {4,5,6,7}, green {1,5,7}, blue {2,3,6,7}, gold {0,3}
    private static final Universe GROUPING = Universe.of(1, 2, 4, 5, 8, 10, 12, 14);
    // gold {1,5,7}, blue {3,5,6}
    private static final Universe COMPLEMENT = Universe.of(0, 1, 2, 4, 8, 15, 6, 9);

    private ExpressionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new DefaultExpressionEvaluator(new SyntaxValidator());
    }

    private EvaluationResult evaluate(Universe universe, String notation) {
        return evaluator.evaluate(TokenNotation.setName(notation), universe);
    }

    @ParameterizedTest(name = "{0} -> {1} cards")
    @DisplayName("Grouping should change the result of the same token sequence")
    @CsvSource({
            "green ∪ red ∩ red,     4",
            "[green ∪ red] ∩ red,   4",
            "green ∪ [red ∩ red],   5",
            "[green ∪ red ∩ red],   4",
            "green ∪ red,           5"
    })
    void groupingShouldChangeResult(String notation, int expected) {
        EvaluationResult result = evaluate(GROUPING, notation);

        assertTrue(result.isValid());
        assertEquals(expected, result.cards().size());
    }

    @Test
    @DisplayName("Without grouping evaluation is strictly left to right")
    void shouldFoldLeftToRight() {
        // (blue ∪ gold) − red
        assertEquals(CardSet.of(0, 2, 3), evaluate(GROUPING, "blue ∪ gold − red").cards());
        // blue ∪ (gold − red)
        assertEquals(CardSet.of(0, 2, 3, 6, 7), evaluate(GROUPING, "blue ∪ [gold − red]").cards());
    }

    @ParameterizedTest(name = "{0} -> {1} cards")
    @DisplayName("Complement should apply to the operand right before it")
    @CsvSource({
            "gold ′ ∩ blue,     2",
            "blue ∩ gold ′,     2",
            "[blue ∩ gold] ′,   7",
            "gold ′ ′,          3",
            "U ′,               0",
            "∅ ′,               8",
            "U,                 8",
            "∅,                 0"
    })
    void complementShouldBindToOperand(String notation, int expected) {
        assertEquals(expected, evaluate(COMPLEMENT, notation).cards().size());
    }

    @Test
    @DisplayName("Resolved wildcards should act as their chosen operator")
    void resolvedWildcardShouldAct() {
        assertEquals(evaluate(GROUPING, "red ∪ blue"), evaluate(GROUPING, "red ?∪ blue"));
        assertEquals(evaluate(GROUPING, "red ′"), evaluate(GROUPING, "red ?′"));
    }

    @Test
    @DisplayName("Operands and complements should range over the active cards only")
    void shouldRespectActiveCards() {
        CardSet active = CardSet.of(4, 5, 6, 7);

        EvaluationResult blue = evaluator.evaluate(TokenNotation.setName("blue"), GROUPING, active);
        EvaluationResult notGold = evaluator.evaluate(TokenNotation.setName("gold ′"), GROUPING, active);
        EvaluationResult universe = evaluator.evaluate(TokenNotation.setName("U"), GROUPING, active);

        assertEquals(CardSet.of(6, 7), blue.cards());
        assertEquals(active, notGold.cards());
        assertEquals(active, universe.cards());
    }

    @Test
    @DisplayName("Invalid lines should evaluate to invalid, empty lines to the empty set")
    void invalidAndEmptyLines() {
        EvaluationResult invalid = evaluate(GROUPING, "red ∪");
        assertFalse(invalid.isValid());
        assertTrue(invalid.cards().isEmpty());
        assertFalse(invalid.hasSize(0));

        EvaluationResult empty = evaluate(GROUPING, "");
        assertTrue(empty.isValid());
        assertTrue(empty.hasSize(0));
    }

    @Test
    @DisplayName("Evaluation should be deterministic")
    void shouldBeDeterministic() {
        String notation = "[green ∪ blue ′] − red ∩ U";
        assertEquals(evaluate(GROUPING, notation), evaluate(GROUPING, notation));
    }
}
