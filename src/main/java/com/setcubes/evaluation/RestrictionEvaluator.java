package com.setcubes.evaluation;

import com.setcubes.card.CardSet;
import com.setcubes.card.Universe;
import com.setcubes.line.Line;
import com.setcubes.syntax.SyntaxValidator;
import com.setcubes.token.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes which cards a restriction line flips out of play.
 * <p>
 * The line is cut at its restriction operator; both sides are evaluated against the
 * full universe, never against an already restricted one.
 * <ul>
 *   <li>{@code A ⊆ B} flips {@code A \ B}</li>
 *   <li>{@code A = B} flips {@code A △ B}</li>
 * </ul>
 */
public class RestrictionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RestrictionEvaluator.class);

    private final SyntaxValidator validator;
    private final ExpressionEvaluator evaluator;

    public RestrictionEvaluator(SyntaxValidator validator, ExpressionEvaluator evaluator) {
        this.validator = validator;
        this.evaluator = evaluator;
    }

    /**
     * Evaluate the violators of a restriction line.
     *
     * @param line     restriction line
     * @param universe the round's cards
     * @return violating cards, or invalid if the line is malformed
     */
    public EvaluationResult violators(Line line, Universe universe) {
        if (!validator.isValidRestriction(line)) {
            log.trace("Invalid restriction: {}", line);
            return EvaluationResult.invalid();
        }
        int split = validator.restrictionPosition(line).orElseThrow();
        Operator operator = line.token(split).operator();

        EvaluationResult left = line.sub(0, split)
                .map(side -> evaluator.evaluate(side, universe))
                .orElse(EvaluationResult.invalid());
        EvaluationResult right = line.sub(split + 1, line.size())
                .map(side -> evaluator.evaluate(side, universe))
                .orElse(EvaluationResult.invalid());
        if (!left.isValid() || !right.isValid()) {
            return EvaluationResult.invalid();
        }

        CardSet flipped = operator == Operator.SUBSET
                ? left.cards().minus(right.cards())
                : left.cards().symmetricDifference(right.cards());
        log.trace("Restriction {}: left={}, right={}, flipped={}", line, left.cards(), right.cards(), flipped);
        return EvaluationResult.of(flipped);
    }
}
