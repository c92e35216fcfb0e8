package com.setcubes.evaluation;

import com.setcubes.card.CardSet;
import com.setcubes.card.Universe;
import com.setcubes.line.Line;

/**
 * Evaluates a set expression line into the cards it names.
 */
public interface ExpressionEvaluator {

    /**
     * Evaluate a line against the active part of a universe.
     *
     * @param line     line to evaluate; its role is not consulted
     * @param universe the round's cards
     * @param active   cards still in play; operands and complements only range over these
     * @return matched cards, or invalid if the line fails validation
     */
    EvaluationResult evaluate(Line line, Universe universe, CardSet active);

    /**
     * Evaluate a line against the whole universe.
     */
    default EvaluationResult evaluate(Line line, Universe universe) {
        return evaluate(line, universe, universe.all());
    }
}
