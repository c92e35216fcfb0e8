package com.setcubes.core;

import com.setcubes.config.EngineConfig;
import com.setcubes.evaluation.BoardEvaluator;
import com.setcubes.evaluation.DefaultExpressionEvaluator;
import com.setcubes.evaluation.ExpressionEvaluator;
import com.setcubes.evaluation.RestrictionEvaluator;
import com.setcubes.solver.ExhaustiveSolvabilitySearch;
import com.setcubes.syntax.SyntaxValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for wiring a {@link SetCubesEngine} from configuration.
 */
public final class SetCubesEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(SetCubesEngineFactory.class);

    private SetCubesEngineFactory() {
    }

    public static SetCubesEngine create(EngineConfig config) {
        SyntaxValidator validator = new SyntaxValidator();
        ExpressionEvaluator evaluator = new DefaultExpressionEvaluator(validator);
        RestrictionEvaluator restrictionEvaluator = new RestrictionEvaluator(validator, evaluator);

        BoardEvaluator board = new BoardEvaluator(config.grouping().toDetector(), evaluator, restrictionEvaluator);
        ExhaustiveSolvabilitySearch search = new ExhaustiveSolvabilitySearch(validator, evaluator, restrictionEvaluator);

        log.info("Created SetCubes engine '{}' v{}", config.name(), config.version());
        return new SetCubesEngine(board, search, config.search().toBudget());
    }
}
