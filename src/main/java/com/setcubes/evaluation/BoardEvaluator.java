package com.setcubes.evaluation;

import com.setcubes.card.CardSet;
import com.setcubes.card.Universe;
import com.setcubes.line.GroupingDetector;
import com.setcubes.line.Line;
import com.setcubes.line.LineRole;
import com.setcubes.token.PlacedToken;
import com.setcubes.token.Token;
import com.setcubes.token.TokenPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Live evaluation of a player's board: a restriction line and a set-name line.
 * <p>
 * The restriction is applied first; its violators leave play and the set-name line
 * is evaluated over the remaining cards. An invalid restriction flips nothing.
 */
public class BoardEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BoardEvaluator.class);

    private final GroupingDetector groupingDetector;
    private final ExpressionEvaluator expressionEvaluator;
    private final RestrictionEvaluator restrictionEvaluator;

    public BoardEvaluator(GroupingDetector groupingDetector,
                          ExpressionEvaluator expressionEvaluator,
                          RestrictionEvaluator restrictionEvaluator) {
        this.groupingDetector = groupingDetector;
        this.expressionEvaluator = expressionEvaluator;
        this.restrictionEvaluator = restrictionEvaluator;
    }

    /**
     * Evaluate placed tokens drawn from a round's pool.
     *
     * @param universe          the round's cards
     * @param pool              the round's pool; every placed token must come from it
     * @param restrictionTokens tokens placed in the restriction row
     * @param setNameTokens     tokens placed in the set-name row
     * @return board state
     * @throws com.setcubes.exception.IntegrationException if the rows use tokens the pool lacks
     */
    public BoardResult evaluate(Universe universe, TokenPool pool,
                                List<PlacedToken> restrictionTokens, List<PlacedToken> setNameTokens) {
        Line restriction = groupingDetector.place(LineRole.RESTRICTION, restrictionTokens);
        Line setName = groupingDetector.place(LineRole.SET_NAME, setNameTokens);

        List<Token> used = new ArrayList<>(restriction.tokens());
        used.addAll(setName.tokens());
        pool.checkUsage(used);

        if (!restriction.isEmpty() && !pool.restrictionsEnabled()) {
            log.debug("Restriction row used while restrictions are disabled: {}", restriction);
            return evaluateSetName(universe, setName, CardSet.empty(), false);
        }
        return evaluate(universe, restriction, setName);
    }

    /**
     * Evaluate two already grouped lines.
     */
    public BoardResult evaluate(Universe universe, Line restriction, Line setName) {
        CardSet flipped = CardSet.empty();
        boolean restrictionValid = true;
        if (!restriction.isEmpty()) {
            EvaluationResult violators = restrictionEvaluator.violators(restriction, universe);
            restrictionValid = violators.isValid();
            flipped = violators.cards();
        }
        return evaluateSetName(universe, setName, flipped, restrictionValid);
    }

    private BoardResult evaluateSetName(Universe universe, Line setName, CardSet flipped, boolean restrictionValid) {
        CardSet active = flipped.complementWithin(universe.all());
        EvaluationResult result = expressionEvaluator.evaluate(setName, universe, active);
        BoardResult board = new BoardResult(result.cards(), flipped, restrictionValid,
                result.isValid(), setName.isEmpty());
        log.debug("Board evaluated: matches={}, flipped={}, restrictionValid={}, setNameValid={}",
                board.matches(), board.flipped(), board.restrictionValid(), board.setNameValid());
        return board;
    }
}
