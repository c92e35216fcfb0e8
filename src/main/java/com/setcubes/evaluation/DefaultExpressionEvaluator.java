package com.setcubes.evaluation;

import com.setcubes.card.CardSet;
import com.setcubes.card.Universe;
import com.setcubes.line.GroupPartition;
import com.setcubes.line.Line;
import com.setcubes.syntax.SyntaxValidator;
import com.setcubes.token.Operator;
import com.setcubes.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of ExpressionEvaluator.
 * <p>
 * Evaluation runs in two passes:
 * <ol>
 *   <li>each multi-token group is folded left to right into one card set;</li>
 *   <li>the line, with every group replaced by its set at the group's leftmost
 *       position, is folded the same way.</li>
 * </ol>
 * There is no operator precedence besides grouping. A complement applies to the
 * operand right before it.
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultExpressionEvaluator.class);

    private final SyntaxValidator validator;

    public DefaultExpressionEvaluator(SyntaxValidator validator) {
        this.validator = validator;
    }

    @Override
    public EvaluationResult evaluate(Line line, Universe universe, CardSet active) {
        if (!validator.isValidExpression(line)) {
            log.trace("Invalid expression: {}", line);
            return EvaluationResult.invalid();
        }
        if (line.isEmpty()) {
            return EvaluationResult.of(CardSet.empty());
        }

        GroupPartition partition = line.partition();
        List<Item> reduced = new ArrayList<>();
        for (int i = 0; i < line.size(); i++) {
            int group = partition.groupOf(i);
            if (partition.isSingleton(group)) {
                reduced.add(item(line.token(i), universe, active));
            } else if (partition.leftmost(group) == i) {
                List<Item> inner = new ArrayList<>();
                for (int position : partition.members(group)) {
                    inner.add(item(line.token(position), universe, active));
                }
                reduced.add(Item.value(fold(inner, active)));
            }
        }

        CardSet result = fold(reduced, active);
        log.trace("Evaluated {} -> {}", line, result);
        return EvaluationResult.of(result);
    }

    /**
     * Fold a validated sequence: operand (postfix)* (binary operand (postfix)*)*.
     */
    private CardSet fold(List<Item> items, CardSet active) {
        int[] cursor = {0};
        CardSet result = operand(items, cursor, active);
        while (cursor[0] < items.size()) {
            Operator operator = items.get(cursor[0]++).operator();
            CardSet next = operand(items, cursor, active);
            result = apply(operator, result, next);
        }
        return result;
    }

    private CardSet operand(List<Item> items, int[] cursor, CardSet active) {
        CardSet value = items.get(cursor[0]++).value();
        while (cursor[0] < items.size() && items.get(cursor[0]).isPostfix()) {
            value = value.complementWithin(active);
            cursor[0]++;
        }
        return value;
    }

    private static CardSet apply(Operator operator, CardSet left, CardSet right) {
        return switch (operator) {
            case UNION -> left.union(right);
            case INTERSECT -> left.intersect(right);
            case DIFFERENCE -> left.minus(right);
            default -> throw new IllegalStateException("Not a set operator: " + operator);
        };
    }

    private static Item item(Token token, Universe universe, CardSet active) {
        return switch (token.kind()) {
            case CATEGORY -> Item.value(universe.cardsWith(token.category()).intersect(active));
            case UNIVERSE -> Item.value(active);
            case NULL_SET -> Item.value(CardSet.empty());
            case BINARY_OPERATOR, POSTFIX_OPERATOR, WILDCARD -> Item.operator(token.operator());
        };
    }

    /** A reduced element: a card set or an operator. */
    private record Item(CardSet value, Operator operator) {

        static Item value(CardSet value) {
            return new Item(value, null);
        }

        static Item operator(Operator operator) {
            return new Item(null, operator);
        }

        boolean isPostfix() {
            return operator != null && operator.isPostfix();
        }
    }
}
