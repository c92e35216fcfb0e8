package com.setcubes.syntax;

import com.setcubes.line.GroupPartition;
import com.setcubes.line.Line;
import com.setcubes.line.LineRole;
import com.setcubes.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Checks token sequences and lines against the expression grammar.
 * <p>
 * Grammar:
 * <pre>
 * expression := operand (binary operand)*
 * operand    := (category | 'U' | '∅') ('′')*
 * </pre>
 * A line is valid when every multi-token group is a valid expression on its own and
 * the line, with each such group collapsed to one operand, is valid too.
 * Restriction operators never appear inside a set expression; a restriction line
 * holds exactly one of them at top level with a non-empty expression on each side.
 */
public class SyntaxValidator {

    /** Grammar role of one element of a (possibly collapsed) sequence. */
    enum Element {
        OPERAND,
        SET_OPERATOR,
        RESTRICTION,
        POSTFIX,
        UNRESOLVED
    }

    /**
     * Validate a line according to its role.
     */
    public boolean isValid(Line line) {
        return line.role() == LineRole.RESTRICTION
                ? isValidRestriction(line)
                : isValidExpression(line);
    }

    /**
     * Validate a flat token sequence, every token its own group.
     */
    public boolean isValidExpression(List<Token> tokens) {
        List<Element> elements = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            elements.add(classify(token));
        }
        return matchesGrammar(elements);
    }

    /**
     * Validate a line as a set expression, honouring its grouping. The empty line is valid.
     */
    public boolean isValidExpression(Line line) {
        GroupPartition partition = line.partition();
        for (int group = 0; group < partition.groupCount(); group++) {
            if (partition.isSingleton(group)) {
                continue;
            }
            List<Element> inner = new ArrayList<>();
            for (int position : partition.members(group)) {
                inner.add(classify(line.token(position)));
            }
            if (!matchesGrammar(inner)) {
                return false;
            }
        }
        return matchesGrammar(collapse(line));
    }

    /**
     * Validate a restriction line: exactly one top-level restriction operator, flanked by
     * two non-empty valid set expressions.
     */
    public boolean isValidRestriction(Line line) {
        OptionalInt position = restrictionPosition(line);
        if (position.isEmpty()) {
            return false;
        }
        int split = position.getAsInt();
        Optional<Line> left = line.sub(0, split);
        Optional<Line> right = line.sub(split + 1, line.size());
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return !left.get().isEmpty() && !right.get().isEmpty()
                && isValidExpression(left.get())
                && isValidExpression(right.get());
    }

    /**
     * Position of the single top-level restriction operator of a line.
     *
     * @return empty if the line has none, more than one, or one buried in a group
     */
    public OptionalInt restrictionPosition(Line line) {
        int found = -1;
        for (int i = 0; i < line.size(); i++) {
            if (!line.token(i).isRestriction()) {
                continue;
            }
            if (found >= 0 || !line.partition().isSingleton(line.partition().groupOf(i))) {
                return OptionalInt.empty();
            }
            found = i;
        }
        return found < 0 ? OptionalInt.empty() : OptionalInt.of(found);
    }

    private List<Element> collapse(Line line) {
        GroupPartition partition = line.partition();
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < line.size(); i++) {
            int group = partition.groupOf(i);
            if (partition.isSingleton(group)) {
                elements.add(classify(line.token(i)));
            } else if (partition.leftmost(group) == i) {
                elements.add(Element.OPERAND);
            }
        }
        return elements;
    }

    static Element classify(Token token) {
        if (token.isUnresolved()) {
            return Element.UNRESOLVED;
        }
        if (token.isOperand()) {
            return Element.OPERAND;
        }
        if (token.isPostfix()) {
            return Element.POSTFIX;
        }
        if (token.isRestriction()) {
            return Element.RESTRICTION;
        }
        return Element.SET_OPERATOR;
    }

    private static boolean matchesGrammar(List<Element> elements) {
        boolean expectingOperand = true;
        for (Element element : elements) {
            switch (element) {
                case OPERAND -> {
                    if (!expectingOperand) {
                        return false;
                    }
                    expectingOperand = false;
                }
                case POSTFIX -> {
                    if (expectingOperand) {
                        return false;
                    }
                }
                case SET_OPERATOR -> {
                    if (expectingOperand) {
                        return false;
                    }
                    expectingOperand = true;
                }
                case RESTRICTION, UNRESOLVED -> {
                    return false;
                }
            }
        }
        return elements.isEmpty() || !expectingOperand;
    }
}
