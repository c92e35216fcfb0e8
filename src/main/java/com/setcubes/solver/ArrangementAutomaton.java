package com.setcubes.solver;

import com.setcubes.token.Token;

/**
 * Recognises token sequences that can be cut into an optional restriction line followed
 * by a set-name line, ignoring grouping.
 * <p>
 * Grouping never turns an invalid flat sequence into a valid one, so a permutation whose
 * prefix is rejected here can be abandoned together with all of its continuations.
 * The automaton is nondeterministic only for unresolved wildcards; its state is a bit
 * set of the states still reachable.
 */
final class ArrangementAutomaton {

    // Before any restriction operator
    private static final int EXPECT_OPERAND = 1;
    private static final int AFTER_OPERAND = 1 << 1;
    // Right side of the restriction
    private static final int RIGHT_EXPECT_OPERAND = 1 << 2;
    private static final int RIGHT_AFTER_OPERAND = 1 << 3;
    // Set-name line following a restriction line
    private static final int NAME_EXPECT_OPERAND = 1 << 4;
    private static final int NAME_AFTER_OPERAND = 1 << 5;

    static final int START = EXPECT_OPERAND;
    static final int REJECTED = 0;

    private final boolean restrictionsEnabled;

    ArrangementAutomaton(boolean restrictionsEnabled) {
        this.restrictionsEnabled = restrictionsEnabled;
    }

    /**
     * Advance every live state over one token.
     */
    int step(int states, Token token) {
        if (token.isOperand()) {
            return operand(states);
        }
        if (token.isUnresolved()) {
            return setOperator(states) | postfix(states);
        }
        if (token.isPostfix()) {
            return postfix(states);
        }
        if (token.isRestriction()) {
            return restrictionsEnabled && (states & AFTER_OPERAND) != 0 ? RIGHT_EXPECT_OPERAND : REJECTED;
        }
        return setOperator(states);
    }

    boolean accepts(int states) {
        return (states & (AFTER_OPERAND | NAME_AFTER_OPERAND)) != 0;
    }

    private static int operand(int states) {
        int next = 0;
        if ((states & EXPECT_OPERAND) != 0) next |= AFTER_OPERAND;
        if ((states & RIGHT_EXPECT_OPERAND) != 0) next |= RIGHT_AFTER_OPERAND;
        // An operand right after a complete right side starts the set-name line
        if ((states & RIGHT_AFTER_OPERAND) != 0) next |= NAME_AFTER_OPERAND;
        if ((states & NAME_EXPECT_OPERAND) != 0) next |= NAME_AFTER_OPERAND;
        return next;
    }

    private static int setOperator(int states) {
        int next = 0;
        if ((states & AFTER_OPERAND) != 0) next |= EXPECT_OPERAND;
        if ((states & RIGHT_AFTER_OPERAND) != 0) next |= RIGHT_EXPECT_OPERAND;
        if ((states & NAME_AFTER_OPERAND) != 0) next |= NAME_EXPECT_OPERAND;
        return next;
    }

    private static int postfix(int states) {
        return states & (AFTER_OPERAND | RIGHT_AFTER_OPERAND | NAME_AFTER_OPERAND);
    }
}
