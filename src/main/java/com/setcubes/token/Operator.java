package com.setcubes.token;

import java.util.List;

/**
 * Operators a token can stand for.
 */
public enum Operator {
    UNION("∪", false, false),
    INTERSECT("∩", false, false),
    DIFFERENCE("−", false, false),
    SUBSET("⊆", false, true),
    EQUALS("=", false, true),
    COMPLEMENT("′", true, false);

    /**
     * Operators a wildcard may be resolved to.
     */
    public static final List<Operator> WILDCARD_CHOICES = List.of(UNION, INTERSECT, DIFFERENCE, COMPLEMENT);

    private final String symbol;
    private final boolean postfix;
    private final boolean restriction;

    Operator(String symbol, boolean postfix, boolean restriction) {
        this.symbol = symbol;
        this.postfix = postfix;
        this.restriction = restriction;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public boolean isBinary() {
        return !postfix;
    }

    /**
     * Subset and Equals compare two sets instead of producing one.
     */
    public boolean isRestriction() {
        return restriction;
    }
}
