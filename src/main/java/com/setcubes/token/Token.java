package com.setcubes.token;

import com.setcubes.card.Category;
import com.setcubes.exception.IntegrationException;

/**
 * A token value. Tokens with equal components are interchangeable.
 *
 * @param kind     token kind
 * @param category category for {@link TokenKind#CATEGORY} tokens, otherwise null
 * @param operator operator for operator tokens, the chosen operator for a resolved
 *                 wildcard, null for operands and unresolved wildcards
 */
public record Token(TokenKind kind, Category category, Operator operator) {

    private static final Token UNIVERSE = new Token(TokenKind.UNIVERSE, null, null);
    private static final Token NULL_SET = new Token(TokenKind.NULL_SET, null, null);
    private static final Token WILDCARD = new Token(TokenKind.WILDCARD, null, null);

    public Token {
        if (kind == null) {
            throw new IntegrationException("Token kind cannot be null");
        }
        switch (kind) {
            case CATEGORY -> {
                if (category == null || operator != null) {
                    throw new IntegrationException("Category token requires exactly a category");
                }
            }
            case UNIVERSE, NULL_SET -> {
                if (category != null || operator != null) {
                    throw new IntegrationException(kind + " token takes no category or operator");
                }
            }
            case BINARY_OPERATOR -> {
                if (operator == null || !operator.isBinary() || category != null) {
                    throw new IntegrationException("Binary token requires a binary operator, got " + operator);
                }
            }
            case POSTFIX_OPERATOR -> {
                if (operator == null || !operator.isPostfix() || category != null) {
                    throw new IntegrationException("Postfix token requires a postfix operator, got " + operator);
                }
            }
            case WILDCARD -> {
                if (category != null) {
                    throw new IntegrationException("Wildcard token takes no category");
                }
                if (operator != null && !Operator.WILDCARD_CHOICES.contains(operator)) {
                    throw new IntegrationException("Wildcard cannot resolve to " + operator);
                }
            }
        }
    }

    public static Token category(Category category) {
        return new Token(TokenKind.CATEGORY, category, null);
    }

    public static Token universe() {
        return UNIVERSE;
    }

    public static Token nullSet() {
        return NULL_SET;
    }

    public static Token operator(Operator operator) {
        return new Token(operator.isPostfix() ? TokenKind.POSTFIX_OPERATOR : TokenKind.BINARY_OPERATOR,
                null, operator);
    }

    public static Token wildcard() {
        return WILDCARD;
    }

    /**
     * Resolve a wildcard to the given operator.
     */
    public Token resolve(Operator choice) {
        if (kind != TokenKind.WILDCARD) {
            throw new IntegrationException("Only wildcards can be resolved, not " + this);
        }
        return new Token(TokenKind.WILDCARD, null, choice);
    }

    /**
     * The value this token occupies in a pool: resolved wildcards map back to a plain wildcard.
     */
    public Token poolForm() {
        return kind == TokenKind.WILDCARD ? WILDCARD : this;
    }

    public boolean isOperand() {
        return kind == TokenKind.CATEGORY || kind == TokenKind.UNIVERSE || kind == TokenKind.NULL_SET;
    }

    public boolean isWildcard() {
        return kind == TokenKind.WILDCARD;
    }

    public boolean isUnresolved() {
        return kind == TokenKind.WILDCARD && operator == null;
    }

    public boolean isBinary() {
        return operator != null && operator.isBinary();
    }

    public boolean isPostfix() {
        return operator != null && operator.isPostfix();
    }

    public boolean isRestriction() {
        return operator != null && operator.isRestriction();
    }

    public String symbol() {
        return switch (kind) {
            case CATEGORY -> category.symbol();
            case UNIVERSE -> "U";
            case NULL_SET -> "∅";
            case BINARY_OPERATOR, POSTFIX_OPERATOR -> operator.symbol();
            case WILDCARD -> operator == null ? "?" : "?" + operator.symbol();
        };
    }

    @Override
    public String toString() {
        return symbol();
    }
}
