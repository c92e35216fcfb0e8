package com.setcubes.token;

/**
 * Kinds of tokens a player can place.
 */
public enum TokenKind {
    // Operands
    CATEGORY,
    UNIVERSE,
    NULL_SET,

    // Operators
    BINARY_OPERATOR,
    POSTFIX_OPERATOR,

    // Resolved to an operator by the player
    WILDCARD
}
