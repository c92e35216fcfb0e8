package com.setcubes.config.notation;

/**
 * Symbol types of the token notation.
 */
public enum SymbolType {
    TOKEN,

    // Group delimiters
    LBRACKET,
    RBRACKET,

    // Special
    EOF
}
