package com.setcubes.config.notation;

import com.setcubes.card.Category;
import com.setcubes.token.Operator;
import com.setcubes.token.Token;

import java.util.Map;

/**
 * Words and symbols of the token notation.
 */
public final class NotationConfig {

    private NotationConfig() {
    }

    /**
     * Words mapped to tokens. Matched case-insensitively.
     */
    public static final Map<String, Token> WORDS = Map.ofEntries(
            // Categories
            Map.entry("RED", Token.category(Category.RED)),
            Map.entry("BLUE", Token.category(Category.BLUE)),
            Map.entry("GREEN", Token.category(Category.GREEN)),
            Map.entry("GOLD", Token.category(Category.GOLD)),

            // Constants
            Map.entry("U", Token.universe()),
            Map.entry("NULL", Token.nullSet()),

            // Operators
            Map.entry("UNION", Token.operator(Operator.UNION)),
            Map.entry("INTERSECT", Token.operator(Operator.INTERSECT)),
            Map.entry("MINUS", Token.operator(Operator.DIFFERENCE)),
            Map.entry("COMPLEMENT", Token.operator(Operator.COMPLEMENT)),
            Map.entry("SUBSET", Token.operator(Operator.SUBSET)),
            Map.entry("EQUALS", Token.operator(Operator.EQUALS))
    );

    /**
     * Single-character symbols mapped to tokens.
     */
    public static final Map<Character, Token> SYMBOLS = Map.ofEntries(
            Map.entry('∅', Token.nullSet()),
            Map.entry('∪', Token.operator(Operator.UNION)),
            Map.entry('∩', Token.operator(Operator.INTERSECT)),
            Map.entry('−', Token.operator(Operator.DIFFERENCE)),
            Map.entry('-', Token.operator(Operator.DIFFERENCE)),
            Map.entry('′', Token.operator(Operator.COMPLEMENT)),
            Map.entry('\'', Token.operator(Operator.COMPLEMENT)),
            Map.entry('⊆', Token.operator(Operator.SUBSET)),
            Map.entry('=', Token.operator(Operator.EQUALS))
    );

    /**
     * Delimiter and marker characters.
     */
    public static final class Marks {
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char WILDCARD = '?';

        private Marks() {
        }
    }
}
