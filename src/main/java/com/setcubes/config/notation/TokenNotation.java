package com.setcubes.config.notation;

import com.setcubes.line.Line;
import com.setcubes.line.LineRole;
import com.setcubes.token.Token;

import java.util.List;

/**
 * Facade for reading token lists and lines written in token notation.
 * <p>
 * Supports:
 * <ul>
 *   <li>Categories: red, blue, green, gold</li>
 *   <li>Constants: U, ∅ (or null)</li>
 *   <li>Operators: ∪ ∩ − ′ ⊆ = (or union, intersect, minus/-, complement/', subset, equals)</li>
 *   <li>Wildcards: ? unresolved, ?∪ resolved</li>
 *   <li>Square brackets around tokens that touch each other</li>
 * </ul>
 * Used for configuration files and fixtures; players place tokens, they do not type them.
 */
public final class TokenNotation {

    private TokenNotation() {
    }

    /**
     * Parse a whitespace-separated token list, e.g. {@code "red blue ∪ green ?"}.
     */
    public static List<Token> parseTokens(String notation) {
        if (notation == null || notation.isBlank()) {
            return List.of();
        }
        List<Symbol> symbols = new NotationTokenizer(notation).tokenize();
        return new NotationParser(notation, symbols).parseTokens();
    }

    /**
     * Parse a grouped line, e.g. {@code "green ∪ [red ∩ red]"}.
     */
    public static Line parseLine(LineRole role, String notation) {
        if (notation == null || notation.isBlank()) {
            return Line.empty(role);
        }
        List<Symbol> symbols = new NotationTokenizer(notation).tokenize();
        return new NotationParser(notation, symbols).parseLine(role);
    }

    public static Line setName(String notation) {
        return parseLine(LineRole.SET_NAME, notation);
    }

    public static Line restriction(String notation) {
        return parseLine(LineRole.RESTRICTION, notation);
    }
}
