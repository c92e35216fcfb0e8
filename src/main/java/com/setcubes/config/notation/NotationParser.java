package com.setcubes.config.notation;

import com.setcubes.exception.ConfigurationException;
import com.setcubes.line.GroupPartition;
import com.setcubes.line.Line;
import com.setcubes.line.LineRole;
import com.setcubes.token.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for token notation.
 * <p>
 * Grammar:
 * <pre>
 * line   := (token | group)*
 * group  := '[' token+ ']'
 * tokens := token*
 * </pre>
 * Grouping brackets are not parentheses: a group is evaluated as one unit and
 * groups do not nest.
 */
public final class NotationParser {

    private final String input;
    private final List<Symbol> symbols;
    private int index;

    public NotationParser(String input, List<Symbol> symbols) {
        this.input = input;
        this.symbols = symbols;
        this.index = 0;
    }

    /**
     * Parse a plain token list; brackets are not allowed.
     */
    public List<Token> parseTokens() {
        List<Token> tokens = new ArrayList<>();
        while (!isAtEnd()) {
            tokens.add(consume(SymbolType.TOKEN, "Expected token").token());
        }
        return tokens;
    }

    /**
     * Parse a line with optional bracketed groups.
     */
    public Line parseLine(LineRole role) {
        List<Token> tokens = new ArrayList<>();
        List<Integer> labels = new ArrayList<>();
        int group = 0;

        while (!isAtEnd()) {
            if (match(SymbolType.LBRACKET)) {
                int members = 0;
                while (!check(SymbolType.RBRACKET)) {
                    if (check(SymbolType.LBRACKET)) {
                        throw error("Groups cannot nest");
                    }
                    tokens.add(consume(SymbolType.TOKEN, "Expected token or ']'").token());
                    labels.add(group);
                    members++;
                }
                expect(SymbolType.RBRACKET);
                if (members == 0) {
                    throw error("Empty group");
                }
            } else {
                tokens.add(consume(SymbolType.TOKEN, "Expected token or '['").token());
                labels.add(group);
            }
            group++;
        }

        int[] partition = labels.stream().mapToInt(Integer::intValue).toArray();
        return new Line(role, tokens, GroupPartition.of(partition));
    }

    private boolean match(SymbolType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Symbol consume(SymbolType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(SymbolType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(SymbolType type) {
        return peek().type() == type;
    }

    private Symbol advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == SymbolType.EOF;
    }

    private Symbol peek() {
        return symbols.get(index);
    }

    private Symbol previous() {
        return symbols.get(index - 1);
    }

    private ConfigurationException error(String message) {
        int position = peek().position();
        return new ConfigurationException("Invalid token notation at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
