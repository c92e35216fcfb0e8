package com.setcubes.config.notation;

import com.setcubes.exception.ConfigurationException;
import com.setcubes.token.Operator;
import com.setcubes.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.setcubes.config.notation.NotationConfig.*;

/**
 * Tokenizer for token notation.
 * Converts input string into a sequence of symbols.
 */
public final class NotationTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public NotationTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of symbols, terminated by EOF
     */
    public List<Symbol> tokenize() {
        List<Symbol> symbols = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            int start = pos;
            if (c == Marks.LEFT_BRACKET) {
                pos++;
                symbols.add(new Symbol(SymbolType.LBRACKET, "[", null, start));
            } else if (c == Marks.RIGHT_BRACKET) {
                pos++;
                symbols.add(new Symbol(SymbolType.RBRACKET, "]", null, start));
            } else if (c == Marks.WILDCARD) {
                symbols.add(readWildcard());
            } else if (SYMBOLS.containsKey(c)) {
                pos++;
                symbols.add(new Symbol(SymbolType.TOKEN, String.valueOf(c), SYMBOLS.get(c), start));
            } else if (Character.isLetter(c)) {
                symbols.add(readWord());
            } else {
                throw error("Unexpected character '" + c + "'", start);
            }
        }

        symbols.add(new Symbol(SymbolType.EOF, "", null, pos));
        return symbols;
    }

    private Symbol readWord() {
        int start = pos;
        while (!isAtEnd() && Character.isLetter(peek())) {
            pos++;
        }
        String word = input.substring(start, pos);
        Token token = WORDS.get(word.toUpperCase(Locale.ROOT));
        if (token == null) {
            throw error("Unknown token '" + word + "'", start);
        }
        return new Symbol(SymbolType.TOKEN, word, token, start);
    }

    private Symbol readWildcard() {
        int start = pos;
        pos++;
        if (isAtEnd() || !SYMBOLS.containsKey(peek())) {
            return new Symbol(SymbolType.TOKEN, "?", Token.wildcard(), start);
        }
        Token operator = SYMBOLS.get(peek());
        pos++;
        if (!Operator.WILDCARD_CHOICES.contains(operator.operator())) {
            throw error("Wildcard cannot stand for '" + operator + "'", start);
        }
        Token resolved = Token.wildcard().resolve(operator.operator());
        return new Symbol(SymbolType.TOKEN, input.substring(start, pos), resolved, start);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private ConfigurationException error(String message, int position) {
        return new ConfigurationException("Invalid token notation at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
