package com.setcubes.config.notation;

import com.setcubes.token.Token;

/**
 * A symbol read from token notation.
 *
 * @param type     symbol type
 * @param text     original text
 * @param token    token value for {@link SymbolType#TOKEN} symbols
 * @param position position in the input string
 */
public record Symbol(SymbolType type, String text, Token token, int position) {

    @Override
    public String toString() {
        if (token != null) {
            return type + "(" + token + ")";
        }
        return type + "(" + text + ")";
    }
}
