package com.setcubes.token;

/**
 * A token as positioned by the player.
 *
 * @param token token value
 * @param x     horizontal position of the token
 * @param y     vertical position of the token
 */
public record PlacedToken(Token token, double x, double y) {

    public static PlacedToken at(Token token, double x, double y) {
        return new PlacedToken(token, x, y);
    }
}
