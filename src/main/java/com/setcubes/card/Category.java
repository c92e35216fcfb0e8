package com.setcubes.card;

import java.util.Optional;

/**
 * Colour categories a card can carry.
 * Each category owns one bit of the 4-bit card code.
 */
public enum Category {
    RED("red", 8),
    BLUE("blue", 4),
    GREEN("green", 2),
    GOLD("gold", 1);

    private final String symbol;
    private final int bit;

    Category(String symbol, int bit) {
        this.symbol = symbol;
        this.bit = bit;
    }

    public String symbol() {
        return symbol;
    }

    public int bit() {
        return bit;
    }

    /**
     * Look up a category by its lower-case symbol.
     */
    public static Optional<Category> fromSymbol(String symbol) {
        for (Category category : values()) {
            if (category.symbol.equalsIgnoreCase(symbol)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
