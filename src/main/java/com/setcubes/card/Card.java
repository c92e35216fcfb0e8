package com.setcubes.card;

import com.setcubes.exception.IntegrationException;

import java.util.EnumSet;
import java.util.Set;

/**
 * A single card of the universe.
 *
 * @param index position of the card within its universe (0..7)
 * @param code  4-bit category code: 8 = red, 4 = blue, 2 = green, 1 = gold
 */
public record Card(int index, int code) {

    public static final int MAX_CODE = 15;

    public Card {
        if (index < 0 || index >= Universe.SIZE) {
            throw new IntegrationException("Card index out of range: " + index);
        }
        if (code < 0 || code > MAX_CODE) {
            throw new IntegrationException("Card code out of range: " + code);
        }
    }

    public boolean has(Category category) {
        return (code & category.bit()) != 0;
    }

    public Set<Category> categories() {
        Set<Category> categories = EnumSet.noneOf(Category.class);
        for (Category category : Category.values()) {
            if (has(category)) {
                categories.add(category);
            }
        }
        return categories;
    }

    @Override
    public String toString() {
        return "Card#" + index + categories();
    }
}
