package com.setcubes.card;

import com.setcubes.exception.IntegrationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The eight cards dealt for one round.
 * <p>
 * Category membership is precomputed once per universe, so evaluation only ever
 * combines {@link CardSet} masks.
 */
public final class Universe {

    public static final int SIZE = 8;

    private final List<Card> cards;
    private final Map<Category, CardSet> byCategory;

    private Universe(List<Card> cards) {
        this.cards = Collections.unmodifiableList(cards);
        this.byCategory = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            int mask = 0;
            for (Card card : cards) {
                if (card.has(category)) {
                    mask |= 1 << card.index();
                }
            }
            byCategory.put(category, CardSet.fromMask(mask));
        }
    }

    /**
     * Build a universe from eight 4-bit card codes.
     *
     * @param codes card codes in deal order
     * @return universe
     * @throws IntegrationException if there are not exactly eight codes
     */
    public static Universe of(int... codes) {
        if (codes == null || codes.length != SIZE) {
            throw new IntegrationException("Universe must hold exactly " + SIZE + " cards, got "
                    + (codes == null ? 0 : codes.length));
        }
        List<Card> cards = new ArrayList<>(SIZE);
        for (int i = 0; i < codes.length; i++) {
            cards.add(new Card(i, codes[i]));
        }
        return new Universe(cards);
    }

    public static Universe of(List<Integer> codes) {
        if (codes == null) {
            throw new IntegrationException("Universe card codes cannot be null");
        }
        return of(codes.stream().mapToInt(Integer::intValue).toArray());
    }

    public Card card(int index) {
        return cards.get(index);
    }

    public List<Card> cards() {
        return cards;
    }

    /**
     * All indices of cards carrying the category.
     */
    public CardSet cardsWith(Category category) {
        return byCategory.get(category);
    }

    public CardSet all() {
        return CardSet.all();
    }

    public int[] codes() {
        return cards.stream().mapToInt(Card::code).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Universe other)) return false;
        return cards.equals(other.cards);
    }

    @Override
    public int hashCode() {
        return cards.hashCode();
    }

    @Override
    public String toString() {
        return "Universe" + cards.stream().map(Card::code).toList();
    }
}
