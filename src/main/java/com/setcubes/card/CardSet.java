package com.setcubes.card;

import com.setcubes.exception.IntegrationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable set of card indices within an eight-card universe.
 * Backed by a bit mask; bit {@code i} set means card {@code i} is a member.
 */
public final class CardSet {

    private static final int FULL_MASK = (1 << Universe.SIZE) - 1;
    private static final CardSet EMPTY = new CardSet(0);
    private static final CardSet ALL = new CardSet(FULL_MASK);

    private final int mask;

    private CardSet(int mask) {
        this.mask = mask;
    }

    public static CardSet empty() {
        return EMPTY;
    }

    public static CardSet all() {
        return ALL;
    }

    public static CardSet of(int... indices) {
        int mask = 0;
        for (int index : indices) {
            if (index < 0 || index >= Universe.SIZE) {
                throw new IntegrationException("Card index out of range: " + index);
            }
            mask |= 1 << index;
        }
        return fromMask(mask);
    }

    public static CardSet fromMask(int mask) {
        if ((mask & ~FULL_MASK) != 0) {
            throw new IntegrationException("Card mask out of range: " + mask);
        }
        if (mask == 0) {
            return EMPTY;
        }
        if (mask == FULL_MASK) {
            return ALL;
        }
        return new CardSet(mask);
    }

    public int mask() {
        return mask;
    }

    public int size() {
        return Integer.bitCount(mask);
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public boolean contains(int index) {
        return index >= 0 && index < Universe.SIZE && (mask & (1 << index)) != 0;
    }

    public CardSet union(CardSet other) {
        return fromMask(mask | other.mask);
    }

    public CardSet intersect(CardSet other) {
        return fromMask(mask & other.mask);
    }

    public CardSet minus(CardSet other) {
        return fromMask(mask & ~other.mask);
    }

    public CardSet symmetricDifference(CardSet other) {
        return fromMask(mask ^ other.mask);
    }

    /**
     * Complement relative to the given active set.
     */
    public CardSet complementWithin(CardSet active) {
        return active.minus(this);
    }

    public List<Integer> indices() {
        List<Integer> indices = new ArrayList<>(size());
        for (int i = 0; i < Universe.SIZE; i++) {
            if (contains(i)) {
                indices.add(i);
            }
        }
        return indices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CardSet other)) return false;
        return mask == other.mask;
    }

    @Override
    public int hashCode() {
        return mask;
    }

    @Override
    public String toString() {
        return indices().toString();
    }
}
