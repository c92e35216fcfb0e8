package com.setcubes.evaluation;

import com.setcubes.card.CardSet;

/**
 * Outcome of evaluating a line: a set of card indices, or invalid.
 * Invalid is an ordinary value, used by callers to suppress highlighting or block submission.
 */
public final class EvaluationResult {

    private static final EvaluationResult INVALID = new EvaluationResult(false, CardSet.empty());

    private final boolean valid;
    private final CardSet cards;

    private EvaluationResult(boolean valid, CardSet cards) {
        this.valid = valid;
        this.cards = cards;
    }

    public static EvaluationResult of(CardSet cards) {
        return new EvaluationResult(true, cards);
    }

    public static EvaluationResult invalid() {
        return INVALID;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * Matched cards; empty for an invalid result.
     */
    public CardSet cards() {
        return cards;
    }

    public boolean hasSize(int count) {
        return valid && cards.size() == count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvaluationResult other)) return false;
        return valid == other.valid && cards.equals(other.cards);
    }

    @Override
    public int hashCode() {
        return valid ? cards.hashCode() : -1;
    }

    @Override
    public String toString() {
        return valid ? "EvaluationResult" + cards : "EvaluationResult{invalid}";
    }
}
