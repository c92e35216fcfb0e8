package com.setcubes.token;

import com.setcubes.exception.IntegrationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The multiset of tokens available for one round.
 * <p>
 * Tokens are stored in their pool form (wildcards unresolved). Same-valued tokens
 * are interchangeable, which the solver relies on for symmetry reduction.
 */
public final class TokenPool {

    private final List<Token> tokens;
    private final Map<Token, Integer> counts;
    private final boolean restrictionsEnabled;
    private final Token required;

    private TokenPool(Builder builder) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(builder.tokens));
        Map<Token, Integer> tally = new LinkedHashMap<>();
        for (Token token : tokens) {
            tally.merge(token, 1, Integer::sum);
        }
        this.counts = Collections.unmodifiableMap(tally);
        this.restrictionsEnabled = builder.restrictionsEnabled;
        this.required = builder.required;

        if (required != null && !counts.containsKey(required)) {
            throw new IntegrationException("Required token " + required + " is not in the pool " + tokens);
        }
    }

    public static TokenPool of(List<Token> tokens, boolean restrictionsEnabled) {
        return builder().tokens(tokens).restrictionsEnabled(restrictionsEnabled).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Token> tokens() {
        return tokens;
    }

    /**
     * Distinct token values with their multiplicity, in first-seen order.
     */
    public Map<Token, Integer> counts() {
        return counts;
    }

    public int size() {
        return tokens.size();
    }

    public boolean restrictionsEnabled() {
        return restrictionsEnabled;
    }

    /**
     * Token value every solution has to use, if the round sets one.
     */
    public Optional<Token> required() {
        return Optional.ofNullable(required);
    }

    public boolean hasOperand() {
        return tokens.stream().anyMatch(Token::isOperand);
    }

    /**
     * Verify that the given tokens can be drawn from this pool.
     *
     * @param used tokens placed across both lines
     * @throws IntegrationException if a token is absent or used more often than the pool holds
     */
    public void checkUsage(Collection<Token> used) {
        Map<Token, Integer> drawn = new LinkedHashMap<>();
        for (Token token : used) {
            drawn.merge(token.poolForm(), 1, Integer::sum);
        }
        for (Map.Entry<Token, Integer> entry : drawn.entrySet()) {
            int available = counts.getOrDefault(entry.getKey(), 0);
            if (entry.getValue() > available) {
                throw new IntegrationException("Token " + entry.getKey() + " used " + entry.getValue()
                        + " time(s) but the pool holds " + available);
            }
        }
    }

    @Override
    public String toString() {
        return "TokenPool{" +
                "tokens=" + tokens +
                ", restrictionsEnabled=" + restrictionsEnabled +
                (required != null ? ", required=" + required : "") +
                '}';
    }

    public static final class Builder {
        private final List<Token> tokens = new ArrayList<>();
        private boolean restrictionsEnabled;
        private Token required;

        private Builder() {
        }

        public Builder token(Token token) {
            if (token == null) {
                throw new IntegrationException("Pool token cannot be null");
            }
            if (token.isWildcard() && !token.isUnresolved()) {
                throw new IntegrationException("Pool wildcards must be unresolved, got " + token);
            }
            tokens.add(token);
            return this;
        }

        public Builder tokens(Collection<Token> tokens) {
            tokens.forEach(this::token);
            return this;
        }

        public Builder restrictionsEnabled(boolean restrictionsEnabled) {
            this.restrictionsEnabled = restrictionsEnabled;
            return this;
        }

        public Builder required(Token required) {
            this.required = required == null ? null : required.poolForm();
            return this;
        }

        public TokenPool build() {
            return new TokenPool(this);
        }
    }
}
