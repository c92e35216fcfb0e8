package com.setcubes.config;

import com.setcubes.card.Universe;
import com.setcubes.config.notation.TokenNotation;
import com.setcubes.core.Puzzle;
import com.setcubes.exception.ConfigurationException;
import com.setcubes.exception.IntegrationException;
import com.setcubes.token.Token;
import com.setcubes.token.TokenPool;

import java.util.List;

/**
 * A predefined round.
 *
 * @param id           unique scenario id
 * @param cards        the eight card codes
 * @param pool         token pool in token notation
 * @param goal         number of cards to match
 * @param restrictions whether restriction operators may be played
 * @param required     token every solution must use, in token notation, or null
 */
public record ScenarioConfig(
        String id,
        List<Integer> cards,
        String pool,
        int goal,
        boolean restrictions,
        String required
) {
    public ScenarioConfig {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Scenario id is required");
        }
        cards = cards == null ? List.of() : List.copyOf(cards);
    }

    /**
     * Build the puzzle this scenario describes.
     *
     * @throws ConfigurationException if the notation or the round data is malformed
     */
    public Puzzle toPuzzle() {
        try {
            TokenPool.Builder builder = TokenPool.builder()
                    .tokens(TokenNotation.parseTokens(pool))
                    .restrictionsEnabled(restrictions);
            if (required != null && !required.isBlank()) {
                List<Token> parsed = TokenNotation.parseTokens(required);
                if (parsed.size() != 1) {
                    throw new ConfigurationException("Scenario '" + id + "' must name exactly one required token");
                }
                builder.required(parsed.get(0));
            }
            return new Puzzle(Universe.of(cards), builder.build(), goal);
        } catch (IntegrationException e) {
            throw new ConfigurationException("Invalid scenario '" + id + "': " + e.getMessage(), e);
        }
    }
}
