package com.setcubes.core;

import com.setcubes.card.Universe;
import com.setcubes.config.EngineConfig;
import com.setcubes.config.ScenarioConfig;
import com.setcubes.config.notation.TokenNotation;
import com.setcubes.evaluation.BoardResult;
import com.setcubes.exception.IntegrationException;
import com.setcubes.solver.SearchOutcome;
import com.setcubes.token.PlacedToken;
import com.setcubes.token.Token;
import com.setcubes.token.TokenPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SetCubesEngineTest {

    // red {4,5,6,7}, green {1,5,7}
    private static final Universe UNIVERSE = Universe.of(1, 2, 4, 5, 8, 10, 12, 14);

    private SetCubesEngine engine;

    @BeforeEach
    void setUp() {
        engine = SetCubesEngineFactory.create(EngineConfig.defaults());
    }

    private static Token token(String notation) {
        return TokenNotation.parseTokens(notation).get(0);
    }

    @Test
    @DisplayName("Token placement should decide the grouping on the board")
    void placementShouldDecideGrouping() {
        Puzzle puzzle = new Puzzle(UNIVERSE,
                TokenPool.of(TokenNotation.parseTokens("green ∪ red ∩ red"), false), 5);

        List<PlacedToken> spread = List.of(
                PlacedToken.at(token("green"), 0, 0),
                PlacedToken.at(token("∪"), 200, 0),
                PlacedToken.at(token("red"), 400, 0),
                PlacedToken.at(token("∩"), 600, 0),
                PlacedToken.at(token("red"), 800, 0));
        List<PlacedToken> clustered = List.of(
                PlacedToken.at(token("green"), 0, 0),
                PlacedToken.at(token("∪"), 200, 0),
                PlacedToken.at(token("red"), 400, 0),
                PlacedToken.at(token("∩"), 480, 0),
                PlacedToken.at(token("red"), 560, 0));

        BoardResult flat = engine.evaluateBoard(puzzle, List.of(), spread);
        BoardResult grouped = engine.evaluateBoard(puzzle, List.of(), clustered);

        assertEquals(4, flat.matches().size());
        assertEquals(5, grouped.matches().size());
        assertFalse(engine.isSolved(puzzle, List.of(), spread));
        assertTrue(engine.isSolved(puzzle, List.of(), clustered));
    }

    @Test
    @DisplayName("Board evaluation should reject tokens the pool does not hold")
    void boardShouldRejectForeignTokens() {
        Puzzle puzzle = new Puzzle(UNIVERSE, TokenPool.of(TokenNotation.parseTokens("red"), false), 4);

        assertThrows(IntegrationException.class, () -> engine.evaluateBoard(puzzle, List.of(),
                List.of(PlacedToken.at(token("blue"), 0, 0))));
    }

    @Test
    @DisplayName("Solvability queries should run under the configured budget")
    void queriesShouldUseBudget() {
        Puzzle puzzle = new ScenarioConfig("union", List.of(1, 2, 3, 4, 5, 8, 9, 10),
                "red blue ∪ green", 5, false, null).toPuzzle();

        assertEquals(SearchOutcome.FOUND, engine.existsSolution(puzzle));
        assertEquals(3, engine.shortestSolution(puzzle).length().getAsInt());
        assertEquals("red ∪ blue", engine.findSolution(puzzle).orElseThrow().setName().notation());
        assertTrue(engine.solutionStats(puzzle).complete());
        assertFalse(engine.budget().isUnlimited());
    }
}
