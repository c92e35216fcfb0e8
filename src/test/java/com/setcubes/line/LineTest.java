package com.setcubes.line;

import com.setcubes.config.notation.TokenNotation;
import com.setcubes.exception.IntegrationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineTest {

    @Test
    @DisplayName("Notation should bracket multi-token groups")
    void notationShouldBracketGroups() {
        Line line = TokenNotation.setName("[red ∪ blue] ∩ green ′");

        assertEquals("[red ∪ blue] ∩ green ′", line.notation());
        assertEquals("SET_NAME([red ∪ blue] ∩ green ′)", line.toString());
    }

    @Test
    @DisplayName("Sub-lines should carry their own grouping")
    void subLineShouldCarryGrouping() {
        Line line = TokenNotation.restriction("[red ∪ blue] ⊆ green");

        Line left = line.sub(0, 3).orElseThrow();
        assertEquals(LineRole.RESTRICTION, left.role());
        assertEquals(GroupPartition.of(0, 0, 0), left.partition());
        assertTrue(line.sub(0, 2).isEmpty());
    }

    @Test
    @DisplayName("Partition must cover every token")
    void partitionMustCoverTokens() {
        Line line = TokenNotation.setName("red ∪ blue");

        assertThrows(IntegrationException.class,
                () -> new Line(LineRole.SET_NAME, line.tokens(), GroupPartition.singletons(2)));
        assertEquals(GroupPartition.singletons(3), new Line(LineRole.SET_NAME, line.tokens(), null).partition());
        assertTrue(Line.empty(LineRole.SET_NAME).isEmpty());
        assertEquals(List.of(), Line.empty(LineRole.RESTRICTION).tokens());
    }
}
