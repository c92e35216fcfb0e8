package com.setcubes.syntax;

import com.setcubes.config.notation.TokenNotation;
import com.setcubes.line.GroupPartition;
import com.setcubes.line.Line;
import com.setcubes.line.LineRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxValidatorTest {

    private final SyntaxValidator validator = new SyntaxValidator();

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Should validate set expressions")
    @CsvSource({
            "red,                    true",
            "U,                      true",
            "∅,                      true",
            "red ∪ blue,             true",
            "red ∪ blue ∩ green − U, true",
            "red ′,                  true",
            "red ′ ′ ∩ blue ′,       true",
            "red ?∪ blue,            true",
            "red ?′,                 true",
            "red ∪,                  false",
            "∪ red,                  false",
            "red blue,               false",
            "′ red,                  false",
            "red ∪ ∩ blue,           false",
            "red ⊆ blue,             false",
            "red ?,                  false",
            "red ? blue,             false"
    })
    void shouldValidateExpressions(String notation, boolean expected) {
        assertEquals(expected, validator.isValidExpression(TokenNotation.parseTokens(notation)));
        assertEquals(expected, validator.isValid(TokenNotation.setName(notation)));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Groups must be valid on their own and as one operand")
    @CsvSource({
            "[red ∪ blue] ∩ green,       true",
            "green ∪ [red ∩ red],        true",
            "[red ∪ blue] ′,             true",
            "[red],                      true",
            "[red ∪] blue,               false",
            "red [∪ blue],               false",
            "[red ∪ blue] green,         false",
            "[red ∪ blue] [green ∩ red], false"
    })
    void shouldValidateGroups(String notation, boolean expected) {
        assertEquals(expected, validator.isValidExpression(TokenNotation.setName(notation)));
    }

    @Test
    @DisplayName("Non-contiguous groups are validated by membership")
    void nonContiguousGroupsAreValidatedByMembership() {
        // red and blue touch around the ∪ between them: [red · blue] is not an expression
        Line line = new Line(LineRole.SET_NAME,
                TokenNotation.parseTokens("red ∪ blue"), GroupPartition.of(0, 1, 0));

        assertFalse(validator.isValidExpression(line));
    }

    @Test
    @DisplayName("The empty set-name line is valid")
    void emptyLineIsValid() {
        assertTrue(validator.isValidExpression(Line.empty(LineRole.SET_NAME)));
        assertTrue(validator.isValidExpression(List.of()));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Should validate restriction lines")
    @CsvSource({
            "red ⊆ blue,                  true",
            "red = blue,                  true",
            "[red ∪ blue] ⊆ green ′,      true",
            "red ∪ gold ⊆ U,              true",
            "red ⊆,                       false",
            "⊆ red,                       false",
            "red ∪ blue,                  false",
            "red ⊆ blue = green,          false",
            "[red ⊆ blue],                false",
            "[red ⊆] blue,                false",
            "red ∪ ⊆ blue,                false"
    })
    void shouldValidateRestrictions(String notation, boolean expected) {
        assertEquals(expected, validator.isValid(TokenNotation.restriction(notation)));
    }

    @Test
    @DisplayName("Should locate the restriction operator")
    void shouldLocateRestrictionOperator() {
        assertEquals(3, validator.restrictionPosition(TokenNotation.restriction("[red ∪ blue] = green")).getAsInt());
        assertTrue(validator.restrictionPosition(TokenNotation.restriction("red ∪ blue")).isEmpty());
        assertFalse(validator.isValidRestriction(Line.empty(LineRole.RESTRICTION)));
    }
}
