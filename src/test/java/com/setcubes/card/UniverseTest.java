package com.setcubes.card;

import com.setcubes.exception.IntegrationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UniverseTest {

    private final Universe universe = Universe.of(1, 2, 3, 4, 5, 8, 9, 10);

    @ParameterizedTest
    @DisplayName("Should index cards by category bit")
    @CsvSource({
            "red,   5 6 7",
            "blue,  3 4",
            "green, 1 2 7",
            "gold,  0 2 4 6"
    })
    void shouldIndexByCategory(String symbol, String indices) {
        Category category = Category.fromSymbol(symbol).orElseThrow();
        int[] expected = Arrays.stream(indices.trim().split(" "))
                .mapToInt(Integer::parseInt)
                .toArray();

        assertEquals(CardSet.of(expected), universe.cardsWith(category));
    }

    @Test
    @DisplayName("Should decode card categories from the 4-bit code")
    void shouldDecodeCategories() {
        Card card = new Card(0, 15);
        assertEquals(EnumSet.allOf(Category.class), card.categories());

        Card redGreen = new Card(1, 10);
        assertEquals(EnumSet.of(Category.RED, Category.GREEN), redGreen.categories());
        assertTrue(new Card(2, 0).categories().isEmpty());
    }

    @Test
    @DisplayName("Should require exactly eight valid card codes")
    void shouldRequireEightCards() {
        assertThrows(IntegrationException.class, () -> Universe.of(1, 2, 3));
        assertThrows(IntegrationException.class, () -> Universe.of(1, 2, 3, 4, 5, 6, 7, 16));
        assertThrows(IntegrationException.class, () -> Universe.of((List<Integer>) null));
    }

    @Test
    @DisplayName("Universes with the same codes should be equal")
    void shouldCompareByCodes() {
        Universe same = Universe.of(List.of(1, 2, 3, 4, 5, 8, 9, 10));

        assertEquals(universe, same);
        assertArrayEquals(new int[]{1, 2, 3, 4, 5, 8, 9, 10}, same.codes());
        assertEquals(CardSet.all(), universe.all());
    }
}
