package com.setcubes.solver;

import com.setcubes.exception.IntegrationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SearchBudgetTest {

    @Test
    @DisplayName("Should stop after the maximum number of steps")
    void shouldStopAfterMaxSteps() {
        SearchBudget.Tracker tracker = SearchBudget.ofSteps(3).start();

        assertTrue(tracker.tryStep());
        assertTrue(tracker.tryStep());
        assertTrue(tracker.tryStep());
        assertFalse(tracker.exhausted());
        assertFalse(tracker.tryStep());
        assertTrue(tracker.exhausted());
        assertEquals(3, tracker.steps());
        assertFalse(tracker.tryStep());
    }

    @Test
    @DisplayName("Should stop once the deadline has passed")
    void shouldStopAfterDeadline() throws InterruptedException {
        SearchBudget.Tracker tracker = SearchBudget.ofTimeout(Duration.ofMillis(1)).start();
        Thread.sleep(20);

        int steps = 0;
        while (tracker.tryStep() && steps < 10_000) {
            steps++;
        }

        assertTrue(tracker.exhausted());
        assertTrue(tracker.steps() <= 256);
    }

    @Test
    @DisplayName("Trackers should be independent")
    void trackersShouldBeIndependent() {
        SearchBudget budget = SearchBudget.ofSteps(1);
        SearchBudget.Tracker first = budget.start();
        assertTrue(first.tryStep());
        assertFalse(first.tryStep());

        assertTrue(budget.start().tryStep());
    }

    @Test
    @DisplayName("Should reject non-positive limits")
    void shouldRejectNonPositiveLimits() {
        assertThrows(IntegrationException.class, () -> SearchBudget.ofSteps(0));
        assertThrows(IntegrationException.class, () -> SearchBudget.ofTimeout(Duration.ZERO));
        assertTrue(SearchBudget.unlimited().isUnlimited());
        assertFalse(SearchBudget.ofSteps(10).isUnlimited());
    }
}
