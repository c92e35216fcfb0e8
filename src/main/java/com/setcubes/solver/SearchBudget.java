package com.setcubes.solver;

import com.setcubes.exception.IntegrationException;

import java.time.Duration;

/**
 * Limits on how much work a single search may do.
 *
 * @param maxSteps maximum number of candidate evaluations
 * @param timeout  wall-clock limit, or null for none
 */
public record SearchBudget(long maxSteps, Duration timeout) {

    private static final SearchBudget UNLIMITED = new SearchBudget(Long.MAX_VALUE, null);

    public SearchBudget {
        if (maxSteps <= 0) {
            throw new IntegrationException("maxSteps must be positive, got " + maxSteps);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IntegrationException("timeout must be positive, got " + timeout);
        }
    }

    public static SearchBudget unlimited() {
        return UNLIMITED;
    }

    public static SearchBudget ofSteps(long maxSteps) {
        return new SearchBudget(maxSteps, null);
    }

    public static SearchBudget ofTimeout(Duration timeout) {
        return new SearchBudget(Long.MAX_VALUE, timeout);
    }

    public boolean isUnlimited() {
        return maxSteps == Long.MAX_VALUE && timeout == null;
    }

    /**
     * Start tracking one search. Trackers belong to a single call and thread.
     */
    public Tracker start() {
        long deadline = timeout == null ? 0 : System.nanoTime() + timeout.toNanos();
        return new Tracker(maxSteps, timeout != null, deadline);
    }

    /**
     * Per-call step counter.
     */
    public static final class Tracker {

        // Clock is read once every this many steps
        private static final int CLOCK_MASK = 0xFF;

        private final long maxSteps;
        private final boolean hasDeadline;
        private final long deadlineNanos;
        private long steps;
        private boolean exhausted;

        private Tracker(long maxSteps, boolean hasDeadline, long deadlineNanos) {
            this.maxSteps = maxSteps;
            this.hasDeadline = hasDeadline;
            this.deadlineNanos = deadlineNanos;
        }

        /**
         * Account for one more evaluation.
         *
         * @return false once the budget is used up
         */
        public boolean tryStep() {
            if (exhausted) {
                return false;
            }
            if (steps >= maxSteps
                    || (hasDeadline && (steps & CLOCK_MASK) == 0 && System.nanoTime() - deadlineNanos >= 0)) {
                exhausted = true;
                return false;
            }
            steps++;
            return true;
        }

        public long steps() {
            return steps;
        }

        public boolean exhausted() {
            return exhausted;
        }
    }
}
