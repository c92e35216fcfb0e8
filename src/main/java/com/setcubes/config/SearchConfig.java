package com.setcubes.config;

import com.setcubes.exception.ConfigurationException;
import com.setcubes.solver.SearchBudget;

import java.time.Duration;

/**
 * Budget applied to interactive solvability checks.
 *
 * @param maxSteps  candidate evaluations allowed per query, 0 for no limit
 * @param timeoutMs wall-clock limit per query, 0 for no limit
 */
public record SearchConfig(long maxSteps, long timeoutMs) {

    public SearchConfig {
        if (maxSteps < 0 || timeoutMs < 0) {
            throw new ConfigurationException("search limits cannot be negative");
        }
    }

    public static SearchConfig defaults() {
        return new SearchConfig(2_000_000, 2_000);
    }

    public SearchBudget toBudget() {
        long steps = maxSteps == 0 ? Long.MAX_VALUE : maxSteps;
        Duration timeout = timeoutMs == 0 ? null : Duration.ofMillis(timeoutMs);
        return new SearchBudget(steps, timeout);
    }
}
