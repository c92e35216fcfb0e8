package com.setcubes.config;

import com.setcubes.exception.ConfigurationException;

/**
 * @param threads worker threads for batch solvability checks
 */
public record BatchConfig(int threads) {

    public BatchConfig {
        if (threads <= 0) {
            throw new ConfigurationException("batch.threads must be positive, got " + threads);
        }
    }

    public static BatchConfig defaults() {
        return new BatchConfig(Math.max(1, Runtime.getRuntime().availableProcessors() / 2));
    }
}
