package com.setcubes.config;

import java.util.List;
import java.util.Optional;

/**
 * Root configuration for the SetCubes engine.
 *
 * @param name      engine name, used in log lines
 * @param version   configuration version
 * @param grouping  touch detection geometry
 * @param search    default solver budget
 * @param batch     batch checker sizing
 * @param scenarios predefined rounds
 */
public record EngineConfig(
        String name,
        String version,
        GroupingConfig grouping,
        SearchConfig search,
        BatchConfig batch,
        List<ScenarioConfig> scenarios
) {
    public EngineConfig {
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
    }

    /**
     * Find a scenario by id.
     */
    public Optional<ScenarioConfig> scenario(String id) {
        return scenarios.stream()
                .filter(s -> s.id().equals(id))
                .findFirst();
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
                "setcubes",
                "1.0",
                GroupingConfig.defaults(),
                SearchConfig.defaults(),
                BatchConfig.defaults(),
                List.of()
        );
    }
}
