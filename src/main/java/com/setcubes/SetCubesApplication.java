package com.setcubes;

import com.setcubes.config.EngineConfig;
import com.setcubes.config.ScenarioConfig;
import com.setcubes.core.Puzzle;
import com.setcubes.core.SetCubesEngine;
import com.setcubes.solver.BatchSolvabilityChecker;
import com.setcubes.solver.SearchOutcome;
import com.setcubes.solver.ShortestSolution;
import com.setcubes.spring.EnableSetCubes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application that checks the configured scenarios.
 */
@SpringBootApplication
@EnableSetCubes
public class SetCubesApplication {

    private static final Logger log = LoggerFactory.getLogger(SetCubesApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SetCubesApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(EngineConfig config, SetCubesEngine engine, BatchSolvabilityChecker checker) {
        return args -> {
            log.info("=== SetCubes Demo Started ===");

            List<Puzzle> puzzles = config.scenarios().stream()
                    .map(ScenarioConfig::toPuzzle)
                    .toList();
            List<SearchOutcome> outcomes = checker.check(puzzles);

            for (int i = 0; i < puzzles.size(); i++) {
                ScenarioConfig scenario = config.scenarios().get(i);
                ShortestSolution shortest = engine.shortestSolution(puzzles.get(i));
                log.info("Scenario {}: goal {}, {} -> {}", scenario.id(), scenario.goal(), outcomes.get(i),
                        shortest.solution().map(Object::toString).orElse("no hint"));
            }

            log.info("=== All Scenarios Checked ===");
        };
    }
}
