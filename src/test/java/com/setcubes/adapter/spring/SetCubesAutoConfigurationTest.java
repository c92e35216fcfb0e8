package com.setcubes.adapter.spring;

import com.setcubes.config.BatchConfig;
import com.setcubes.config.EngineConfig;
import com.setcubes.config.GroupingConfig;
import com.setcubes.config.ScenarioConfig;
import com.setcubes.config.SearchConfig;
import com.setcubes.core.SetCubesEngine;
import com.setcubes.exception.ConfigurationException;
import com.setcubes.solver.BatchSolvabilityChecker;
import com.setcubes.solver.SearchOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SetCubesAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SetCubesAutoConfiguration.class))
            .withPropertyValues("setcubes.config-path=classpath:setcubes-test.yaml");

    @Test
    @DisplayName("Should create the engine from the configured file")
    void shouldCreateEngine() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(SetCubesEngine.class));
            assertNotNull(context.getBean(BatchSolvabilityChecker.class));

            EngineConfig config = context.getBean(EngineConfig.class);
            assertEquals("setcubes-test", config.name());
            assertEquals(50_000, context.getBean(SetCubesEngine.class).budget().maxSteps());
        });
    }

    @Test
    @DisplayName("Configured scenarios should be checkable in a batch")
    void shouldCheckScenarios() {
        contextRunner.run(context -> {
            EngineConfig config = context.getBean(EngineConfig.class);
            BatchSolvabilityChecker checker = context.getBean(BatchSolvabilityChecker.class);

            List<SearchOutcome> outcomes = checker.check(config.scenarios().stream()
                    .map(ScenarioConfig::toPuzzle)
                    .toList());

            assertEquals(List.of(SearchOutcome.FOUND, SearchOutcome.NOT_FOUND, SearchOutcome.FOUND), outcomes);
        });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("setcubes.enabled=false").run(context -> {
            assertTrue(context.getBeansOfType(SetCubesEngine.class).isEmpty());
            assertTrue(context.getBeansOfType(EngineConfig.class).isEmpty());
        });
    }

    @Test
    @DisplayName("Should prefer a user-supplied configuration")
    void shouldPreferUserConfiguration() {
        contextRunner.withUserConfiguration(CustomConfig.class).run(context -> {
            assertEquals("custom", context.getBean(EngineConfig.class).name());
            assertNotNull(context.getBean(SetCubesEngine.class));
        });
    }

    @Test
    @DisplayName("Should fail to start on a missing configuration file")
    void shouldFailOnMissingFile() {
        contextRunner.withPropertyValues("setcubes.config-path=classpath:missing.yaml").run(context -> {
            assertNotNull(context.getStartupFailure());
            Throwable root = context.getStartupFailure();
            while (root.getCause() != null && !(root instanceof ConfigurationException)) {
                root = root.getCause();
            }
            assertInstanceOf(ConfigurationException.class, root);
        });
    }

    @Test
    @DisplayName("Should shut the batch checker down with the context")
    void shouldShutDownWithContext() {
        AtomicReference<BatchSolvabilityChecker> checker = new AtomicReference<>();

        contextRunner.run(context -> checker.set(context.getBean(BatchSolvabilityChecker.class)));

        assertTrue(checker.get().isShutdown());
    }

    @Configuration
    static class CustomConfig {

        @Bean
        EngineConfig customEngineConfig() {
            return new EngineConfig("custom", "0.1", GroupingConfig.defaults(), SearchConfig.defaults(),
                    new BatchConfig(1), List.of());
        }
    }
}
