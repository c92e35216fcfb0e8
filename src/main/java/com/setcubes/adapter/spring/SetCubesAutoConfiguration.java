package com.setcubes.adapter.spring;

import com.setcubes.config.ConfigLoader;
import com.setcubes.config.EngineConfig;
import com.setcubes.core.SetCubesEngine;
import com.setcubes.core.SetCubesEngineFactory;
import com.setcubes.solver.BatchSolvabilityChecker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for SetCubes.
 */
@Configuration
@ConditionalOnProperty(prefix = "setcubes", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SetCubesProperties.class)
public class SetCubesAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SetCubesAutoConfiguration.class);

    private BatchSolvabilityChecker batchChecker;

    @Bean
    @ConditionalOnMissingBean
    public EngineConfig setCubesConfig(SetCubesProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public SetCubesEngine setCubesEngine(EngineConfig config) {
        return SetCubesEngineFactory.create(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchSolvabilityChecker batchSolvabilityChecker(SetCubesEngine engine, EngineConfig config) {
        log.info("Creating BatchSolvabilityChecker with {} thread(s)", config.batch().threads());
        this.batchChecker = new BatchSolvabilityChecker(engine.search(), engine.budget(), config.batch().threads());
        return this.batchChecker;
    }

    @PreDestroy
    public void shutdown() {
        if (batchChecker != null && !batchChecker.isShutdown()) {
            log.info("Shutting down BatchSolvabilityChecker");
            batchChecker.shutdown();
        }
    }
}
