package com.setcubes.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for SetCubes.
 */
@ConfigurationProperties(prefix = "setcubes")
public class SetCubesProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the engine configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:setcubes.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
