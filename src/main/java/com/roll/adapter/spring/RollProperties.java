package com.roll.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for roll runs.
 */
@ConfigurationProperties(prefix = "roll")
public class RollProperties {

    /**
     * Whether the roll beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the roll configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:roll.yaml";

    /**
     * Overrides task-count from the configuration file when set.
     */
    private Integer taskCount;

    /**
     * Overrides pool-size from the configuration file when set.
     */
    private Integer poolSize;

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

    public Integer getTaskCount() {
        return taskCount;
    }

    public void setTaskCount(Integer taskCount) {
        this.taskCount = taskCount;
    }

    public Integer getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(Integer poolSize) {
        this.poolSize = poolSize;
    }
}
