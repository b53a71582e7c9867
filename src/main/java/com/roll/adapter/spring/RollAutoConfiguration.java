package com.roll.adapter.spring;

import com.roll.config.ConfigLoader;
import com.roll.config.RollConfig;
import com.roll.core.DiceTaskSource;
import com.roll.core.TaskSource;
import com.roll.strategy.StrategyRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for roll runs.
 */
@Configuration
@ConditionalOnProperty(prefix = "roll", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RollProperties.class)
public class RollAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RollAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public RollConfig rollConfig(RollProperties properties) {
        RollConfig config = ConfigLoader.load(properties.getConfigPath())
                .withOverrides(properties.getTaskCount(), properties.getPoolSize());
        ConfigLoader.validate(config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskSource taskSource(RollConfig config) {
        log.info("Creating DiceTaskSource: d{} with {}ms latency",
                config.dice().sides(), config.dice().latencyMs());
        return new DiceTaskSource(config.dice());
    }

    @Bean
    @ConditionalOnMissingBean
    public StrategyRunner strategyRunner(RollConfig config, TaskSource taskSource) {
        return new StrategyRunner(config, taskSource);
    }
}
