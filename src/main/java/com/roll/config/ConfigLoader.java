package com.roll.config;

import com.roll.exception.ConfigurationException;
import com.roll.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads roll configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RollConfig load(String path) {
        log.info("Loading roll configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static RollConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(document, "configuration root");

        // The roll section may sit at the root or under a 'roll' key
        Map<String, Object> rollConfig = root.containsKey("roll")
                ? asMap(root.get("roll"), "roll")
                : root;

        String name = getString(rollConfig, "name", "default-rolls");
        int taskCount = getInt(rollConfig, "task-count", RollConfig.DEFAULT_TASK_COUNT);
        int poolSize = getInt(rollConfig, "pool-size", RollConfig.DEFAULT_POOL_SIZE);
        String threadNamePrefix = getString(rollConfig, "thread-name-prefix",
                RollConfig.DEFAULT_THREAD_NAME_PREFIX);
        DiceConfig dice = parseDiceConfig(rollConfig.get("dice"));
        List<StrategyType> strategies = parseStrategies(rollConfig.get("strategies"));

        RollConfig config = new RollConfig(name, taskCount, poolSize, threadNamePrefix, dice, strategies);
        validate(config);

        log.info("Loaded roll configuration: {} with {} tasks, pool size {}, {} strategies, d{} at {}ms",
                name, taskCount, poolSize, strategies.size(), dice.sides(), dice.latencyMs());

        return config;
    }

    private static DiceConfig parseDiceConfig(Object section) {
        if (section == null) {
            return DiceConfig.defaults();
        }
        Map<String, Object> map = asMap(section, "dice");
        DiceConfig defaults = DiceConfig.defaults();
        return new DiceConfig(
                getInt(map, "sides", defaults.sides()),
                getLong(map, "latency-ms", defaults.latencyMs())
        );
    }

    private static List<StrategyType> parseStrategies(Object section) {
        if (section == null) {
            return List.of(StrategyType.values());
        }
        if (!(section instanceof List<?> list)) {
            throw new ConfigurationException("Expected a list for 'strategies': " + section);
        }
        if (list.isEmpty()) {
            return List.of(StrategyType.values());
        }
        List<StrategyType> strategies = new ArrayList<>();
        for (Object item : list) {
            if (item == null) {
                throw new ConfigurationException("Empty entry in 'strategies'");
            }
            String typeStr = item.toString().trim().toUpperCase().replace("-", "_");
            try {
                strategies.add(StrategyType.valueOf(typeStr));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown strategy '" + item + "'", e);
            }
        }
        return strategies;
    }

    /**
     * Fail fast on values no strategy can run with.
     */
    public static void validate(RollConfig config) {
        if (config.taskCount() < 0) {
            throw new ConfigurationException("task-count must be zero or positive: " + config.taskCount());
        }
        if (config.poolSize() <= 0) {
            throw new ConfigurationException("pool-size must be positive: " + config.poolSize());
        }
        if (config.dice().sides() <= 0) {
            throw new ConfigurationException("dice.sides must be positive: " + config.dice().sides());
        }
        if (config.dice().latencyMs() < 0) {
            throw new ConfigurationException(
                    "dice.latency-ms must be zero or positive: " + config.dice().latencyMs());
        }
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Expected a mapping for '" + key + "': " + value);
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for '" + key + "': " + value, e);
        }
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for '" + key + "': " + value, e);
        }
    }
}
