package com.roll.config;

import com.roll.exception.ConfigurationException;
import com.roll.strategy.StrategyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load configuration from classpath")
    void shouldLoadFromClasspath() {
        RollConfig config = ConfigLoader.load("classpath:roll-test.yaml");

        assertEquals("test-rolls", config.name());
        assertEquals(12, config.taskCount());
        assertEquals(3, config.poolSize());
        assertEquals("test-roll-", config.threadNamePrefix());
        assertEquals(new DiceConfig(1, 0), config.dice());
        assertEquals(List.of(StrategyType.BOUNDED_POOL, StrategyType.SEQUENTIAL), config.strategies());
    }

    @Test
    @DisplayName("Should apply defaults for missing keys")
    void shouldApplyDefaults() {
        RollConfig config = ConfigLoader.load("classpath:roll-minimal.yaml");

        assertEquals("minimal-rolls", config.name());
        assertEquals(100, config.taskCount());
        assertEquals(10, config.poolSize());
        assertEquals(DiceConfig.defaults(), config.dice());
        assertEquals(List.of(StrategyType.values()), config.strategies());
    }

    @Test
    @DisplayName("Should load the packaged default configuration")
    void shouldLoadPackagedDefaults() {
        RollConfig config = ConfigLoader.load("classpath:roll.yaml");

        assertEquals(RollConfig.DEFAULT_TASK_COUNT, config.taskCount());
        assertEquals(RollConfig.DEFAULT_POOL_SIZE, config.poolSize());
        assertEquals(100, config.dice().latencyMs());
    }

    @Test
    @DisplayName("Should load configuration from the file system")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("rolls.yaml");
        Files.writeString(file, "roll:\n  task-count: 7\n  pool-size: 2\n");

        RollConfig config = ConfigLoader.load(file.toString());

        assertEquals(7, config.taskCount());
        assertEquals(2, config.poolSize());
    }

    @Test
    @DisplayName("Should fail fast on invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:roll-invalid-pool.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:roll-unknown-strategy.yaml"));
        assertThrows(ConfigurationException.class, () -> parse("roll:\n  task-count: -1\n"));
        assertThrows(ConfigurationException.class, () -> parse("roll:\n  task-count: many\n"));
        assertThrows(ConfigurationException.class, () -> parse("roll:\n  dice:\n    sides: 0\n"));
        assertThrows(ConfigurationException.class, () -> parse("roll:\n  dice:\n    latency-ms: -5\n"));
    }

    @Test
    @DisplayName("Should reject sections of the wrong shape")
    void shouldRejectMalformedSections() {
        ConfigurationException strategies = assertThrows(ConfigurationException.class,
                () -> parse("roll:\n  strategies: SEQUENTIAL\n"));
        assertTrue(strategies.getMessage().contains("'strategies'"));

        ConfigurationException dice = assertThrows(ConfigurationException.class,
                () -> parse("roll:\n  dice: 6\n"));
        assertTrue(dice.getMessage().contains("'dice'"));

        ConfigurationException section = assertThrows(ConfigurationException.class,
                () -> parse("roll:\n"));
        assertTrue(section.getMessage().contains("'roll'"));

        assertThrows(ConfigurationException.class, () -> parse("just-a-string\n"));
        assertThrows(ConfigurationException.class, () -> parse("- SEQUENTIAL\n- BUFFERED\n"));
        assertThrows(ConfigurationException.class, () -> parse("roll:\n  strategies:\n    -\n"));
    }

    @Test
    @DisplayName("Should fail on missing or empty files")
    void shouldRejectMissingOrEmptyFile(@TempDir Path dir) throws Exception {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));

        Path empty = dir.resolve("empty.yaml");
        Files.writeString(empty, "");
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(empty.toString()));
    }

    @Test
    @DisplayName("Should override task count and pool size only where given")
    void shouldApplyOverrides() {
        RollConfig config = RollConfig.defaults().withOverrides(1000, null);

        assertEquals(1000, config.taskCount());
        assertEquals(RollConfig.DEFAULT_POOL_SIZE, config.poolSize());
    }

    private static RollConfig parse(String yaml) {
        return ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
