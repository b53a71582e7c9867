package com.roll.config;

import com.roll.strategy.StrategyType;

import java.util.List;

/**
 * Root configuration for a sequence of strategy runs.
 *
 * @param name             Configuration name, used in logs
 * @param taskCount        Number of tasks per run (N)
 * @param poolSize         Worker count for the bounded pool strategy (P)
 * @param threadNamePrefix Prefix for threads created by strategies
 * @param dice             Dice task source configuration
 * @param strategies       Strategies to run, in order
 */
public record RollConfig(
        String name,
        int taskCount,
        int poolSize,
        String threadNamePrefix,
        DiceConfig dice,
        List<StrategyType> strategies
) {
    public static final int DEFAULT_TASK_COUNT = 100;
    public static final int DEFAULT_POOL_SIZE = 10;
    public static final String DEFAULT_THREAD_NAME_PREFIX = "roll-";

    public RollConfig {
        strategies = List.copyOf(strategies);
    }

    /**
     * Default run: 100 rolls, 10 workers, every strategy.
     */
    public static RollConfig defaults() {
        return new RollConfig(
                "default-rolls",
                DEFAULT_TASK_COUNT,
                DEFAULT_POOL_SIZE,
                DEFAULT_THREAD_NAME_PREFIX,
                DiceConfig.defaults(),
                List.of(StrategyType.values())
        );
    }

    /**
     * Copy with task count and pool size replaced where an override is given.
     */
    public RollConfig withOverrides(Integer taskCountOverride, Integer poolSizeOverride) {
        return new RollConfig(
                name,
                taskCountOverride != null ? taskCountOverride : taskCount,
                poolSizeOverride != null ? poolSizeOverride : poolSize,
                threadNamePrefix,
                dice,
                strategies
        );
    }
}
