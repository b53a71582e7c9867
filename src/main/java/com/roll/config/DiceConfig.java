package com.roll.config;

import java.time.Duration;

/**
 * Configuration for the default dice task source.
 *
 * @param sides     Number of sides of the die
 * @param latencyMs Simulated latency of one roll in milliseconds
 */
public record DiceConfig(
        int sides,
        long latencyMs
) {
    public static DiceConfig defaults() {
        return new DiceConfig(6, 100);
    }

    public Duration latency() {
        return Duration.ofMillis(latencyMs);
    }
}
