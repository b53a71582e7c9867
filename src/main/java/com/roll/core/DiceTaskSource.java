package com.roll.core;

import com.roll.config.DiceConfig;
import com.roll.exception.TaskInvocationException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rolls a die with a simulated per-roll latency, standing in for a remote call.
 * Uses {@link ThreadLocalRandom} so concurrent callers share no generator state.
 */
public class DiceTaskSource implements TaskSource {

    private final int sides;
    private final Duration latency;

    public DiceTaskSource(int sides, Duration latency) {
        if (sides <= 0) {
            throw new IllegalArgumentException("Die must have at least one side: " + sides);
        }
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("Latency must be zero or positive: " + latency);
        }
        this.sides = sides;
        this.latency = latency;
    }

    public DiceTaskSource(DiceConfig config) {
        this(config.sides(), config.latency());
    }

    @Override
    public int roll() {
        if (!latency.isZero()) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskInvocationException("Interrupted while rolling", e);
            }
        }
        return ThreadLocalRandom.current().nextInt(1, sides + 1);
    }

    public int getSides() {
        return sides;
    }

    public Duration getLatency() {
        return latency;
    }
}
