package com.roll.core;

import com.roll.strategy.StrategyType;

import java.time.Duration;
import java.util.Locale;

/**
 * Outcome of one strategy run.
 *
 * @param strategy         Strategy that produced the report
 * @param elapsed          Wall-clock duration of the run
 * @param taskCount        Number of tasks run (N)
 * @param sum              Aggregate sum, null when the strategy discards results
 * @param concurrencyLimit Worker pool size (P), null for strategies without one
 */
public record ExecutionReport(
        StrategyType strategy,
        Duration elapsed,
        int taskCount,
        Long sum,
        Integer concurrencyLimit
) {

    public static ExecutionReport completed(StrategyType strategy, Duration elapsed, int taskCount) {
        return new ExecutionReport(strategy, elapsed, taskCount, null, null);
    }

    public static ExecutionReport summed(StrategyType strategy, Duration elapsed, int taskCount, long sum) {
        return new ExecutionReport(strategy, elapsed, taskCount, sum, null);
    }

    public static ExecutionReport summed(StrategyType strategy, Duration elapsed, int taskCount,
                                         long sum, int concurrencyLimit) {
        return new ExecutionReport(strategy, elapsed, taskCount, sum, concurrencyLimit);
    }

    public boolean hasSum() {
        return sum != null;
    }

    public boolean hasConcurrencyLimit() {
        return concurrencyLimit != null;
    }

    /**
     * One human-readable line for the reporting sink.
     */
    public String describe() {
        StringBuilder line = new StringBuilder()
                .append("Took ").append(formatElapsed())
                .append(" to ").append(hasSum() ? "sum " : "do ")
                .append(taskCount).append(" rolls using ")
                .append(strategy.getDescription());
        if (hasConcurrencyLimit()) {
            line.append(" and a concurrency limit of ").append(concurrencyLimit);
        }
        if (hasSum()) {
            line.append(". Sum is ").append(sum);
        }
        return line.toString();
    }

    private String formatElapsed() {
        return String.format(Locale.ROOT, "%.3fms", elapsed.toNanos() / 1_000_000.0);
    }
}
