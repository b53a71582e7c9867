package com.roll.strategy;

import com.roll.config.RollConfig;
import com.roll.core.ExecutionReport;
import com.roll.core.TaskSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the configured strategies in order against one task source and reports each run.
 */
public class StrategyRunner {

    private static final Logger log = LoggerFactory.getLogger(StrategyRunner.class);

    private final RollConfig config;
    private final TaskSource source;

    public StrategyRunner(RollConfig config, TaskSource source) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.source = Objects.requireNonNull(source, "Task source cannot be null");
    }

    /**
     * Run every configured strategy once, logging one report line per run.
     *
     * @return reports in run order
     * @throws com.roll.exception.TaskInvocationException if a task fails; later strategies are not run
     * @throws InterruptedException if interrupted while a strategy waits
     */
    public List<ExecutionReport> runAll() throws InterruptedException {
        log.info("Running {} strategies with {} tasks each ({})",
                config.strategies().size(), config.taskCount(), config.name());

        List<ExecutionReport> reports = new ArrayList<>();
        for (StrategyType type : config.strategies()) {
            reports.add(run(type));
        }
        return reports;
    }

    /**
     * Run a single strategy with the configured task count.
     */
    public ExecutionReport run(StrategyType type) throws InterruptedException {
        RollStrategy strategy = StrategyFactory.create(type, config);
        ExecutionReport report = strategy.run(source, config.taskCount());
        log.info(report.describe());
        return report;
    }

    public RollConfig getConfig() {
        return config;
    }
}
