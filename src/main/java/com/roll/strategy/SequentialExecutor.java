package com.roll.strategy;

import com.roll.core.Aggregator;
import com.roll.core.ExecutionReport;
import com.roll.core.TaskSource;

/**
 * Invokes the task source N times on the calling thread, summing as it goes.
 */
public class SequentialExecutor extends AbstractRollStrategy {

    public SequentialExecutor(String threadNamePrefix) {
        super(threadNamePrefix);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.SEQUENTIAL;
    }

    @Override
    public ExecutionReport run(TaskSource source, int taskCount) {
        checkTaskCount(source, taskCount);
        long start = System.nanoTime();

        Aggregator aggregator = new Aggregator();
        for (int i = 0; i < taskCount; i++) {
            aggregator.add(invoke(source, i));
        }

        return ExecutionReport.summed(getType(), since(start), taskCount, aggregator.sum());
    }
}
