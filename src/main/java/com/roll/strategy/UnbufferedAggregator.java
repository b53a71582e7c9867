package com.roll.strategy;

import com.roll.core.Aggregator;
import com.roll.core.ExecutionReport;
import com.roll.core.TaskSource;
import com.roll.exception.ResultQueueClosedException;
import com.roll.queue.ResultChannel;
import com.roll.queue.ResultQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands results from one concurrent unit per task to the caller through a zero-capacity
 * queue. A spawning unit starts the producers so the caller can drain while they run;
 * the caller performs exactly N reads.
 * <p>
 * Only one result is ever in transit per producer, but every producer stays parked
 * until the caller reads its value.
 */
public class UnbufferedAggregator extends AbstractRollStrategy {

    private static final Logger log = LoggerFactory.getLogger(UnbufferedAggregator.class);

    public UnbufferedAggregator(String threadNamePrefix) {
        super(threadNamePrefix);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.UNBUFFERED;
    }

    @Override
    public ExecutionReport run(TaskSource source, int taskCount) throws InterruptedException {
        checkTaskCount(source, taskCount);
        long start = System.nanoTime();

        ResultQueue<Integer> results = ResultChannel.unbuffered();
        ExecutorService units = newUnboundedUnits();
        Aggregator aggregator = new Aggregator();
        boolean drained = false;
        try {
            units.execute(() -> spawnProducers(units, results, source, taskCount));

            for (int i = 0; i < taskCount; i++) {
                int read = i;
                aggregator.add(results.take().orElseThrow(() -> new IllegalStateException(
                        "Result queue closed after " + read + " of " + taskCount + " results")));
            }
            results.close();
            drained = true;
        } catch (ResultQueueClosedException e) {
            throw failureOf(e);
        } finally {
            abandon(results);
            release(units, !drained);
        }

        return ExecutionReport.summed(getType(), since(start), taskCount, aggregator.sum());
    }

    private static void spawnProducers(ExecutorService units, ResultQueue<Integer> results,
                                       TaskSource source, int taskCount) {
        for (int i = 0; i < taskCount; i++) {
            int taskIndex = i;
            try {
                units.execute(() -> deposit(results, source, taskIndex));
            } catch (RejectedExecutionException e) {
                // The run was aborted and its units shut down
                log.debug("Stopped spawning producers after {} of {}", taskIndex, taskCount);
                return;
            }
        }
    }
}
