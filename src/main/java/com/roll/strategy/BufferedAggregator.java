package com.roll.strategy;

import com.roll.core.Aggregator;
import com.roll.core.ExecutionReport;
import com.roll.core.TaskSource;
import com.roll.exception.ResultQueueClosedException;
import com.roll.exception.TaskInvocationException;
import com.roll.queue.ResultChannel;
import com.roll.queue.ResultQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts one concurrent unit per task, each depositing into a queue sized to hold every
 * result. Draining starts only after the latch reports all deposits done.
 * <p>
 * Producers never wait on the queue, at the price of holding all N results in memory
 * at once. For large N or large results that buffer is the dominant cost.
 */
public class BufferedAggregator extends AbstractRollStrategy {

    private static final Logger log = LoggerFactory.getLogger(BufferedAggregator.class);

    private volatile ResultQueue<Integer> lastQueue;

    public BufferedAggregator(String threadNamePrefix) {
        super(threadNamePrefix);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BUFFERED;
    }

    @Override
    public ExecutionReport run(TaskSource source, int taskCount) throws InterruptedException {
        checkTaskCount(source, taskCount);
        long start = System.nanoTime();

        ResultQueue<Integer> results = ResultChannel.buffered(taskCount);
        lastQueue = results;
        CountDownLatch pending = new CountDownLatch(taskCount);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        ExecutorService units = newUnboundedUnits();
        boolean deposited = false;
        try {
            for (int i = 0; i < taskCount; i++) {
                int taskIndex = i;
                units.execute(() -> {
                    try {
                        results.put(invoke(source, taskIndex));
                    } catch (TaskInvocationException | Error e) {
                        failure.compareAndSet(null, e);
                    } catch (ResultQueueClosedException e) {
                        log.debug("Dropping result of task {}: {}", taskIndex, e.getMessage());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        failure.compareAndSet(null,
                                new TaskInvocationException("Interrupted while depositing", taskIndex, e));
                    } finally {
                        pending.countDown();
                    }
                });
            }
            pending.await();
            deposited = true;
        } finally {
            if (!deposited) {
                abandon(results);
            }
            release(units, !deposited);
        }
        results.close();

        rethrow(failure.get());

        Aggregator aggregator = new Aggregator();
        Optional<Integer> result;
        while ((result = results.take()).isPresent()) {
            aggregator.add(result.get());
        }
        aggregator.verifyCount(taskCount);

        return ExecutionReport.summed(getType(), since(start), taskCount, aggregator.sum());
    }

    /**
     * Queue used by the most recent run, for inspecting how many deposits had to wait.
     */
    ResultQueue<Integer> getLastQueue() {
        return lastQueue;
    }
}
