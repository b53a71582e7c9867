package com.roll.strategy;

import com.roll.adapter.executor.FixedWorkerPool;
import com.roll.adapter.executor.WorkerPool;
import com.roll.core.Aggregator;
import com.roll.core.ExecutionReport;
import com.roll.core.TaskSource;
import com.roll.exception.ResultQueueClosedException;
import com.roll.queue.ResultChannel;
import com.roll.queue.ResultQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shapes N submissions onto a fixed pool of P workers. Workers hand results to the caller
 * through a zero-capacity queue; a supervisor thread waits for the pool to drain and then
 * closes the queue, which ends the caller's drain loop.
 * <p>
 * At most P invocations are in flight at once, so with uniform latency the run takes
 * at least {@code ceil(N / P)} task latencies.
 */
public class BoundedPoolAggregator extends AbstractRollStrategy {

    private static final Logger log = LoggerFactory.getLogger(BoundedPoolAggregator.class);

    private final int poolSize;

    public BoundedPoolAggregator(int poolSize, String threadNamePrefix) {
        super(threadNamePrefix);
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + poolSize);
        }
        this.poolSize = poolSize;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BOUNDED_POOL;
    }

    public int getPoolSize() {
        return poolSize;
    }

    @Override
    public ExecutionReport run(TaskSource source, int taskCount) throws InterruptedException {
        checkTaskCount(source, taskCount);
        long start = System.nanoTime();

        WorkerPool pool = new FixedWorkerPool(poolSize, threadNamePrefix + "pool-worker-");
        ResultQueue<Integer> results = ResultChannel.unbuffered();
        for (int i = 0; i < taskCount; i++) {
            int taskIndex = i;
            pool.submit(() -> deposit(results, source, taskIndex));
        }

        Thread supervisor = new Thread(() -> {
            try {
                pool.stopAndWait();
                results.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.fail(e);
            }
        }, threadNamePrefix + "pool-supervisor");
        supervisor.setDaemon(true);
        supervisor.start();

        Aggregator aggregator = new Aggregator();
        try {
            Optional<Integer> result;
            while ((result = results.take()).isPresent()) {
                aggregator.add(result.get());
            }
        } catch (ResultQueueClosedException e) {
            throw failureOf(e);
        } finally {
            abandon(results);
            joinUninterruptibly(supervisor);
        }
        aggregator.verifyCount(taskCount);

        log.debug("Bounded pool run finished: {} tasks on {} workers", taskCount, poolSize);
        return ExecutionReport.summed(getType(), since(start), taskCount, aggregator.sum(), poolSize);
    }
}
