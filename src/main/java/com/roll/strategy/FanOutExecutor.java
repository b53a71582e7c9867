package com.roll.strategy;

import com.roll.core.ExecutionReport;
import com.roll.core.TaskSource;
import com.roll.exception.TaskInvocationException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts one concurrent unit per task and waits on a latch until all of them have finished.
 * Results are discarded; only completion matters.
 * <p>
 * Nothing bounds the number of threads: this is the baseline the bounded pool is compared to.
 */
public class FanOutExecutor extends AbstractRollStrategy {

    public FanOutExecutor(String threadNamePrefix) {
        super(threadNamePrefix);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.FAN_OUT;
    }

    @Override
    public ExecutionReport run(TaskSource source, int taskCount) throws InterruptedException {
        checkTaskCount(source, taskCount);
        long start = System.nanoTime();

        CountDownLatch done = new CountDownLatch(taskCount);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        ExecutorService units = newUnboundedUnits();
        boolean finished = false;
        try {
            for (int i = 0; i < taskCount; i++) {
                int taskIndex = i;
                units.execute(() -> {
                    try {
                        invoke(source, taskIndex);
                    } catch (TaskInvocationException | Error e) {
                        failure.compareAndSet(null, e);
                    } finally {
                        done.countDown();
                    }
                });
            }
            done.await();
            finished = true;
        } finally {
            release(units, !finished);
        }

        rethrow(failure.get());
        return ExecutionReport.completed(getType(), since(start), taskCount);
    }
}
