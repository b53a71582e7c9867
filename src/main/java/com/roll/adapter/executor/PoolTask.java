package com.roll.adapter.executor;

import java.util.concurrent.Future;

/**
 * Runnable wrapper with a stable taskId for logging.
 * The shared {@link #STOP} instance tells a worker to exit.
 */
final class PoolTask implements Runnable {

    static final PoolTask STOP = new PoolTask(() -> { }, "stop");

    private final Runnable task;
    private final String taskId;

    PoolTask(Runnable task, String taskId) {
        this.task = task;
        this.taskId = taskId;
    }

    @Override
    public void run() {
        task.run();
    }

    /**
     * Cancel the wrapped task if it is a future, so nobody waits on a task that will never run.
     */
    void discard() {
        if (task instanceof Future<?> future) {
            future.cancel(false);
        }
    }

    boolean isStop() {
        return this == STOP;
    }

    Runnable getTask() {
        return task;
    }

    String getTaskId() {
        return taskId;
    }
}
