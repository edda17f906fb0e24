package com.ivamare.eventsourcing.worker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Background loop that keeps a scheduler clock in step with wall time, delivering commands as
 * they become due.
 *
 * <p>Example:
 * <pre>
 * Worker worker = new SchedulerWorker(trigger, "default", dataSource, 1000, true, resilience);
 * worker.start();
 * // ... later
 * worker.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface Worker {

    void start();

    /**
     * Stop the worker gracefully, letting the current pass finish within {@code timeout}.
     *
     * @return future that completes when the worker has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    void stopNow();

    boolean isRunning();

    /**
     * @return name of the clock this worker advances
     */
    String clockName();

    /**
     * Consecutive failed passes, 0 when healthy.
     */
    int getConsecutiveErrorCount();
}
