package com.ivamare.eventsourcing.worker.impl;

import com.ivamare.eventsourcing.EventSourcingProperties.ResilienceProperties;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.exception.DatabaseExceptionClassifier;
import com.ivamare.eventsourcing.scheduler.SchedulerAdvancedResult;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import com.ivamare.eventsourcing.scheduler.impl.JdbcScheduledCommandStore;
import com.ivamare.eventsourcing.worker.Worker;
import org.postgresql.PGConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker that catches a scheduler clock up to wall time on every pass.
 *
 * <p>Passes run every {@code pollIntervalMs}, or sooner when a PostgreSQL notification arrives
 * on the scheduler channel.
 */
public class SchedulerWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(SchedulerWorker.class);

    private final SchedulerClockTrigger trigger;
    private final String clockName;
    private final DataSource dataSource;
    private final Clock wallClock;
    private final int pollIntervalMs;
    private final boolean useNotify;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean passInProgress = new AtomicBoolean(false);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);

    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double backoffMultiplier;
    private final int errorThreshold;

    private ExecutorService executor;

    /**
     * @param trigger delivers due commands
     * @param clockName clock to keep in step with wall time
     * @param dataSource DataSource for the LISTEN connection (can be null if useNotify is false)
     * @param pollIntervalMs poll interval in milliseconds
     * @param useNotify whether to wait on PostgreSQL NOTIFY between passes
     * @param resilience back-off after database errors
     */
    public SchedulerWorker(
            SchedulerClockTrigger trigger,
            String clockName,
            DataSource dataSource,
            int pollIntervalMs,
            boolean useNotify,
            ResilienceProperties resilience) {
        this(trigger, clockName, dataSource, Clock.system(), pollIntervalMs, useNotify, resilience);
    }

    public SchedulerWorker(
            SchedulerClockTrigger trigger,
            String clockName,
            DataSource dataSource,
            Clock wallClock,
            int pollIntervalMs,
            boolean useNotify,
            ResilienceProperties resilience) {
        this.trigger = trigger;
        this.clockName = clockName;
        this.dataSource = dataSource;
        this.wallClock = wallClock;
        this.pollIntervalMs = pollIntervalMs;
        this.useNotify = useNotify && dataSource != null;
        this.initialBackoffMs = resilience.getInitialBackoffMs();
        this.maxBackoffMs = resilience.getMaxBackoffMs();
        this.backoffMultiplier = resilience.getBackoffMultiplier();
        this.errorThreshold = resilience.getErrorThreshold();
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Scheduler worker for clock {} already running", clockName);
            return;
        }

        stopping.set(false);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "scheduler-worker-" + clockName);
            thread.setDaemon(true);
            return thread;
        });

        log.info("Starting scheduler worker for clock={}, pollIntervalMs={}, useNotify={}",
            clockName, pollIntervalMs, useNotify);

        executor.submit(this::runLoop);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping scheduler worker for clock {}", clockName);

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (passInProgress.get() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(100);
                }

                if (passInProgress.get()) {
                    log.warn("Timeout waiting for delivery pass on clock {}", clockName);
                }

                running.set(false);
                executor.shutdown();

                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }

                log.info("Scheduler worker for clock {} stopped", clockName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public String clockName() {
        return clockName;
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    // --- Main Loop ---

    private void runLoop() {
        log.debug("Scheduler worker loop started for clock {}", clockName);

        try {
            if (useNotify) {
                runWithNotify();
            } else {
                runWithPolling();
            }
        } catch (Exception e) {
            if (!stopping.get()) {
                log.error("Scheduler worker loop crashed for clock {}", clockName, e);
            }
        } finally {
            running.set(false);
            log.debug("Scheduler worker loop ended for clock {}", clockName);
        }
    }

    private void runWithNotify() {
        String channel = JdbcScheduledCommandStore.NOTIFY_CHANNEL;
        log.info("Scheduler worker for clock {} using NOTIFY mode, listening on channel {}", clockName, channel);

        // Outer loop handles reconnection on connection loss
        while (running.get() && !stopping.get()) {
            try (Connection listenConn = dataSource.getConnection()) {
                listenConn.setAutoCommit(true);

                try (Statement stmt = listenConn.createStatement()) {
                    stmt.execute("LISTEN " + channel);
                }
                log.debug("Scheduler worker for clock {} established LISTEN connection", clockName);
                consecutiveErrors.set(0);

                PGConnection pgConn = listenConn.unwrap(PGConnection.class);

                while (running.get() && !stopping.get()) {
                    try {
                        runPass();
                        consecutiveErrors.set(0);
                    } catch (RuntimeException e) {
                        if (DatabaseExceptionClassifier.isTransient(e)) {
                            // break out to reconnect
                            throw e;
                        }
                        log.error("Non-transient error delivering on clock {}: {}", clockName, e.getMessage());
                    }
                    if (stopping.get()) {
                        return;
                    }

                    pgConn.getNotifications(pollIntervalMs);
                }
            } catch (SQLException e) {
                if (!stopping.get()) {
                    int errors = consecutiveErrors.incrementAndGet();
                    long backoff = calculateBackoff(errors);
                    logConnectionError(errors, backoff, e);
                    sleep(backoff);
                }
            } catch (Exception e) {
                if (!stopping.get()) {
                    int errors = consecutiveErrors.incrementAndGet();
                    long backoff = calculateBackoff(errors);
                    if (DatabaseExceptionClassifier.isTransient(e)) {
                        logConnectionError(errors, backoff, e);
                    } else {
                        log.error("Non-transient error in NOTIFY loop for clock {}", clockName, e);
                    }
                    sleep(backoff);
                }
            }
        }
    }

    private void runWithPolling() {
        log.info("Scheduler worker for clock {} using POLLING mode (interval={}ms)", clockName, pollIntervalMs);

        while (running.get() && !stopping.get()) {
            try {
                runPass();
                consecutiveErrors.set(0);
                if (stopping.get()) {
                    return;
                }

                sleep(pollIntervalMs);
            } catch (Exception e) {
                if (!stopping.get()) {
                    int errors = consecutiveErrors.incrementAndGet();
                    long backoff = calculateBackoff(errors);

                    if (DatabaseExceptionClassifier.isTransient(e)) {
                        logConnectionError(errors, backoff, e);
                    } else {
                        log.error("Non-transient error in scheduler worker for clock {}: {}", clockName, e.getMessage());
                    }

                    sleep(backoff);
                }
            }
        }
    }

    /**
     * Catch the clock up to wall time once, delivering whatever became due.
     */
    SchedulerAdvancedResult runPass() {
        passInProgress.set(true);
        try {
            SchedulerAdvancedResult result = trigger.catchUp(clockName, wallClock.now());
            if (result.deliveredCount() > 0) {
                log.debug("Clock {} pass: {} succeeded, {} failed",
                    clockName, result.successfulCommands().size(), result.failedCommands().size());
            }
            return result;
        } finally {
            passInProgress.set(false);
        }
    }

    /**
     * Calculate exponential backoff delay with jitter.
     *
     * @param errorCount consecutive error count (1-based)
     * @return delay in milliseconds
     */
    long calculateBackoff(int errorCount) {
        if (errorCount <= 0) {
            return initialBackoffMs;
        }
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, errorCount - 1);
        // +/- 10% jitter
        double jitter = delay * 0.1 * (Math.random() * 2 - 1);
        return Math.min((long) (delay + jitter), maxBackoffMs);
    }

    private void logConnectionError(int errorCount, long backoffMs, Exception e) {
        String reason = DatabaseExceptionClassifier.getTransientReason(e);
        String message = "Scheduler worker {} database error (count={}, reason={}), backing off {}ms: {}";

        if (errorCount >= errorThreshold) {
            log.error(message, clockName, errorCount, reason, backoffMs, e.getMessage());
        } else {
            log.warn(message, clockName, errorCount, reason, backoffMs, e.getMessage());
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
