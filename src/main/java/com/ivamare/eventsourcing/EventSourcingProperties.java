package com.ivamare.eventsourcing;

import com.ivamare.eventsourcing.policy.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for event sourcing.
 *
 * <p>Example configuration:
 * <pre>
 * eventsourcing:
 *   enabled: true
 *   storage: jdbc
 *   bus:
 *     handler-threads: 4
 *   scheduler:
 *     default-clock-name: default
 *     default-max-attempts: 5
 *     backoff-schedule: [60, 120, 180, 240, 300]
 *     wakeup-offset: 0s
 *     worker:
 *       auto-start: true
 *       poll-interval-ms: 1000
 *       use-notify: true
 *       resilience:
 *         initial-backoff-ms: 1000
 *         max-backoff-ms: 30000
 *         backoff-multiplier: 2.0
 *         error-threshold: 5
 *   snapshot:
 *     enabled: false
 * </pre>
 */
@ConfigurationProperties(prefix = "eventsourcing")
public class EventSourcingProperties {

    /**
     * Enable/disable event sourcing auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Where events and scheduled commands are kept.
     */
    private Storage storage = Storage.IN_MEMORY;

    private BusProperties bus = new BusProperties();

    private SchedulerProperties scheduler = new SchedulerProperties();

    private SnapshotProperties snapshot = new SnapshotProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public BusProperties getBus() {
        return bus;
    }

    public void setBus(BusProperties bus) {
        this.bus = bus;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    public SnapshotProperties getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(SnapshotProperties snapshot) {
        this.snapshot = snapshot;
    }

    public enum Storage {
        IN_MEMORY,
        JDBC
    }

    /**
     * Event bus configuration.
     */
    public static class BusProperties {

        /**
         * Size of the handler dispatch pool.
         */
        private int handlerThreads = 4;

        public int getHandlerThreads() {
            return handlerThreads;
        }

        public void setHandlerThreads(int handlerThreads) {
            this.handlerThreads = handlerThreads;
        }
    }

    /**
     * Command scheduler configuration.
     */
    public static class SchedulerProperties {

        /**
         * Clock used by commands scheduled without one.
         */
        private String defaultClockName = "default";

        /**
         * Maximum delivery attempts for command types without their own retry policy.
         */
        private int defaultMaxAttempts = 5;

        /**
         * Backoff schedule in seconds for each retry.
         */
        private List<Integer> backoffSchedule = List.of(60, 120, 180, 240, 300);

        /**
         * How far ahead of the due time in-process wake-up signals fire.
         */
        private Duration wakeupOffset = Duration.ZERO;

        private WorkerProperties worker = new WorkerProperties();

        /**
         * Build the retry policy used when a command type registers none.
         */
        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.ofSeconds(defaultMaxAttempts, backoffSchedule);
        }

        public String getDefaultClockName() {
            return defaultClockName;
        }

        public void setDefaultClockName(String defaultClockName) {
            this.defaultClockName = defaultClockName;
        }

        public int getDefaultMaxAttempts() {
            return defaultMaxAttempts;
        }

        public void setDefaultMaxAttempts(int defaultMaxAttempts) {
            this.defaultMaxAttempts = defaultMaxAttempts;
        }

        public List<Integer> getBackoffSchedule() {
            return backoffSchedule;
        }

        public void setBackoffSchedule(List<Integer> backoffSchedule) {
            this.backoffSchedule = backoffSchedule;
        }

        public Duration getWakeupOffset() {
            return wakeupOffset;
        }

        public void setWakeupOffset(Duration wakeupOffset) {
            this.wakeupOffset = wakeupOffset;
        }

        public WorkerProperties getWorker() {
            return worker;
        }

        public void setWorker(WorkerProperties worker) {
            this.worker = worker;
        }
    }

    /**
     * Real-time scheduler worker configuration.
     */
    public static class WorkerProperties {

        /**
         * Start the worker on application ready.
         */
        private boolean autoStart = false;

        /**
         * Poll interval in milliseconds.
         */
        private int pollIntervalMs = 1000;

        /**
         * Use PostgreSQL NOTIFY for instant wake-up. Requires JDBC storage.
         */
        private boolean useNotify = true;

        /**
         * Resilience configuration for database error recovery.
         */
        private ResilienceProperties resilience = new ResilienceProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public boolean isUseNotify() {
            return useNotify;
        }

        public void setUseNotify(boolean useNotify) {
            this.useNotify = useNotify;
        }

        public ResilienceProperties getResilience() {
            return resilience;
        }

        public void setResilience(ResilienceProperties resilience) {
            this.resilience = resilience;
        }
    }

    /**
     * Back-off applied by the worker after database errors.
     */
    public static class ResilienceProperties {

        /**
         * Initial backoff duration in milliseconds after first database error.
         */
        private long initialBackoffMs = 1000;

        /**
         * Maximum backoff duration in milliseconds.
         */
        private long maxBackoffMs = 30000;

        /**
         * Multiplier for exponential backoff.
         */
        private double backoffMultiplier = 2.0;

        /**
         * Number of consecutive errors before logging at ERROR level.
         * Below this threshold, errors are logged at WARN level.
         */
        private int errorThreshold = 5;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public int getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(int errorThreshold) {
            this.errorThreshold = errorThreshold;
        }

        /**
         * Calculate the backoff delay for a given error count, without jitter.
         *
         * @param errorCount consecutive error count (1-based)
         * @return delay in milliseconds
         */
        public long calculateBackoff(int errorCount) {
            if (errorCount <= 0) {
                return initialBackoffMs;
            }
            double delay = initialBackoffMs * Math.pow(backoffMultiplier, errorCount - 1);
            return Math.min((long) delay, maxBackoffMs);
        }
    }

    /**
     * Snapshot configuration.
     */
    public static class SnapshotProperties {

        /**
         * Keep an in-memory snapshot repository and load through it.
         */
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
