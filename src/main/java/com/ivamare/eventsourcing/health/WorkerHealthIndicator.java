package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.worker.Worker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health indicator for scheduler workers. Down when a worker stopped or keeps failing.
 */
public class WorkerHealthIndicator implements HealthIndicator {

    private final List<Worker> workers;
    private final int errorThreshold;

    public WorkerHealthIndicator(List<Worker> workers, int errorThreshold) {
        this.workers = workers != null ? workers : List.of();
        this.errorThreshold = errorThreshold;
    }

    @Override
    public Health health() {
        if (workers.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No scheduler workers running")
                .build();
        }

        Map<String, WorkerStatus> statuses = workers.stream()
            .collect(Collectors.toMap(
                Worker::clockName,
                w -> new WorkerStatus(w.isRunning(), w.getConsecutiveErrorCount()),
                (existing, replacement) -> existing
            ));

        boolean allRunning = workers.stream().allMatch(Worker::isRunning);
        int maxConsecutiveErrors = workers.stream()
            .mapToInt(Worker::getConsecutiveErrorCount)
            .max()
            .orElse(0);

        Health.Builder builder = allRunning && maxConsecutiveErrors < errorThreshold ? Health.up() : Health.down();
        return builder
            .withDetail("workers", statuses)
            .withDetail("maxConsecutiveErrors", maxConsecutiveErrors)
            .build();
    }

    record WorkerStatus(boolean running, int consecutiveErrors) {}
}
