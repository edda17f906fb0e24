package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.worker.Worker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("WorkerHealthIndicator")
class WorkerHealthIndicatorTest {

    private Worker worker(String clock, boolean running, int errors) {
        Worker worker = mock(Worker.class);
        when(worker.clockName()).thenReturn(clock);
        when(worker.isRunning()).thenReturn(running);
        when(worker.getConsecutiveErrorCount()).thenReturn(errors);
        return worker;
    }

    @Test
    @DisplayName("should return UNKNOWN when no workers registered")
    void shouldReturnUnknownWhenNoWorkersRegistered() {
        Health health = new WorkerHealthIndicator(List.of(), 5).health();

        assertEquals(Status.UNKNOWN, health.getStatus());
        assertEquals("No scheduler workers running", health.getDetails().get("message"));
    }

    @Test
    @DisplayName("should return UNKNOWN when null workers list")
    void shouldReturnUnknownWhenNullWorkersList() {
        assertEquals(Status.UNKNOWN, new WorkerHealthIndicator(null, 5).health().getStatus());
    }

    @Test
    @DisplayName("should return UP when all workers running below the error threshold")
    void shouldReturnUpWhenAllWorkersRunning() {
        WorkerHealthIndicator healthIndicator = new WorkerHealthIndicator(
            List.of(worker("default", true, 0), worker("billing", true, 2)), 5);

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(2, health.getDetails().get("maxConsecutiveErrors"));
        assertEquals(2, ((Map<?, ?>) health.getDetails().get("workers")).size());
    }

    @Test
    @DisplayName("should return DOWN when a worker stopped")
    void shouldReturnDownWhenWorkerStopped() {
        WorkerHealthIndicator healthIndicator = new WorkerHealthIndicator(
            List.of(worker("default", true, 0), worker("billing", false, 0)), 5);

        assertEquals(Status.DOWN, healthIndicator.health().getStatus());
    }

    @Test
    @DisplayName("should return DOWN when errors reach the threshold")
    void shouldReturnDownWhenErrorsReachThreshold() {
        WorkerHealthIndicator healthIndicator = new WorkerHealthIndicator(
            List.of(worker("default", true, 5)), 5);

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(5, health.getDetails().get("maxConsecutiveErrors"));
    }
}
