package com.ivamare.eventsourcing.worker.impl;

import com.ivamare.eventsourcing.EventSourcingProperties.ResilienceProperties;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.scheduler.SchedulerAdvancedResult;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("SchedulerWorker")
class SchedulerWorkerTest {

    private static final Instant WALL_TIME = Instant.parse("2024-03-01T10:00:00Z");

    private SchedulerClockTrigger trigger;
    private ResilienceProperties resilience;
    private SchedulerWorker worker;

    @BeforeEach
    void setUp() {
        trigger = mock(SchedulerClockTrigger.class);
        when(trigger.catchUp(eq("default"), any(Instant.class)))
            .thenReturn(SchedulerAdvancedResult.empty("default", WALL_TIME));
        resilience = new ResilienceProperties();
        resilience.setInitialBackoffMs(10);
        resilience.setMaxBackoffMs(50);
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stopNow();
        }
    }

    private SchedulerWorker newWorker() {
        return new SchedulerWorker(trigger, "default", null, Clock.fixed(WALL_TIME), 20, false, resilience);
    }

    @Nested
    @DisplayName("runPass")
    class RunPassTests {

        @Test
        @DisplayName("should catch the clock up to wall time")
        void shouldCatchClockUpToWallTime() {
            worker = newWorker();

            SchedulerAdvancedResult result = worker.runPass();

            assertEquals(0, result.deliveredCount());
            verify(trigger).catchUp("default", WALL_TIME);
        }

        @Test
        @DisplayName("should propagate failures to the loop")
        void shouldPropagateFailures() {
            when(trigger.catchUp(eq("default"), any(Instant.class))).thenThrow(new IllegalStateException("boom"));
            worker = newWorker();

            assertThrows(IllegalStateException.class, () -> worker.runPass());
        }
    }

    @Nested
    @DisplayName("calculateBackoff")
    class CalculateBackoffTests {

        @Test
        @DisplayName("should grow exponentially within jitter")
        void shouldGrowExponentially() {
            resilience.setInitialBackoffMs(1000);
            resilience.setMaxBackoffMs(60000);
            worker = newWorker();

            long first = worker.calculateBackoff(1);
            long third = worker.calculateBackoff(3);

            assertTrue(first >= 900 && first <= 1100, "first backoff was " + first);
            assertTrue(third >= 3600 && third <= 4400, "third backoff was " + third);
        }

        @Test
        @DisplayName("should cap at the maximum backoff")
        void shouldCapAtMaximum() {
            resilience.setInitialBackoffMs(1000);
            resilience.setMaxBackoffMs(30000);
            worker = newWorker();

            assertEquals(30000, worker.calculateBackoff(20));
        }

        @Test
        @DisplayName("should use the initial backoff for a zero error count")
        void shouldUseInitialBackoffForZeroErrors() {
            resilience.setInitialBackoffMs(1000);
            worker = newWorker();

            assertEquals(1000, worker.calculateBackoff(0));
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should poll the trigger until stopped")
        void shouldPollUntilStopped() throws Exception {
            worker = newWorker();

            worker.start();

            verify(trigger, timeout(1000).atLeast(2)).catchUp("default", WALL_TIME);
            assertTrue(worker.isRunning());
            assertEquals("default", worker.clockName());

            worker.stop(Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

            assertFalse(worker.isRunning());
        }

        @Test
        @DisplayName("should ignore a second start")
        void shouldIgnoreSecondStart() {
            worker = newWorker();

            worker.start();
            worker.start();

            assertTrue(worker.isRunning());
        }

        @Test
        @DisplayName("should count consecutive failed passes and keep running")
        void shouldCountConsecutiveFailures() {
            when(trigger.catchUp(eq("default"), any(Instant.class))).thenThrow(new IllegalStateException("boom"));
            worker = newWorker();

            worker.start();

            verify(trigger, timeout(1000).atLeast(3)).catchUp("default", WALL_TIME);
            assertTrue(worker.getConsecutiveErrorCount() >= 2);
            assertTrue(worker.isRunning());
        }

        @Test
        @DisplayName("should complete stop immediately when never started")
        void shouldStopWhenNeverStarted() {
            worker = newWorker();

            assertTrue(worker.stop(Duration.ofSeconds(1)).isDone());
        }
    }
}
