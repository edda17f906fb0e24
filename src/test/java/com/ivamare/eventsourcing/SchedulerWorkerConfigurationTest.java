package com.ivamare.eventsourcing;

import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandWakeupSender;
import com.ivamare.eventsourcing.scheduler.SchedulerAdvancedResult;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import com.ivamare.eventsourcing.scheduler.impl.ExecutorWakeupSender;
import com.ivamare.eventsourcing.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("SchedulerWorkerConfiguration")
class SchedulerWorkerConfigurationTest {

    private SchedulerClockTrigger trigger;
    private EventSourcingProperties properties;
    private SchedulerWorkerConfiguration configuration;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        trigger = mock(SchedulerClockTrigger.class);
        when(trigger.catchUp(eq("default"), any(Instant.class)))
            .thenAnswer(inv -> SchedulerAdvancedResult.empty("default", inv.getArgument(1)));
        properties = new EventSourcingProperties();
        properties.getScheduler().getWorker().setPollIntervalMs(50);

        ObjectProvider<DataSource> dataSource = mock(ObjectProvider.class);
        configuration = new SchedulerWorkerConfiguration(trigger, dataSource, properties);
    }

    @AfterEach
    void tearDown() {
        configuration.stopWorkers();
    }

    @Test
    @DisplayName("should start a polling worker for the default clock")
    void shouldStartWorkerForDefaultClock() {
        configuration.startWorkers();

        List<Worker> workers = configuration.schedulerWorkers();
        assertEquals(1, workers.size());
        assertEquals("default", workers.get(0).clockName());
        assertTrue(workers.get(0).isRunning());
        verify(trigger, timeout(1000).atLeastOnce()).catchUp(eq("default"), any(Instant.class));
    }

    @Test
    @DisplayName("should have no workers before the application is ready")
    void shouldHaveNoWorkersBeforeReady() {
        assertTrue(configuration.schedulerWorkers().isEmpty());
        assertDoesNotThrow(() -> configuration.stopWorkers());
    }

    @Test
    @DisplayName("should create an in-process wake-up sender")
    void shouldCreateWakeupSender() {
        ScheduledCommandWakeupSender sender = configuration.scheduledCommandWakeupSender(Clock.system());

        assertInstanceOf(ExecutorWakeupSender.class, sender);
        ((ExecutorWakeupSender) sender).close();
    }

    @Test
    @DisplayName("should only be active with auto-start")
    void shouldOnlyBeActiveWithAutoStart() {
        ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventSourcingAutoConfiguration.class));

        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(SchedulerWorkerConfiguration.class);
            assertThat(context).doesNotHaveBean("schedulerWorkers");
        });

        contextRunner
            .withPropertyValues("eventsourcing.scheduler.worker.auto-start=true")
            .run(context -> {
                assertThat(context).hasSingleBean(SchedulerWorkerConfiguration.class);
                assertThat(context).hasSingleBean(ScheduledCommandWakeupSender.class);
                assertThat(context).hasBean("schedulerWorkers");
            });
    }
}
