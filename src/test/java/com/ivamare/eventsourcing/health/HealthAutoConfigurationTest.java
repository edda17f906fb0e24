package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.EventSourcingAutoConfiguration;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.scheduler.impl.InMemoryScheduledCommandStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(EventSourcingAutoConfiguration.class, HealthAutoConfiguration.class));

    @Test
    @DisplayName("should create SchedulerHealthIndicator when enabled")
    void shouldCreateSchedulerHealthIndicatorWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SchedulerHealthIndicator.class);
            assertThat(context).doesNotHaveBean(WorkerHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should create WorkerHealthIndicator when the worker auto-starts")
    void shouldCreateWorkerHealthIndicatorWithAutoStart() {
        contextRunner
            .withPropertyValues("eventsourcing.scheduler.worker.auto-start=true")
            .run(context -> assertThat(context).hasSingleBean(WorkerHealthIndicator.class));
    }

    @Test
    @DisplayName("should not create health indicators when disabled")
    void shouldNotCreateHealthIndicatorsWhenDisabled() {
        contextRunner
            .withPropertyValues("eventsourcing.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(SchedulerHealthIndicator.class);
                assertThat(context).doesNotHaveBean(WorkerHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create duplicate health indicator if one exists")
    void shouldNotCreateDuplicateHealthIndicator() {
        contextRunner
            .withUserConfiguration(CustomHealthIndicatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(SchedulerHealthIndicator.class);
                assertThat(context.getBean(SchedulerHealthIndicator.class))
                    .isSameAs(CustomHealthIndicatorConfig.CUSTOM_INDICATOR);
            });
    }

    @Configuration
    static class CustomHealthIndicatorConfig {
        static final SchedulerHealthIndicator CUSTOM_INDICATOR =
            new SchedulerHealthIndicator(new InMemoryScheduledCommandStore(), "default", Clock.system());

        @Bean
        public SchedulerHealthIndicator customSchedulerHealthIndicator() {
            return CUSTOM_INDICATOR;
        }
    }
}
