package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.EventSourcingAutoConfiguration;
import com.ivamare.eventsourcing.EventSourcingProperties;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.worker.Worker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.List;

/**
 * Auto-configuration for event sourcing health indicators.
 */
@AutoConfiguration(after = EventSourcingAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean(ScheduledCommandStore.class)
@ConditionalOnProperty(prefix = "eventsourcing", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SchedulerHealthIndicator.class)
    public SchedulerHealthIndicator schedulerHealthIndicator(
            ScheduledCommandStore store,
            Clock clock,
            EventSourcingProperties properties,
            ObjectProvider<DataSource> dataSource) {
        DataSource ds = properties.getStorage() == EventSourcingProperties.Storage.JDBC
            ? dataSource.getIfAvailable()
            : null;
        return new SchedulerHealthIndicator(store, properties.getScheduler().getDefaultClockName(), clock, ds);
    }

    @Bean
    @ConditionalOnBean(name = "schedulerWorkers")
    @ConditionalOnMissingBean(WorkerHealthIndicator.class)
    public WorkerHealthIndicator schedulerWorkerHealthIndicator(
            List<Worker> schedulerWorkers,
            EventSourcingProperties properties) {
        return new WorkerHealthIndicator(schedulerWorkers,
            properties.getScheduler().getWorker().getResilience().getErrorThreshold());
    }
}
