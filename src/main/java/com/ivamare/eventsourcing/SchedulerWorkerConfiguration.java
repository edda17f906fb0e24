package com.ivamare.eventsourcing;

import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandWakeupSender;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import com.ivamare.eventsourcing.scheduler.impl.ExecutorWakeupSender;
import com.ivamare.eventsourcing.worker.Worker;
import com.ivamare.eventsourcing.worker.impl.SchedulerWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Real-time scheduler worker, started on application ready.
 *
 * <p>Enable with:
 * <pre>
 * eventsourcing:
 *   scheduler:
 *     worker:
 *       auto-start: true
 * </pre>
 *
 * <p>The worker keeps the default clock in step with wall time. Commands due sooner than the
 * poll interval are also woken up by an in-process timer.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "eventsourcing.scheduler.worker", name = "auto-start", havingValue = "true")
public class SchedulerWorkerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchedulerWorkerConfiguration.class);

    private final List<Worker> workers = new ArrayList<>();
    private final SchedulerClockTrigger trigger;
    private final ObjectProvider<DataSource> dataSource;
    private final EventSourcingProperties properties;

    public SchedulerWorkerConfiguration(
            SchedulerClockTrigger trigger,
            ObjectProvider<DataSource> dataSource,
            EventSourcingProperties properties) {
        this.trigger = trigger;
        this.dataSource = dataSource;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        EventSourcingProperties.SchedulerProperties sp = properties.getScheduler();
        EventSourcingProperties.WorkerProperties wp = sp.getWorker();
        boolean jdbc = properties.getStorage() == EventSourcingProperties.Storage.JDBC;

        Worker worker = new SchedulerWorker(
            trigger,
            sp.getDefaultClockName(),
            jdbc ? dataSource.getIfAvailable() : null,
            wp.getPollIntervalMs(),
            jdbc && wp.isUseNotify(),
            wp.getResilience()
        );
        worker.start();
        workers.add(worker);

        log.info("Started scheduler worker for clock={}", sp.getDefaultClockName());
    }

    @PreDestroy
    public void stopWorkers() {
        if (workers.isEmpty()) {
            return;
        }

        log.info("Stopping {} scheduler workers...", workers.size());

        workers.forEach(w -> w.stop(Duration.ofSeconds(30)));

        log.info("All scheduler workers stopped");
    }

    @Bean
    public List<Worker> schedulerWorkers() {
        return workers;
    }

    @Bean(destroyMethod = "close")
    public ScheduledCommandWakeupSender scheduledCommandWakeupSender(Clock clock) {
        return new ExecutorWakeupSender(trigger, clock, properties.getScheduler().getWakeupOffset());
    }
}
