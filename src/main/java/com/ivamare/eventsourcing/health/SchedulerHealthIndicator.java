package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.scheduler.SchedulerClock;
import com.ivamare.eventsourcing.scheduler.SchedulerStatistics;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Health indicator for the command scheduler.
 *
 * <p>Reports:
 * <ul>
 *   <li>Database connectivity and pool stats, when a DataSource is given</li>
 *   <li>Pending, due, delivered and finalized command counts on the default clock</li>
 *   <li>How far the clock lags behind wall time</li>
 * </ul>
 */
public class SchedulerHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final ScheduledCommandStore store;
    private final String clockName;
    private final Clock wallClock;
    private final DataSource dataSource;

    public SchedulerHealthIndicator(ScheduledCommandStore store, String clockName, Clock wallClock) {
        this(store, clockName, wallClock, null);
    }

    public SchedulerHealthIndicator(ScheduledCommandStore store, String clockName, Clock wallClock, DataSource dataSource) {
        this.store = store;
        this.clockName = clockName;
        this.wallClock = wallClock;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Optional<SchedulerClock> clock = store.findClock(clockName);
            if (clock.isEmpty()) {
                return Health.up()
                    .withDetail("clock", clockName)
                    .withDetail("message", "No commands scheduled yet")
                    .build();
            }

            SchedulerClock current = clock.get();
            SchedulerStatistics stats = store.statistics(clockName, current.utcNow());

            Health.Builder builder = Health.up()
                .withDetail("clock", clockName)
                .withDetail("clockTime", current.utcNow().toString())
                .withDetail("lagMs", Math.max(0, wallClock.now().toEpochMilli() - current.utcNow().toEpochMilli()))
                .withDetail("pendingCommands", stats.pending())
                .withDetail("dueCommands", stats.due())
                .withDetail("deliveredCommands", stats.delivered())
                .withDetail("finalizedCommands", stats.finalized());

            addPoolStats(builder);

            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
