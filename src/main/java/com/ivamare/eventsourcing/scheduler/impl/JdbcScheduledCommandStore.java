package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.exception.DatabaseExceptionClassifier;
import com.ivamare.eventsourcing.exception.SchedulingException;
import com.ivamare.eventsourcing.scheduler.CommandExecutionError;
import com.ivamare.eventsourcing.scheduler.DeliveryPrecondition;
import com.ivamare.eventsourcing.scheduler.ScheduledCommand;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.scheduler.SchedulerClock;
import com.ivamare.eventsourcing.scheduler.SchedulerStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ScheduledCommandStore over the {@code eventsourcing} schema.
 *
 * <p>Inserts send {@code pg_notify} on {@link #NOTIFY_CHANNEL} so a listening worker wakes up.
 */
public class JdbcScheduledCommandStore implements ScheduledCommandStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduledCommandStore.class);

    public static final String NOTIFY_CHANNEL = "eventsourcing_scheduler";

    private static final int MAX_SEQUENCE_ATTEMPTS = 10;

    private static final String SELECT_COMMAND = """
        SELECT aggregate_id, sequence_number, aggregate_type, command_name, serialized_command, etag,
               created_time, due_time, applied_time, final_attempt_time, attempts, clock_name,
               precondition_aggregate_id, precondition_etag
        FROM eventsourcing.scheduled_command
        """;

    private static final RowMapper<SchedulerClock> CLOCK_MAPPER = (rs, rowNum) -> new SchedulerClock(
        rs.getString("name"),
        toInstant(rs.getTimestamp("start_time")),
        toInstant(rs.getTimestamp("utc_now"))
    );

    private static final RowMapper<ScheduledCommand> COMMAND_MAPPER = (rs, rowNum) -> {
        String preconditionId = rs.getString("precondition_aggregate_id");
        DeliveryPrecondition precondition = preconditionId == null ? null
            : new DeliveryPrecondition(UUID.fromString(preconditionId), rs.getString("precondition_etag"));
        return new ScheduledCommand(
            UUID.fromString(rs.getString("aggregate_id")),
            rs.getLong("sequence_number"),
            rs.getString("aggregate_type"),
            rs.getString("command_name"),
            rs.getString("serialized_command"),
            rs.getString("etag"),
            toInstant(rs.getTimestamp("created_time")),
            toInstant(rs.getTimestamp("due_time")),
            toInstant(rs.getTimestamp("applied_time")),
            toInstant(rs.getTimestamp("final_attempt_time")),
            rs.getInt("attempts"),
            rs.getString("clock_name"),
            precondition
        );
    };

    private static final RowMapper<CommandExecutionError> ERROR_MAPPER = (rs, rowNum) -> new CommandExecutionError(
        UUID.fromString(rs.getString("aggregate_id")),
        rs.getLong("sequence_number"),
        rs.getInt("attempt"),
        toInstant(rs.getTimestamp("occurred_at")),
        rs.getString("exception_type"),
        rs.getString("message"),
        rs.getBoolean("final_attempt")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcScheduledCommandStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    // --- Clocks ---

    @Override
    public Optional<SchedulerClock> findClock(String name) {
        List<SchedulerClock> clocks = jdbcTemplate.query(
            "SELECT name, start_time, utc_now FROM eventsourcing.clock WHERE name = ?",
            CLOCK_MAPPER, name);
        return clocks.stream().findFirst();
    }

    @Override
    public SchedulerClock getOrCreateClock(String name, Instant startTime) {
        jdbcTemplate.update("""
            INSERT INTO eventsourcing.clock (name, start_time, utc_now)
            VALUES (?, ?, ?)
            ON CONFLICT (name) DO NOTHING
            """,
            name, Timestamp.from(startTime), Timestamp.from(startTime));
        return findClock(name)
            .orElseThrow(() -> new SchedulingException("Clock " + name + " could not be created"));
    }

    @Override
    public void updateClock(SchedulerClock clock) {
        int updated = jdbcTemplate.update(
            "UPDATE eventsourcing.clock SET utc_now = ? WHERE name = ?",
            Timestamp.from(clock.utcNow()), clock.name());
        if (updated == 0) {
            throw new SchedulingException("Unknown clock " + clock.name());
        }
    }

    // --- Commands ---

    @Override
    public Optional<ScheduledCommand> insert(ScheduledCommand command) {
        for (int attempt = 1; attempt <= MAX_SEQUENCE_ATTEMPTS; attempt++) {
            if (command.etag() != null && etagExists(command.aggregateId(), command.etag())) {
                return Optional.empty();
            }
            ScheduledCommand toStore = command.sequenceNumber() != 0
                ? command
                : command.withSequenceNumber(nextNegativeSequenceNumber(command.aggregateId()));
            try {
                doInsert(toStore);
                jdbcTemplate.queryForList("SELECT pg_notify(?, ?)",
                    NOTIFY_CHANNEL, toStore.aggregateId() + ":" + toStore.sequenceNumber());
                return Optional.of(toStore);
            } catch (DataAccessException e) {
                if (!DatabaseExceptionClassifier.isUniqueViolation(e)) {
                    throw e;
                }
                if (command.sequenceNumber() != 0) {
                    log.debug("Scheduled command {} already stored: {}", toStore, e.getMessage());
                    return Optional.empty();
                }
                log.debug("Sequence number {} taken for {}, retrying", toStore.sequenceNumber(), toStore.aggregateId());
            }
        }
        throw new SchedulingException("Could not assign a sequence number for scheduled command on "
            + command.aggregateId());
    }

    private boolean etagExists(UUID aggregateId, String etag) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM eventsourcing.scheduled_command WHERE aggregate_id = ? AND etag = ?)",
            Boolean.class, aggregateId, etag);
        return Boolean.TRUE.equals(exists);
    }

    private long nextNegativeSequenceNumber(UUID aggregateId) {
        Long next = jdbcTemplate.queryForObject(
            "SELECT LEAST(COALESCE(MIN(sequence_number), 0), 0) - 1 FROM eventsourcing.scheduled_command WHERE aggregate_id = ?",
            Long.class, aggregateId);
        return next != null ? next : -1L;
    }

    private void doInsert(ScheduledCommand command) {
        DeliveryPrecondition precondition = command.precondition();
        jdbcTemplate.update("""
            INSERT INTO eventsourcing.scheduled_command (
                aggregate_id, sequence_number, aggregate_type, command_name, serialized_command, etag,
                created_time, due_time, applied_time, final_attempt_time, attempts, clock_name,
                precondition_aggregate_id, precondition_etag
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            command.aggregateId(),
            command.sequenceNumber(),
            command.aggregateType(),
            command.commandName(),
            command.serializedCommand(),
            command.etag(),
            toTimestamp(command.createdTime()),
            toTimestamp(command.dueTime()),
            toTimestamp(command.appliedTime()),
            toTimestamp(command.finalAttemptTime()),
            command.attempts(),
            command.clockName(),
            precondition != null ? precondition.aggregateId() : null,
            precondition != null ? precondition.etag() : null
        );
    }

    @Override
    public Optional<ScheduledCommand> find(UUID aggregateId, long sequenceNumber) {
        List<ScheduledCommand> found = jdbcTemplate.query(
            SELECT_COMMAND + " WHERE aggregate_id = ? AND sequence_number = ?",
            COMMAND_MAPPER, aggregateId, sequenceNumber);
        return found.stream().findFirst();
    }

    @Override
    public List<ScheduledCommand> findDue(String clockName, Instant asOf) {
        return jdbcTemplate.query(SELECT_COMMAND + """
             WHERE clock_name = ?
               AND applied_time IS NULL
               AND final_attempt_time IS NULL
               AND COALESCE(due_time, created_time) <= ?
             ORDER BY COALESCE(due_time, created_time), created_time, ABS(sequence_number)
            """,
            COMMAND_MAPPER, clockName, Timestamp.from(asOf));
    }

    @Override
    public void update(ScheduledCommand command) {
        int updated = jdbcTemplate.update("""
            UPDATE eventsourcing.scheduled_command
            SET due_time = ?, applied_time = ?, final_attempt_time = ?, attempts = ?
            WHERE aggregate_id = ? AND sequence_number = ?
            """,
            toTimestamp(command.dueTime()),
            toTimestamp(command.appliedTime()),
            toTimestamp(command.finalAttemptTime()),
            command.attempts(),
            command.aggregateId(),
            command.sequenceNumber());
        if (updated == 0) {
            throw new SchedulingException("Unknown scheduled command " + command);
        }
    }

    // --- Errors ---

    @Override
    public void addError(CommandExecutionError error) {
        jdbcTemplate.update("""
            INSERT INTO eventsourcing.scheduled_command_error (
                aggregate_id, sequence_number, attempt, occurred_at, exception_type, message, final_attempt
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            error.aggregateId(),
            error.sequenceNumber(),
            error.attempt(),
            Timestamp.from(error.occurredAt()),
            error.exceptionType(),
            error.message(),
            error.finalAttempt());
    }

    @Override
    public List<CommandExecutionError> errors(UUID aggregateId, long sequenceNumber) {
        return jdbcTemplate.query("""
            SELECT aggregate_id, sequence_number, attempt, occurred_at, exception_type, message, final_attempt
            FROM eventsourcing.scheduled_command_error
            WHERE aggregate_id = ? AND sequence_number = ?
            ORDER BY attempt
            """,
            ERROR_MAPPER, aggregateId, sequenceNumber);
    }

    @Override
    public SchedulerStatistics statistics(String clockName, Instant asOf) {
        return jdbcTemplate.queryForObject("""
            SELECT
                COUNT(*) FILTER (WHERE applied_time IS NULL AND final_attempt_time IS NULL) AS pending,
                COUNT(*) FILTER (WHERE applied_time IS NULL AND final_attempt_time IS NULL
                                 AND COALESCE(due_time, created_time) <= ?) AS due,
                COUNT(*) FILTER (WHERE applied_time IS NOT NULL) AS delivered,
                COUNT(*) FILTER (WHERE applied_time IS NULL AND final_attempt_time IS NOT NULL) AS finalized
            FROM eventsourcing.scheduled_command
            WHERE clock_name = ?
            """,
            (rs, rowNum) -> new SchedulerStatistics(
                rs.getLong("pending"), rs.getLong("due"), rs.getLong("delivered"), rs.getLong("finalized")),
            Timestamp.from(asOf), clockName);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
