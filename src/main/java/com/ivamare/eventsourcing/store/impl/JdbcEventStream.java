package com.ivamare.eventsourcing.store.impl;

import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.exception.DatabaseExceptionClassifier;
import com.ivamare.eventsourcing.model.StoredEvent;
import com.ivamare.eventsourcing.store.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of EventStream over {@code eventsourcing.event}.
 *
 * <p>The primary key on (aggregate_id, sequence_number) is the optimistic concurrency check;
 * a batch is inserted in one transaction.
 */
public class JdbcEventStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStream.class);

    private static final String SELECT = """
        SELECT id, aggregate_id, sequence_number, stream_name, type, body, utc_time, etag, actor
        FROM eventsourcing.event
        """;

    private static final RowMapper<StoredEvent> EVENT_MAPPER = (rs, rowNum) -> new StoredEvent(
        UUID.fromString(rs.getString("aggregate_id")),
        rs.getLong("sequence_number"),
        rs.getString("stream_name"),
        rs.getString("type"),
        rs.getString("body"),
        toInstant(rs.getTimestamp("utc_time")),
        rs.getString("etag"),
        rs.getString("actor"),
        rs.getLong("id")
    );

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcEventStream(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public List<StoredEvent> appendAll(List<StoredEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        try {
            return transactionTemplate.execute(status -> events.stream().map(this::insert).toList());
        } catch (DataAccessException e) {
            if (DatabaseExceptionClassifier.isUniqueViolation(e)) {
                StoredEvent first = events.get(0);
                log.debug("Rejected append for {} starting at seq={}: {}",
                    first.aggregateId(), first.sequenceNumber(), e.getMessage());
                throw new ConcurrencyException("Sequence number already recorded for aggregate "
                    + first.aggregateId() + " (batch starting at " + first.sequenceNumber() + ")", e);
            }
            throw e;
        }
    }

    private StoredEvent insert(StoredEvent event) {
        Long id = jdbcTemplate.queryForObject("""
            INSERT INTO eventsourcing.event (
                aggregate_id, sequence_number, stream_name, type, body, utc_time, etag, actor
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """,
            Long.class,
            event.aggregateId(),
            event.sequenceNumber(),
            event.streamName(),
            event.type(),
            event.body(),
            event.timestamp() != null ? Timestamp.from(event.timestamp()) : null,
            event.etag(),
            event.actor()
        );
        return id != null ? event.withAbsoluteSequenceNumber(id) : event;
    }

    @Override
    public Optional<StoredEvent> latest(UUID aggregateId) {
        List<StoredEvent> results = jdbcTemplate.query(
            SELECT + "WHERE aggregate_id = ? ORDER BY sequence_number DESC LIMIT 1",
            EVENT_MAPPER,
            aggregateId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<StoredEvent> all(UUID aggregateId) {
        return jdbcTemplate.query(
            SELECT + "WHERE aggregate_id = ? ORDER BY sequence_number",
            EVENT_MAPPER,
            aggregateId
        );
    }

    @Override
    public List<StoredEvent> asOfDate(UUID aggregateId, Instant asOf) {
        return jdbcTemplate.query(
            SELECT + "WHERE aggregate_id = ? AND utc_time <= ? ORDER BY sequence_number",
            EVENT_MAPPER,
            aggregateId, Timestamp.from(asOf)
        );
    }

    @Override
    public List<StoredEvent> upToVersion(UUID aggregateId, long version) {
        return jdbcTemplate.query(
            SELECT + "WHERE aggregate_id = ? AND sequence_number <= ? ORDER BY sequence_number",
            EVENT_MAPPER,
            aggregateId, version
        );
    }

    @Override
    public List<StoredEvent> afterVersion(UUID aggregateId, long version) {
        return jdbcTemplate.query(
            SELECT + "WHERE aggregate_id = ? AND sequence_number > ? ORDER BY sequence_number",
            EVENT_MAPPER,
            aggregateId, version
        );
    }

    @Override
    public boolean hasETag(UUID aggregateId, String etag) {
        if (etag == null) {
            return false;
        }
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM eventsourcing.event WHERE aggregate_id = ? AND etag = ?",
            Integer.class,
            aggregateId, etag
        );
        return count != null && count > 0;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
