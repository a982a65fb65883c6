package com.ivamare.ordersession.store.impl;

import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.SessionEventCodec;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.DatabaseExceptionClassifier;
import com.ivamare.ordersession.exception.StorageFailureException;
import com.ivamare.ordersession.exception.VersionConflictException;
import com.ivamare.ordersession.store.AppendResult;
import com.ivamare.ordersession.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * PostgreSQL event store.
 *
 * <p>The version check and the inserts run in one transaction. The unique key on
 * {@code (stream_id, sequence_number)} catches two writers that both passed the
 * check; the loser gets a {@link VersionConflictException}.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String SELECT_COLUMNS =
        "SELECT global_position, stream_id, sequence_number, event_type, payload::text AS payload, recorded_at "
            + "FROM ordersession.event ";

    private static final String INSERT_SQL = """
        INSERT INTO ordersession.event (stream_id, sequence_number, event_type, payload, recorded_at)
        VALUES (?, ?, ?, ?::jsonb, ?)
        RETURNING global_position
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SessionEventCodec codec;
    private final Clock clock;
    private final RowMapper<StoredEvent> eventMapper;

    public JdbcEventStore(JdbcTemplate jdbcTemplate,
                          TransactionTemplate transactionTemplate,
                          SessionEventCodec codec,
                          Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.codec = codec;
        this.clock = clock;
        this.eventMapper = (rs, rowNum) -> {
            String type = rs.getString("event_type");
            return new StoredEvent(
                rs.getString("stream_id"),
                rs.getLong("sequence_number"),
                rs.getLong("global_position"),
                type,
                this.codec.decode(type, rs.getString("payload")),
                rs.getTimestamp("recorded_at").toInstant()
            );
        };
    }

    @Override
    public AppendResult append(String streamId, long expectedVersion, List<SessionEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events must not be empty");
        }

        try {
            AppendResult result = transactionTemplate.execute(status -> doAppend(streamId, expectedVersion, events));
            log.debug("Appended {} events to {} (version {} -> {})",
                events.size(), streamId, expectedVersion, result.newVersion());
            return result;
        } catch (DuplicateKeyException e) {
            long actual = currentVersion(streamId);
            log.debug("Concurrent append on {} lost the race (expected {}, now {})", streamId, expectedVersion, actual);
            throw new VersionConflictException(streamId, expectedVersion, actual);
        } catch (DataAccessException e) {
            throw storageFailure("append to " + streamId, e);
        }
    }

    private AppendResult doAppend(String streamId, long expectedVersion, List<SessionEvent> events) {
        long actual = queryVersion(streamId);
        if (actual != expectedVersion) {
            throw new VersionConflictException(streamId, expectedVersion, actual);
        }

        Instant recordedAt = clock.instant();
        List<StoredEvent> stored = new ArrayList<>(events.size());
        long sequence = expectedVersion;
        for (SessionEvent event : events) {
            sequence++;
            Long position = jdbcTemplate.queryForObject(
                INSERT_SQL,
                Long.class,
                streamId, sequence, event.type(), codec.encode(event), Timestamp.from(recordedAt)
            );
            stored.add(new StoredEvent(streamId, sequence, position != null ? position : 0L,
                event.type(), event, recordedAt));
        }
        return new AppendResult(streamId, expectedVersion, sequence, stored);
    }

    @Override
    public Stream<StoredEvent> readFrom(String streamId, long fromVersionExclusive) {
        String operation = "read " + streamId;
        Stream<StoredEvent> rows;
        try {
            rows = jdbcTemplate.queryForStream(
                SELECT_COLUMNS + "WHERE stream_id = ? AND sequence_number > ? ORDER BY sequence_number",
                eventMapper,
                streamId, fromVersionExclusive
            );
        } catch (DataAccessException e) {
            throw storageFailure(operation, e);
        }
        return translated(rows, operation);
    }

    /**
     * Rows are fetched while the caller iterates, so failures surface there too.
     */
    private Stream<StoredEvent> translated(Stream<StoredEvent> rows, String operation) {
        Spliterator<StoredEvent> source = rows.spliterator();
        Spliterator<StoredEvent> guarded = new Spliterators.AbstractSpliterator<>(
                Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super StoredEvent> action) {
                try {
                    return source.tryAdvance(action);
                } catch (DataAccessException e) {
                    throw storageFailure(operation, e);
                }
            }
        };
        return StreamSupport.stream(guarded, false).onClose(rows::close);
    }

    @Override
    public long currentVersion(String streamId) {
        try {
            return queryVersion(streamId);
        } catch (DataAccessException e) {
            throw storageFailure("read version of " + streamId, e);
        }
    }

    @Override
    public List<StoredEvent> readAll(long afterGlobalPosition, int limit) {
        try {
            return jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE global_position > ? ORDER BY global_position LIMIT ?",
                eventMapper,
                afterGlobalPosition, limit
            );
        } catch (DataAccessException e) {
            throw storageFailure("read all events", e);
        }
    }

    private long queryVersion(String streamId) {
        Long version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(sequence_number), 0) FROM ordersession.event WHERE stream_id = ?",
            Long.class,
            streamId
        );
        return version != null ? version : 0L;
    }

    private StorageFailureException storageFailure(String operation, DataAccessException e) {
        boolean transientFailure = DatabaseExceptionClassifier.isTransient(e);
        String kind = DatabaseExceptionClassifier.isTimeout(e) ? "timed out" : "failed";
        log.warn("Event store {} {} (transient={}, sqlState={}): {}",
            operation, kind, transientFailure, DatabaseExceptionClassifier.getSqlState(e), e.getMessage());
        return new StorageFailureException("Event store " + operation + " " + kind, transientFailure, e);
    }
}
