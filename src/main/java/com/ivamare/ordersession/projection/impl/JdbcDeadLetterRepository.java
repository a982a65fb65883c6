package com.ivamare.ordersession.projection.impl;

import com.ivamare.ordersession.exception.StorageFailureException;
import com.ivamare.ordersession.projection.DeadLetter;
import com.ivamare.ordersession.projection.DeadLetterRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;

/**
 * JDBC implementation of DeadLetterRepository.
 */
public class JdbcDeadLetterRepository implements DeadLetterRepository {

    private static final String UPSERT_SQL = """
        INSERT INTO ordersession.projection_dead_letter
            (subscriber, stream_id, sequence_number, global_position, event_type, attempts, error_message, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (subscriber, stream_id, sequence_number) DO UPDATE SET
            attempts = ordersession.projection_dead_letter.attempts + EXCLUDED.attempts,
            error_message = EXCLUDED.error_message,
            created_at = EXCLUDED.created_at
        """;

    private static final RowMapper<DeadLetter> DEAD_LETTER_MAPPER = (rs, rowNum) -> new DeadLetter(
        rs.getLong("id"),
        rs.getString("subscriber"),
        rs.getString("stream_id"),
        rs.getLong("sequence_number"),
        rs.getLong("global_position"),
        rs.getString("event_type"),
        rs.getInt("attempts"),
        rs.getString("error_message"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcDeadLetterRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(DeadLetter deadLetter) {
        try {
            jdbcTemplate.update(
                UPSERT_SQL,
                deadLetter.subscriber(),
                deadLetter.streamId(),
                deadLetter.sequenceNumber(),
                deadLetter.globalPosition(),
                deadLetter.eventType(),
                deadLetter.attempts(),
                deadLetter.errorMessage(),
                deadLetter.createdAt() != null ? Timestamp.from(deadLetter.createdAt()) : null
            );
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to record dead letter for " + deadLetter.streamId(), e);
        }
    }

    @Override
    public List<DeadLetter> findAll() {
        return jdbcTemplate.query(
            "SELECT * FROM ordersession.projection_dead_letter ORDER BY id",
            DEAD_LETTER_MAPPER
        );
    }

    @Override
    public List<DeadLetter> findBySubscriber(String subscriber) {
        return jdbcTemplate.query(
            "SELECT * FROM ordersession.projection_dead_letter WHERE subscriber = ? ORDER BY id",
            DEAD_LETTER_MAPPER,
            subscriber
        );
    }

    @Override
    public int delete(String subscriber, String streamId) {
        return jdbcTemplate.update(
            "DELETE FROM ordersession.projection_dead_letter WHERE subscriber = ? AND stream_id = ?",
            subscriber, streamId
        );
    }

    @Override
    public int deleteBySubscriber(String subscriber) {
        return jdbcTemplate.update(
            "DELETE FROM ordersession.projection_dead_letter WHERE subscriber = ?",
            subscriber
        );
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ordersession.projection_dead_letter",
            Long.class
        );
        return count != null ? count : 0L;
    }
}
