package com.ivamare.ordersession.snapshot.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ordersession.exception.StorageFailureException;
import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.snapshot.Snapshot;
import com.ivamare.ordersession.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL snapshot store. State is kept as JSON.
 *
 * <p>A row that no longer deserializes (for example after a state shape change)
 * is treated as missing, so the loader falls back to full replay.
 */
public class JdbcSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private static final String UPSERT_SQL = """
        INSERT INTO ordersession.snapshot (stream_id, version, state)
        VALUES (?, ?, ?::jsonb)
        ON CONFLICT (stream_id, version) DO UPDATE SET state = EXCLUDED.state, created_at = NOW()
        """;

    private static final String PRUNE_SQL = """
        DELETE FROM ordersession.snapshot
        WHERE stream_id = ?
          AND version NOT IN (
              SELECT version FROM ordersession.snapshot
              WHERE stream_id = ?
              ORDER BY version DESC
              LIMIT ?
          )
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Optional<Snapshot>> snapshotMapper;

    public JdbcSnapshotStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.snapshotMapper = (rs, rowNum) -> {
            String streamId = rs.getString("stream_id");
            long version = rs.getLong("version");
            try {
                OrderSessionState state = this.objectMapper.readValue(rs.getString("state"), OrderSessionState.class);
                return Optional.of(new Snapshot(streamId, version, state, rs.getTimestamp("created_at").toInstant()));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Ignoring unreadable snapshot {}@{}: {}", streamId, version, e.getMessage());
                return Optional.empty();
            }
        };
    }

    @Override
    public void save(String streamId, long version, OrderSessionState state) {
        try {
            String json = objectMapper.writeValueAsString(state);
            jdbcTemplate.update(UPSERT_SQL, streamId, version, json);
            log.debug("Saved snapshot {}@{}", streamId, version);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Failed to save snapshot {}@{}: {}", streamId, version, e.getMessage());
        }
    }

    @Override
    public Optional<Snapshot> loadLatest(String streamId) {
        try {
            List<Optional<Snapshot>> rows = jdbcTemplate.query(
                "SELECT stream_id, version, state::text AS state, created_at FROM ordersession.snapshot "
                    + "WHERE stream_id = ? ORDER BY version DESC LIMIT 1",
                snapshotMapper,
                streamId
            );
            return rows.isEmpty() ? Optional.empty() : rows.get(0);
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to load snapshot for " + streamId, e);
        }
    }

    @Override
    public int prune(String streamId, int keepLatest) {
        try {
            int deleted = jdbcTemplate.update(PRUNE_SQL, streamId, streamId, Math.max(1, keepLatest));
            if (deleted > 0) {
                log.debug("Pruned {} snapshots of {}", deleted, streamId);
            }
            return deleted;
        } catch (DataAccessException e) {
            log.warn("Failed to prune snapshots of {}: {}", streamId, e.getMessage());
            return 0;
        }
    }
}
