package com.ivamare.ordersession.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for the JDBC event store.
 *
 * <p>Checks:
 * <ul>
 *   <li>ordersession schema exists</li>
 *   <li>Reports stream and event counts</li>
 *   <li>Reports HikariCP pool usage when available</li>
 * </ul>
 */
public class EventStoreHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;

    public EventStoreHealthIndicator(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, null);
    }

    public EventStoreHealthIndicator(JdbcTemplate jdbcTemplate, DataSource dataSource) {
        this.jdbcTemplate = jdbcTemplate;
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

            Boolean schemaExists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = 'ordersession')",
                Boolean.class
            );
            if (!Boolean.TRUE.equals(schemaExists)) {
                return Health.down()
                    .withDetail("error", "ordersession schema not found")
                    .build();
            }

            Long streams = jdbcTemplate.queryForObject(
                "SELECT COUNT(DISTINCT stream_id) FROM ordersession.event",
                Long.class
            );
            Long lastPosition = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(global_position), 0) FROM ordersession.event",
                Long.class
            );

            Health.Builder builder = Health.up()
                .withDetail("schema", "ordersession")
                .withDetail("streams", streams != null ? streams : 0L)
                .withDetail("lastGlobalPosition", lastPosition != null ? lastPosition : 0L);

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
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
