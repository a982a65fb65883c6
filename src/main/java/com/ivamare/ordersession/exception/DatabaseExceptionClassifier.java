package com.ivamare.ordersession.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a storage failure is transient, meaning a later attempt may succeed.
 *
 * <p>Used by the JDBC stores to tag {@link StorageFailureException}s so callers can
 * tell a flapping database apart from a broken query.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
        // Utility class - no instantiation
    }

    /**
     * PostgreSQL SQL states for connection loss (08), resource exhaustion (53),
     * operator intervention (57) and rolled-back transactions (40).
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57014",  // query_canceled (statement timeout)
        "57P01", "57P02", "57P03",
        "40001", "40P01"
    );

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "read timed out",
        "connection is not available",
        "pool exhausted",
        "broken pipe",
        "terminating connection",
        "server closed the connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down",
        "canceling statement due to statement timeout"
    };

    /**
     * Determine if the exception, or anything in its cause chain, is transient.
     *
     * @param ex the exception to classify, may be null
     * @return true if a retry may succeed
     */
    public static boolean isTransient(Throwable ex) {
        return transientReason(ex).isPresent();
    }

    /**
     * Whether the exception chain contains a statement or query timeout.
     *
     * @param ex the exception to inspect
     * @return true for timeouts
     */
    public static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof QueryTimeoutException || current instanceof SQLTimeoutException) {
                return true;
            }
            if (current instanceof SQLException sqlEx && "57014".equals(sqlEx.getSQLState())) {
                return true;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }

    /**
     * Get the SQL state from the first {@link SQLException} in the chain.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        if (ex == null) {
            return null;
        }
        if (ex instanceof SQLException sqlEx) {
            return sqlEx.getSQLState();
        }
        if (ex.getCause() != null && ex.getCause() != ex) {
            return getSqlState(ex.getCause());
        }
        return null;
    }

    /**
     * Describe why the exception counts as transient, for logging.
     *
     * @param ex the exception to describe
     * @return the reason, or empty when the failure is not transient
     */
    public static Optional<String> transientReason(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            String reason = directReason(current);
            if (reason != null) {
                return Optional.of(reason);
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return Optional.empty();
    }

    private static String directReason(Throwable ex) {
        // Subclasses first so each branch stays reachable
        if (ex instanceof CannotGetJdbcConnectionException) {
            return "Spring CannotGetJdbcConnectionException";
        }
        if (ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            return "Spring " + ex.getClass().getSimpleName();
        }
        if (ex instanceof SQLTransientException
                || ex instanceof SQLRecoverableException
                || ex instanceof SQLNonTransientConnectionException) {
            return "JDBC " + ex.getClass().getSimpleName();
        }
        if (ex instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return "SQL state " + sqlState;
            }
        }

        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }
        return null;
    }
}
