package com.ivamare.eventsourcing.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies storage failures.
 *
 * <p>Two questions matter to the event store and the scheduler:
 * <ul>
 *   <li>did the write lose the (aggregateId, sequenceNumber) race? Those become
 *       {@link ConcurrencyException}s</li>
 *   <li>is the database temporarily unreachable? Those make the scheduler worker back off</li>
 * </ul>
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
    }

    /** PostgreSQL unique_violation. */
    public static final String UNIQUE_VIOLATION = "23505";

    /**
     * PostgreSQL SQL states that indicate a transient condition.
     * <ul>
     *   <li>08xxx - Connection exceptions</li>
     *   <li>53xxx - Insufficient resources</li>
     *   <li>57xxx - Operator intervention (shutdown)</li>
     *   <li>40xxx - Transaction rollback (serialization, deadlock)</li>
     * </ul>
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57P01", "57P02", "57P03", "57P04",
        "40001", "40P01"
    );

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "socket timeout",
        "read timed out",
        "connection is not available",
        "pool exhausted",
        "connection closed",
        "broken pipe",
        "terminating connection",
        "server closed the connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    };

    /**
     * Determine whether the failure is a primary-key or unique-index violation.
     *
     * @param ex the exception to classify
     * @return true for duplicate keys
     */
    public static boolean isUniqueViolation(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof DuplicateKeyException) {
                return true;
            }
            if (current instanceof SQLException sqlEx && UNIQUE_VIOLATION.equals(sqlEx.getSQLState())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Determine if the exception is transient and the operation may succeed later.
     *
     * @param ex the exception to classify
     * @return true if the exception is transient
     */
    public static boolean isTransient(Throwable ex) {
        return !"Unknown".equals(getTransientReason(ex));
    }

    /**
     * Get the SQL state from an exception if available.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        if (ex instanceof SQLException sqlEx) {
            return sqlEx.getSQLState();
        }
        if (ex.getCause() != null && ex.getCause() != ex) {
            return getSqlState(ex.getCause());
        }
        return null;
    }

    /**
     * Get a brief description of why the exception was classified as transient.
     *
     * @param ex the exception to describe
     * @return the transient condition, or "Unknown" if not transient
     */
    public static String getTransientReason(Throwable ex) {
        if (ex == null) {
            return "Unknown";
        }

        // Subclasses before parents
        if (ex instanceof CannotGetJdbcConnectionException) {
            return "Spring CannotGetJdbcConnectionException";
        }
        if (ex instanceof TransientDataAccessException || ex instanceof RecoverableDataAccessException) {
            return "Spring " + ex.getClass().getSimpleName();
        }
        if (ex instanceof DataAccessResourceFailureException) {
            return "Spring DataAccessResourceFailureException";
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

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return getTransientReason(cause);
        }
        return "Unknown";
    }
}
