package com.cricverse.booking.exception;

import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Classifies storage errors that are worth retrying (lock waits, deadlocks,
 * serialization failures, lost connections) and maps them to PERSISTENCE_FAILURE.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PersistenceFailures {

    // PostgreSQL: lock_not_available, deadlock_detected, serialization_failure, query_canceled; H2: lock timeout
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of("55P03", "40P01", "40001", "57014", "HYT00");

    public static <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            if (isTransient(e)) {
                throw new BusinessException(ErrorCode.PERSISTENCE_FAILURE,
                        "Storage unavailable during " + operation + ": " + rootMessage(e), e);
            }
            throw e;
        }
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TransientDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof SQLTransientException) {
                return true;
            }
            if (current instanceof org.jooq.exception.DataAccessException jooqError
                    && TRANSIENT_SQL_STATES.contains(jooqError.sqlState())) {
                return true;
            }
            if (current instanceof SQLException sqlError
                    && TRANSIENT_SQL_STATES.contains(sqlError.getSQLState())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
