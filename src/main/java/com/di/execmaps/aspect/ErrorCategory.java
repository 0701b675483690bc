package com.di.execmaps.aspect;

import com.di.execmaps.error.OperationCancelledException;
import com.di.execmaps.error.ParameterExpansionException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories for map-operation logging and metric tags.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Categorizing never changes what is thrown to the caller.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    DATABASE_ERROR("Database error", "General database operation error"),
    PARAMETER_EXPANSION("Parameter expansion error", "Key set could not be expanded into bind parameters"),
    CANCELLED("Cancelled", "Operation was cancelled by the caller"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded its deadline"),
    VALIDATION_ERROR("Validation error", "Invalid arguments, e.g. a batch spanning physical shards"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof OperationCancelledException, CANCELLED);
        MATCHERS.put(t -> t instanceof ParameterExpansionException, PARAMETER_EXPANSION);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "57", TIMEOUT_ERROR
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        if (exception instanceof DataAccessException dae) {
            return categorizeDataAccessException(dae);
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeDataAccessException(DataAccessException dae) {
        SQLException sqlEx = findSqlException(dae);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        if (dae instanceof DataAccessResourceFailureException) {
            return CONNECTION_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "duplicate")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static SQLException findSqlException(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof SQLException sqlEx) {
                return sqlEx;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof QueryTimeoutException
                || t instanceof java.util.concurrent.TimeoutException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof NullPointerException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof IllegalStateException
                || t instanceof org.springframework.beans.factory.BeanCreationException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
