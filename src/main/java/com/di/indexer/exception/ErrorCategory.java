package com.di.indexer.exception;

import com.di.indexer.bundle.BundleException;
import com.di.indexer.contentstore.ContentStoreException;
import com.di.indexer.ledger.AbiDecodingException;
import com.di.indexer.ledger.LedgerException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories for loop logging, metrics and REST error bodies.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and decide whether it is {@link #isRetryable() retryable}.
 */
public enum ErrorCategory {

    LEDGER_ERROR("Ledger error", "Ledger node unreachable or returned an error", true),
    CONTENT_STORE_ERROR("Content store error", "Content store unreachable or returned an error", true),
    BUNDLE_ERROR("Bundle error", "Bundle missing, malformed or failing verification", false),
    DECODE_ERROR("Decode error", "Attestation payload does not match its schema", false),
    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection", true),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed", false),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error", false),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back", true),
    DATABASE_ERROR("Database error", "General database operation error", true),
    NETWORK_ERROR("Network error", "Network communication failure", true),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit", true),
    VALIDATION_ERROR("Validation error", "Input validation or state rule violation", false),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue", false),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure", false),
    APPLICATION_ERROR("Application error", "General application error", false),
    UNKNOWN("Unknown error", "Unclassified or unknown error type", false);

    private final String  name;
    private final String  description;
    private final boolean retryable;

    ErrorCategory(String name, String description, boolean retryable) {
        this.name = name;
        this.description = description;
        this.retryable = retryable;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Whether the ingestion loop should back off and try the same window again. */
    public boolean isRetryable() {
        return retryable;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof LedgerException, LEDGER_ERROR);
        MATCHERS.put(t -> t instanceof ContentStoreException, CONTENT_STORE_ERROR);
        MATCHERS.put(t -> t instanceof BundleException, BUNDLE_ERROR);
        MATCHERS.put(t -> t instanceof AbiDecodingException, DECODE_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        if (exception instanceof DataAccessException dae) {
            return categorizeDataAccess(dae);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeDataAccess(DataAccessException dae) {
        Throwable root = dae.getMostSpecificCause();
        if (root instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        if (dae instanceof DataAccessResourceFailureException) return CONNECTION_ERROR;
        if (dae instanceof DataIntegrityViolationException)   return CONSTRAINT_VIOLATION;
        if (dae instanceof TransientDataAccessException)      return TRANSACTION_ROLLBACK;
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
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof java.io.IOException && !(t instanceof java.io.FileNotFoundException));
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timed out", "timeout");
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof JsonProcessingException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
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
