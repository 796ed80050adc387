package com.di.ingestion.warehouse;

import java.util.Locale;

/**
 * Raised when the warehouse rejects a statement (DDL, copy, merge, count).
 *
 * <p>The message carries the engine error text so it can be written verbatim
 * into the ingestion log.
 */
public class StatementExecutionException extends RuntimeException {

    private final String statementKind;
    private final String sql;

    public StatementExecutionException(String statementKind, String sql, Throwable cause) {
        super(statementKind + " failed: " + rootMessage(cause), cause);
        this.statementKind = statementKind;
        this.sql = sql;
    }

    public StatementExecutionException(String statementKind, String sql, String message) {
        super(statementKind + " failed: " + message);
        this.statementKind = statementKind;
        this.sql = sql;
    }

    public String getStatementKind() {
        return statementKind;
    }

    public String getSql() {
        return sql;
    }

    /** {@code true} when the engine reported that the object or column already exists. */
    public boolean isAlreadyExists() {
        String message = getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("already exists");
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
