package com.firesql.query;

import com.firesql.domain.ErrorStatus;

/**
 * Exception thrown when a query cannot be executed.
 * Carries the status the failure is reported with and, where known, the query text.
 */
public class QueryExecutionException extends RuntimeException {

    private final ErrorStatus status;
    private final String query;

    public QueryExecutionException(String message, ErrorStatus status) {
        super(message);
        this.status = status;
        this.query = null;
    }

    public QueryExecutionException(String message, ErrorStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.query = null;
    }

    public QueryExecutionException(String message, ErrorStatus status, String query, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.query = query;
    }

    public ErrorStatus getStatus() {
        return status;
    }

    public String getQuery() {
        return query;
    }
}
