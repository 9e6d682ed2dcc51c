package com.firesql.query;

import com.firesql.domain.ErrorStatus;

import java.time.Duration;

/**
 * Delegated execution did not finish before its deadline.
 */
public class QueryTimeoutException extends QueryExecutionException {

    public QueryTimeoutException(Duration timeout, Throwable cause) {
        super("query execution timeout after " + timeout.getSeconds() + " seconds",
            ErrorStatus.INTERNAL, cause);
    }
}
