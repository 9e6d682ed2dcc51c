package com.firesql.store;

import com.firesql.domain.ErrorStatus;
import com.firesql.query.QueryExecutionException;

/**
 * Retrieval from the document store failed. Reported as a bad request and not retried.
 */
public class StoreException extends QueryExecutionException {

    public StoreException(String message) {
        super(message, ErrorStatus.BAD_REQUEST);
    }

    public StoreException(String message, Throwable cause) {
        super(message, ErrorStatus.BAD_REQUEST, cause);
    }
}
