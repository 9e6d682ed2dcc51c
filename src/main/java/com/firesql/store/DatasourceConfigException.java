package com.firesql.store;

import com.firesql.domain.ErrorStatus;
import com.firesql.query.QueryExecutionException;

/**
 * Datasource identity or credentials are missing or invalid.
 */
public class DatasourceConfigException extends QueryExecutionException {

    public DatasourceConfigException(String message) {
        super(message, ErrorStatus.BAD_REQUEST);
    }

    public DatasourceConfigException(String message, Throwable cause) {
        super(message, ErrorStatus.BAD_REQUEST, cause);
    }
}
