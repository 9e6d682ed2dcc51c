package com.firesql.query;

import com.firesql.domain.ErrorStatus;

/**
 * Exception thrown when the SELECT/FROM skeleton of a query cannot be parsed.
 * Clause-level problems never raise this; they degrade to plan defaults.
 */
public class QueryParseException extends QueryExecutionException {

    public QueryParseException(String message) {
        super(message, ErrorStatus.BAD_REQUEST);
    }

    public QueryParseException(String message, String query) {
        super(message, ErrorStatus.BAD_REQUEST, query, null);
    }
}
