package com.firesql.query;

/**
 * Where a query is executed.
 */
public enum ExecutionPath {

    /**
     * Parsed into a {@link QueryPlan} and executed by the in-memory engine.
     */
    NATIVE,

    /**
     * Passed verbatim to the general-purpose SQL executor.
     */
    DELEGATED
}
