package com.firesql.delegate;

import com.firesql.domain.ExecutionResult;
import com.firesql.store.DatasourceSettings;

/**
 * General-purpose executor for queries the native path does not handle.
 * Receives the raw query text unchanged.
 */
public interface SqlExecutor {

    /**
     * Execute a query against the datasource.
     *
     * @param settings datasource identity and credentials
     * @param query raw query text
     * @return column names and row-major records
     * @throws com.firesql.query.QueryExecutionException on parse or store failure
     */
    ExecutionResult execute(DatasourceSettings settings, String query);
}
