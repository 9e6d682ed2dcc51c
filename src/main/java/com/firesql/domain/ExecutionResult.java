package com.firesql.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Row-major result of a delegated execution: column names and one record per row.
 */
public class ExecutionResult {

    private final List<String> columns;
    private final List<List<Object>> records;

    public ExecutionResult(List<String> columns, List<List<Object>> records) {
        this.columns = columns != null ? columns : new ArrayList<>();
        this.records = records != null ? records : new ArrayList<>();
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRecords() {
        return records;
    }

    /**
     * Copy holding at most {@code maxRows} records.
     */
    public ExecutionResult truncate(int maxRows) {
        if (records.size() <= maxRows) {
            return this;
        }
        return new ExecutionResult(columns, new ArrayList<>(records.subList(0, maxRows)));
    }
}
