package com.firesql.query;

import java.util.Locale;

/**
 * Aggregate functions computed by the in-memory grouping engine.
 */
public enum AggregateFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX;

    /**
     * Lower-cased name, also used as the column name of an unaliased aggregate.
     */
    public String lowerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
