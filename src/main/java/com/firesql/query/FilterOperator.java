package com.firesql.query;

/**
 * Operators accepted in manually evaluated WHERE filters. Only equality.
 */
public enum FilterOperator {
    EQ
}
