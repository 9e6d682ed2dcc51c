package com.firesql.query;

/**
 * ORDER BY direction, ascending unless DESC is given.
 */
public enum SortDirection {
    ASC,
    DESC;

    public boolean isAscending() {
        return this == ASC;
    }
}
