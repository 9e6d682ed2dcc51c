package com.firesql.store;

import com.firesql.query.SortDirection;

import java.util.Objects;

/**
 * Ordering pushed down to the document store.
 */
public class StoreOrder {
    private final String field;
    private final SortDirection direction;

    public StoreOrder(String field, SortDirection direction) {
        this.field = field;
        this.direction = direction;
    }

    public String getField() {
        return field;
    }

    public SortDirection getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreOrder)) {
            return false;
        }
        StoreOrder that = (StoreOrder) o;
        return field.equals(that.field) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    @Override
    public String toString() {
        return field + " " + direction;
    }
}
