package com.firesql.store;

import java.util.Objects;

/**
 * A filter pushed down to the document store.
 */
public class StoreFilter {
    private final String field;
    private final StoreOperator operator;
    private final Object value;

    public StoreFilter(String field, StoreOperator operator, Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public StoreOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreFilter)) {
            return false;
        }
        StoreFilter that = (StoreFilter) o;
        return field.equals(that.field) && operator == that.operator && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator.getSymbol() + " " + value;
    }
}
