package com.firesql.query;

import java.util.Objects;

/**
 * Represents a WHERE filter evaluated in memory (field op value).
 * The field may be a dotted nested path.
 */
public class FilterInfo {
    private final String field;
    private final FilterOperator operator;
    private final String value;

    public FilterInfo(String field, FilterOperator operator, String value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterInfo)) {
            return false;
        }
        FilterInfo that = (FilterInfo) o;
        return field.equals(that.field) && operator == that.operator && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
