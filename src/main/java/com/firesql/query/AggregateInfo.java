package com.firesql.query;

import java.util.Locale;
import java.util.Objects;

/**
 * Represents an aggregate in the SELECT list, e.g. {@code COUNT(*) as total}.
 * Without an AS clause the alias is the verbatim source expression.
 */
public class AggregateInfo {
    private final AggregateFunction function;
    private final String field;
    private final String alias;

    public AggregateInfo(AggregateFunction function, String field, String alias) {
        this.function = function;
        this.field = field;
        this.alias = alias;
    }

    public AggregateFunction getFunction() {
        return function;
    }

    public String getField() {
        return field;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Alias stripped of function syntax: the name after {@code AS} when the raw
     * alias still carries one, or the lower-cased function name when the alias
     * is the bare expression such as {@code COUNT(*)}.
     */
    public String getColumnName() {
        if (alias == null || !(alias.contains("(") && alias.contains(")"))) {
            return alias;
        }
        if (alias.toUpperCase(Locale.ROOT).contains(" AS ")) {
            String[] parts = alias.split(" ");
            for (int i = 0; i < parts.length - 1; i++) {
                if (parts[i].equalsIgnoreCase("AS")) {
                    return parts[i + 1];
                }
            }
        }
        return function.lowerName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateInfo)) {
            return false;
        }
        AggregateInfo that = (AggregateInfo) o;
        return function == that.function && Objects.equals(field, that.field) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, field, alias);
    }

    @Override
    public String toString() {
        return function + "(" + field + ") as " + alias;
    }
}
