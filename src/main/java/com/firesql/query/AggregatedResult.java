package com.firesql.query;

import com.firesql.domain.FieldValue;

import java.util.ArrayList;
import java.util.List;

/**
 * One output row of an aggregating query: a value per group-by field, a value
 * per aggregate, and the number used to order rows.
 */
public class AggregatedResult {
    private final List<FieldValue> groupValues = new ArrayList<>();
    private final List<Double> aggregateValues = new ArrayList<>();
    private double sortValue;

    public List<FieldValue> getGroupValues() {
        return groupValues;
    }

    public List<Double> getAggregateValues() {
        return aggregateValues;
    }

    public double getSortValue() {
        return sortValue;
    }

    public void setSortValue(double sortValue) {
        this.sortValue = sortValue;
    }

    @Override
    public String toString() {
        return "AggregatedResult{groups=" + groupValues + ", aggregates=" + aggregateValues
            + ", sort=" + sortValue + "}";
    }
}
