package com.firesql.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Represents the parsed form of a SQL-subset query.
 *
 * A plan with group-by fields or aggregates is an aggregating plan: its ordering
 * and limit apply to the aggregated rows, never to the retrieved documents.
 */
public class QueryPlan {
    private String collection;
    private final List<String> fields = new ArrayList<>();
    private String timeField;
    private final List<FilterInfo> additionalFilters = new ArrayList<>();
    private String orderField;
    private SortDirection orderDirection = SortDirection.ASC;
    private int limit;
    private final List<String> groupByFields = new ArrayList<>();
    private final List<AggregateInfo> aggregateFields = new ArrayList<>();

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public List<String> getFields() {
        return fields;
    }

    public void addField(String field) {
        fields.add(field);
    }

    public String getTimeField() {
        return timeField;
    }

    public void setTimeField(String timeField) {
        this.timeField = timeField;
    }

    public boolean hasTimeField() {
        return timeField != null && !timeField.isEmpty();
    }

    public List<FilterInfo> getAdditionalFilters() {
        return additionalFilters;
    }

    public void addFilter(FilterInfo filter) {
        additionalFilters.add(filter);
    }

    public String getOrderField() {
        return orderField;
    }

    public void setOrderField(String orderField) {
        this.orderField = orderField;
    }

    public boolean hasOrderField() {
        return orderField != null && !orderField.isEmpty();
    }

    public SortDirection getOrderDirection() {
        return orderDirection;
    }

    public void setOrderDirection(SortDirection orderDirection) {
        this.orderDirection = orderDirection;
    }

    /**
     * Row limit, 0 meaning unbounded.
     */
    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = Math.max(limit, 0);
    }

    public List<String> getGroupByFields() {
        return groupByFields;
    }

    public void addGroupByField(String field) {
        groupByFields.add(field);
    }

    public List<AggregateInfo> getAggregateFields() {
        return aggregateFields;
    }

    public void addAggregate(AggregateInfo aggregate) {
        aggregateFields.add(aggregate);
    }

    public boolean isAggregating() {
        return !groupByFields.isEmpty() || !aggregateFields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryPlan)) {
            return false;
        }
        QueryPlan that = (QueryPlan) o;
        return limit == that.limit
            && Objects.equals(collection, that.collection)
            && fields.equals(that.fields)
            && Objects.equals(timeField, that.timeField)
            && additionalFilters.equals(that.additionalFilters)
            && Objects.equals(orderField, that.orderField)
            && orderDirection == that.orderDirection
            && groupByFields.equals(that.groupByFields)
            && aggregateFields.equals(that.aggregateFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, fields, timeField, additionalFilters, orderField,
            orderDirection, limit, groupByFields, aggregateFields);
    }

    @Override
    public String toString() {
        return "QueryPlan{collection=" + collection
            + ", fields=" + fields
            + ", timeField=" + timeField
            + ", filters=" + additionalFilters
            + ", orderField=" + orderField + " " + orderDirection
            + ", limit=" + limit
            + ", groupBy=" + groupByFields
            + ", aggregates=" + aggregateFields + "}";
    }
}
