package com.firesql.query;

import com.firesql.domain.Document;
import com.firesql.domain.FieldValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * In-memory GROUP BY, aggregate functions, post-aggregation ORDER BY and LIMIT.
 *
 * Groups are kept in a hash map, so row order is unspecified unless the plan orders.
 * MIN, MAX and AVG over a group with no numeric values yield 0.0.
 */
@Component
public class GroupAggregator {

    static final String KEY_SEPARATOR = "|";

    private final QueryDiagnostics diagnostics;

    public GroupAggregator(QueryDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Group, aggregate, order and limit already filtered documents.
     *
     * @param documents documents that passed the WHERE filters
     * @param plan an aggregating plan
     * @return aggregated rows, ordered and limited per the plan
     */
    public List<AggregatedResult> aggregate(List<Document> documents, QueryPlan plan) {
        Map<String, List<Document>> groups = group(documents, plan.getGroupByFields());
        diagnostics.emit("aggregate.grouped", Map.of(
            "documents", documents.size(),
            "groups", groups.size()));

        List<AggregatedResult> results = new ArrayList<>(groups.size());
        for (List<Document> members : groups.values()) {
            AggregatedResult result = new AggregatedResult();

            Document representative = members.get(0);
            for (String groupField : plan.getGroupByFields()) {
                result.getGroupValues().add(representative.resolve(groupField));
            }
            for (AggregateInfo aggregate : plan.getAggregateFields()) {
                result.getAggregateValues().add(compute(aggregate, members));
            }

            if (plan.hasOrderField()) {
                resolveSortValue(result, plan);
            }
            results.add(result);
        }

        if (plan.hasOrderField()) {
            recoverSortValues(results, plan);
            sort(results, plan.getOrderDirection());
        }

        if (plan.getLimit() > 0 && plan.getLimit() < results.size()) {
            diagnostics.emit("aggregate.limited", Map.of(
                "rows", results.size(),
                "limit", plan.getLimit()));
            results = new ArrayList<>(results.subList(0, plan.getLimit()));
        }
        return results;
    }

    static Map<String, List<Document>> group(List<Document> documents, List<String> groupByFields) {
        Map<String, List<Document>> groups = new HashMap<>();
        for (Document document : documents) {
            String key = groupByFields.stream()
                .map(field -> document.resolve(field).asText())
                .collect(Collectors.joining(KEY_SEPARATOR));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(document);
        }
        return groups;
    }

    static double compute(AggregateInfo aggregate, List<Document> members) {
        AggregateFunction function = aggregate.getFunction();
        if (function == AggregateFunction.COUNT) {
            return members.size();
        }

        double sum = 0.0;
        int count = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Document member : members) {
            OptionalDouble value = member.resolve(aggregate.getField()).toDouble();
            if (value.isEmpty()) {
                continue;
            }
            double v = value.getAsDouble();
            sum += v;
            count++;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        switch (function) {
            case SUM:
                return sum;
            case AVG:
                return count > 0 ? sum / count : 0.0;
            case MIN:
                return count > 0 ? min : 0.0;
            case MAX:
                return count > 0 ? max : 0.0;
            default:
                return 0.0;
        }
    }

    /**
     * Pick the sort value. An aggregate alias match on any aggregate wins over a
     * lower-cased function name match, which wins over a cleaned alias match.
     * Failing all three, a matching group-by field coerced to a number is used.
     * Unmatched leaves 0.
     */
    static void resolveSortValue(AggregatedResult result, QueryPlan plan) {
        String orderField = plan.getOrderField();
        int index = matchAggregate(orderField, plan.getAggregateFields(), true);
        if (index >= 0) {
            result.setSortValue(result.getAggregateValues().get(index));
            return;
        }

        List<String> groupByFields = plan.getGroupByFields();
        for (int i = 0; i < groupByFields.size(); i++) {
            if (orderField.equals(groupByFields.get(i))) {
                OptionalDouble value = result.getGroupValues().get(i).toDouble();
                if (value.isPresent()) {
                    result.setSortValue(value.getAsDouble());
                }
                return;
            }
        }
    }

    /**
     * Second matching pass for rows still at the zero default, by alias then
     * function name. A row whose real aggregate value is 0 is indistinguishable
     * from an unmatched one here.
     */
    static void recoverSortValues(List<AggregatedResult> results, QueryPlan plan) {
        int index = matchAggregate(plan.getOrderField(), plan.getAggregateFields(), false);
        if (index < 0) {
            return;
        }
        for (AggregatedResult result : results) {
            if (result.getSortValue() == 0) {
                result.setSortValue(result.getAggregateValues().get(index));
            }
        }
    }

    /**
     * Index of the aggregate the ORDER BY field names, or -1.
     */
    static int matchAggregate(String orderField, List<AggregateInfo> aggregates, boolean includeColumnName) {
        for (int i = 0; i < aggregates.size(); i++) {
            if (orderField.equals(aggregates.get(i).getAlias())) {
                return i;
            }
        }
        for (int i = 0; i < aggregates.size(); i++) {
            if (orderField.equals(aggregates.get(i).getFunction().lowerName())) {
                return i;
            }
        }
        if (includeColumnName) {
            for (int i = 0; i < aggregates.size(); i++) {
                if (orderField.equals(aggregates.get(i).getColumnName())) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Pairwise exchange sort on the sort value. Group counts are small, and ties
     * keep no particular order.
     */
    static void sort(List<AggregatedResult> results, SortDirection direction) {
        for (int i = 0; i < results.size() - 1; i++) {
            for (int j = i + 1; j < results.size(); j++) {
                double left = results.get(i).getSortValue();
                double right = results.get(j).getSortValue();
                boolean swap = direction == SortDirection.DESC ? left < right : left > right;
                if (swap) {
                    AggregatedResult tmp = results.get(i);
                    results.set(i, results.get(j));
                    results.set(j, tmp);
                }
            }
        }
    }
}
