package com.firesql.query;

import com.firesql.query.SqlClauses.Clause;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hand-rolled parser for the SQL subset
 * {@code SELECT fields FROM collection [WHERE ...] [GROUP BY ...] [ORDER BY ...] [LIMIT n]}.
 *
 * Only the SELECT/FROM skeleton is strict. A malformed LIMIT becomes "no limit",
 * WHERE conditions without an equality operator are dropped, and time-range
 * conditions on {@code $__from}/{@code $__to} only mark the plan's time field.
 */
@Component
public class QueryParser {

    static final String FROM_VARIABLE = "$__from";
    static final String TO_VARIABLE = "$__to";

    private static final String[] AGGREGATE_MARKERS = {"COUNT(", "SUM(", "AVG(", "MIN(", "MAX("};

    // Case-sensitive on purpose: lower-case "and" does not split conditions.
    private static final Pattern CONDITION_SEPARATOR = Pattern.compile("\\sAND\\s");

    private static final Pattern TIME_CONDITION = Pattern.compile(
        "([^\\s<>=]+)\\s*(>=|<=|>|<)\\s*\\S*\\$__(?:from|to)");

    private final QueryDiagnostics diagnostics;

    public QueryParser(QueryDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Parse a query into a plan.
     *
     * @param query the query text
     * @return the parsed plan
     * @throws QueryParseException if SELECT or FROM is missing
     */
    public QueryPlan parse(String query) throws QueryParseException {
        SqlClauses clauses = SqlClauses.split(query);
        QueryPlan plan = new QueryPlan();

        parseSelectList(clauses.getSelectList(), plan);
        plan.setCollection(firstToken(clauses.getFrom()));

        clauses.get(Clause.WHERE).ifPresent(where -> parseWhere(where, plan));
        clauses.get(Clause.GROUP_BY).ifPresent(groupBy -> parseGroupBy(groupBy, plan));
        clauses.get(Clause.ORDER_BY).ifPresent(orderBy -> parseOrderBy(orderBy, plan));
        clauses.get(Clause.LIMIT).ifPresent(limit -> parseLimit(limit, plan));

        // Grouped columns come out of the aggregation, not the plain field list
        plan.getFields().removeAll(plan.getGroupByFields());

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("collection", plan.getCollection());
        attributes.put("fields", plan.getFields());
        attributes.put("timeField", plan.getTimeField());
        attributes.put("filters", plan.getAdditionalFilters().size());
        attributes.put("groupBy", plan.getGroupByFields());
        attributes.put("aggregates", plan.getAggregateFields().size());
        attributes.put("limit", plan.getLimit());
        diagnostics.emit("parse.complete", attributes);
        return plan;
    }

    /**
     * Split a SELECT list on commas outside parentheses and classify each entry.
     */
    void parseSelectList(String selectList, QueryPlan plan) {
        for (String raw : splitTopLevel(selectList)) {
            String field = raw.trim();
            if (field.isEmpty()) {
                continue;
            }
            if (field.equals("*")) {
                plan.addField("*");
                continue;
            }

            AggregateFunction function = aggregateFunction(field);
            if (function != null) {
                plan.addAggregate(parseAggregate(field, function));
            } else {
                plan.addField(stripBackticks(field));
            }
        }
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * The aggregate function a SELECT entry uses, or null for a plain field.
     * A leading function name wins; otherwise the earliest one in the text.
     */
    private static AggregateFunction aggregateFunction(String field) {
        String upper = field.toUpperCase(Locale.ROOT);
        AggregateFunction earliest = null;
        int earliestIndex = Integer.MAX_VALUE;
        for (String marker : AGGREGATE_MARKERS) {
            int index = upper.indexOf(marker);
            if (index == 0) {
                return functionFor(marker);
            }
            if (index > 0 && index < earliestIndex) {
                earliestIndex = index;
                earliest = functionFor(marker);
            }
        }
        return earliest;
    }

    private static AggregateFunction functionFor(String marker) {
        return AggregateFunction.valueOf(marker.substring(0, marker.length() - 1));
    }

    private static AggregateInfo parseAggregate(String field, AggregateFunction function) {
        String argument = "";
        int open = field.indexOf('(');
        int close = field.indexOf(')');
        if (open != -1 && close > open) {
            argument = field.substring(open + 1, close).trim();
        }

        String alias = field;
        int asPos = field.toUpperCase(Locale.ROOT).indexOf(" AS ");
        if (asPos != -1) {
            alias = field.substring(asPos + 4).trim();
        }
        return new AggregateInfo(function, argument, alias);
    }

    void parseWhere(String where, QueryPlan plan) {
        for (String raw : CONDITION_SEPARATOR.split(where)) {
            String condition = raw.trim();
            if (condition.isEmpty()) {
                continue;
            }
            if (condition.contains(FROM_VARIABLE) || condition.contains(TO_VARIABLE)) {
                markTimeField(condition, plan);
                continue;
            }

            FilterInfo filter = parseEquality(condition);
            if (filter == null) {
                diagnostics.emit("parse.where.dropped", Map.of("condition", condition));
            } else {
                plan.addFilter(filter);
            }
        }
    }

    private void markTimeField(String condition, QueryPlan plan) {
        if (plan.hasTimeField()) {
            return;
        }
        Matcher m = TIME_CONDITION.matcher(condition);
        if (m.find()) {
            plan.setTimeField(stripBackticks(m.group(1)));
            diagnostics.emit("parse.where.time", Map.of("field", plan.getTimeField()));
        }
    }

    /**
     * Parse {@code field = value} or {@code field == value}; anything else yields null.
     */
    private static FilterInfo parseEquality(String condition) {
        int eq = condition.indexOf('=');
        if (eq < 0) {
            return null;
        }
        String left = condition.substring(0, eq);
        if (left.endsWith("!") || left.endsWith("<") || left.endsWith(">") || left.contains("<>")) {
            return null;
        }

        String field = stripBackticks(left.trim());
        if (field.isEmpty() || field.contains("<") || field.contains(">")) {
            return null;
        }
        int valueStart = condition.startsWith("==", eq) ? eq + 2 : eq + 1;
        String value = stripQuotes(condition.substring(valueStart).trim());
        return new FilterInfo(field, FilterOperator.EQ, value);
    }

    void parseGroupBy(String groupBy, QueryPlan plan) {
        for (String raw : groupBy.split(",")) {
            String field = stripBackticks(raw.trim());
            if (!field.isEmpty()) {
                plan.addGroupByField(field);
            }
        }
    }

    void parseOrderBy(String orderBy, QueryPlan plan) {
        String[] tokens = orderBy.trim().split("\\s+");
        if (tokens.length == 0 || tokens[0].isEmpty()) {
            return;
        }
        String field = tokens[0];
        if (field.endsWith(",")) {
            field = field.substring(0, field.length() - 1);
        }
        plan.setOrderField(stripBackticks(field));
        plan.setOrderDirection(tokens.length >= 2 && tokens[1].equalsIgnoreCase("DESC")
            ? SortDirection.DESC
            : SortDirection.ASC);
    }

    void parseLimit(String limit, QueryPlan plan) {
        String token = firstToken(limit);
        try {
            plan.setLimit(Integer.parseInt(token));
        } catch (NumberFormatException e) {
            diagnostics.emit("parse.limit.ignored", Map.of("limit", token));
            plan.setLimit(0);
        }
    }

    private static String firstToken(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.split("\\s+")[0];
    }

    static String stripBackticks(String field) {
        int start = 0;
        int end = field.length();
        while (start < end && field.charAt(start) == '`') {
            start++;
        }
        while (end > start && field.charAt(end - 1) == '`') {
            end--;
        }
        return field.substring(start, end);
    }

    static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }
}
