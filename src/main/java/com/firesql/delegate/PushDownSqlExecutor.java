package com.firesql.delegate;

import com.firesql.domain.Document;
import com.firesql.domain.ExecutionResult;
import com.firesql.query.QueryParseException;
import com.firesql.query.SortDirection;
import com.firesql.query.SqlClauses;
import com.firesql.query.SqlClauses.Clause;
import com.firesql.store.DatasourceSettings;
import com.firesql.store.DocumentStore;
import com.firesql.store.DocumentStoreFactory;
import com.firesql.store.StoreFilter;
import com.firesql.store.StoreOperator;
import com.firesql.store.StoreOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Executes non-aggregating queries by translating them entirely into a store query.
 *
 * Supported form:
 * {@code SELECT <fields | *> FROM collection [WHERE a op v AND ...] [ORDER BY f [ASC|DESC]] [LIMIT n]}
 * where {@code op} is one of {@code = == != <> < <= > >=}. Literals are typed:
 * quoted text is a string, {@code true}/{@code false} a boolean, integers are
 * {@code Long} and decimals {@code Double}.
 */
@Component
public class PushDownSqlExecutor implements SqlExecutor {
    private static final Logger logger = LoggerFactory.getLogger(PushDownSqlExecutor.class);

    private static final String WILDCARD = "*";

    private static final Pattern AND = Pattern.compile("\\sand\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONDITION = Pattern.compile(
        "^`?([^\\s`=!<>]+)`?\\s*(==|!=|<>|<=|>=|=|<|>)\\s*(.+)$");
    private static final Pattern AGGREGATE = Pattern.compile(
        "\\b(count|sum|avg|min|max)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

    private final DocumentStoreFactory storeFactory;

    public PushDownSqlExecutor(DocumentStoreFactory storeFactory) {
        this.storeFactory = storeFactory;
    }

    @Override
    public ExecutionResult execute(DatasourceSettings settings, String query) {
        SqlClauses clauses = SqlClauses.split(query);
        if (clauses.has(Clause.GROUP_BY) || AGGREGATE.matcher(clauses.getSelectList()).find()) {
            throw new QueryParseException("aggregations are not supported on this query path", query);
        }

        List<String> fields = selectFields(clauses.getSelectList(), query);
        String collection = firstToken(clauses.getFrom());
        if (collection.isEmpty()) {
            throw new QueryParseException("missing collection name", query);
        }

        List<StoreFilter> filters = new ArrayList<>();
        Optional<String> where = clauses.get(Clause.WHERE);
        if (where.isPresent()) {
            for (String condition : AND.split(where.get())) {
                if (!condition.isBlank()) {
                    filters.add(parseCondition(condition.trim(), query));
                }
            }
        }

        StoreOrder order = clauses.get(Clause.ORDER_BY).map(text -> parseOrder(text, query)).orElse(null);
        int limit = clauses.get(Clause.LIMIT).map(text -> parseLimit(text, query)).orElse(0);

        logger.debug("Delegated query on {}: filters={}, order={}, limit={}", collection, filters, order, limit);
        DocumentStore store = storeFactory.connect(settings);
        List<Document> documents = store.query(collection, filters, order, limit);

        List<String> columns = fields.contains(WILDCARD) ? expandColumns(fields, documents) : fields;
        List<List<Object>> records = new ArrayList<>(documents.size());
        for (Document document : documents) {
            List<Object> record = new ArrayList<>(columns.size());
            for (String column : columns) {
                record.add(document.resolve(column).raw());
            }
            records.add(record);
        }
        return new ExecutionResult(columns, records);
    }

    private static List<String> selectFields(String selectList, String query) {
        List<String> fields = new ArrayList<>();
        for (String raw : selectList.split(",")) {
            String field = stripBackticks(raw.trim());
            if (!field.isEmpty()) {
                fields.add(field);
            }
        }
        if (fields.isEmpty()) {
            throw new QueryParseException("empty SELECT list", query);
        }
        return fields;
    }

    /**
     * Wildcards expand to the sorted union of top-level keys; explicit fields keep their place.
     */
    static List<String> expandColumns(List<String> fields, List<Document> documents) {
        Set<String> keys = new TreeSet<>();
        for (Document document : documents) {
            keys.addAll(document.fieldNames());
        }
        List<String> columns = new ArrayList<>();
        for (String field : fields) {
            if (WILDCARD.equals(field)) {
                for (String key : keys) {
                    if (!columns.contains(key)) {
                        columns.add(key);
                    }
                }
            } else if (!columns.contains(field)) {
                columns.add(field);
            }
        }
        return columns;
    }

    static StoreFilter parseCondition(String condition, String query) {
        Matcher m = CONDITION.matcher(condition);
        if (!m.matches()) {
            throw new QueryParseException("unsupported condition: " + condition, query);
        }
        StoreOperator operator = StoreOperator.fromSql(m.group(2));
        return new StoreFilter(m.group(1), operator, parseLiteral(m.group(3).trim(), query));
    }

    static Object parseLiteral(String literal, String query) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        String lower = literal.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return Boolean.valueOf(lower);
        }
        if (INTEGER.matcher(literal).matches()) {
            try {
                return Long.parseLong(literal);
            } catch (NumberFormatException e) {
                throw new QueryParseException("integer literal out of range: " + literal, query);
            }
        }
        if (DECIMAL.matcher(literal).matches()) {
            return Double.parseDouble(literal);
        }
        throw new QueryParseException("unsupported literal: " + literal, query);
    }

    private static StoreOrder parseOrder(String text, String query) {
        String[] tokens = text.trim().split("\\s+");
        if (tokens.length == 0 || tokens[0].isEmpty()) {
            throw new QueryParseException("empty ORDER BY", query);
        }
        SortDirection direction = SortDirection.ASC;
        if (tokens.length > 1) {
            if (tokens[1].equalsIgnoreCase("DESC")) {
                direction = SortDirection.DESC;
            } else if (!tokens[1].equalsIgnoreCase("ASC")) {
                throw new QueryParseException("unsupported ORDER BY: " + text, query);
            }
        }
        return new StoreOrder(stripBackticks(tokens[0]), direction);
    }

    private static int parseLimit(String text, String query) {
        String token = firstToken(text);
        try {
            int limit = Integer.parseInt(token);
            if (limit < 0) {
                throw new QueryParseException("invalid LIMIT: " + token, query);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new QueryParseException("invalid LIMIT: " + token, query);
        }
    }

    private static String firstToken(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? "" : trimmed.split("\\s+")[0];
    }

    private static String stripBackticks(String field) {
        if (field.length() >= 2 && field.startsWith("`") && field.endsWith("`")) {
            return field.substring(1, field.length() - 1);
        }
        return field;
    }
}
