package com.firesql.query;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a SQL-subset query into its clause texts.
 *
 * Keywords are matched case-insensitively and may be preceded by any whitespace,
 * so clauses can start on a new line or after tabs. A clause ends at the nearest
 * following keyword, in whatever order the clauses appear.
 */
public final class SqlClauses {

    /**
     * Optional clauses following FROM.
     */
    public enum Clause {
        WHERE("\\swhere\\s"),
        GROUP_BY("\\sgroup\\s+by\\s"),
        ORDER_BY("\\sorder\\s+by\\s"),
        LIMIT("\\slimit\\s");

        private final Pattern pattern;

        Clause(String regex) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }
    }

    static final String MISSING_SELECT_OR_FROM = "missing SELECT or FROM";

    private static final Pattern SELECT = Pattern.compile("select\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern FROM = Pattern.compile("\\sfrom\\s", Pattern.CASE_INSENSITIVE);

    private final String selectList;
    private final String from;
    private final Map<Clause, String> clauses;

    private SqlClauses(String selectList, String from, Map<Clause, String> clauses) {
        this.selectList = selectList;
        this.from = from;
        this.clauses = clauses;
    }

    /**
     * Split a query into clauses.
     *
     * @throws QueryParseException when SELECT or FROM cannot be located
     */
    public static SqlClauses split(String query) {
        String text = query == null ? "" : query.trim();

        Matcher select = SELECT.matcher(text);
        Matcher from = FROM.matcher(text);
        if (!select.find() || !from.find(select.end() - 1)) {
            throw new QueryParseException(MISSING_SELECT_OR_FROM, query);
        }
        int fromBody = from.end();

        Map<Clause, Integer> starts = new EnumMap<>(Clause.class);
        Map<Clause, Integer> bodies = new EnumMap<>(Clause.class);
        for (Clause clause : Clause.values()) {
            Matcher m = clause.pattern.matcher(text);
            if (m.find(fromBody - 1)) {
                starts.put(clause, m.start());
                bodies.put(clause, m.end());
            }
        }

        String fromText = slice(text, fromBody, boundaryAfter(from.start(), starts, text.length()));

        Map<Clause, String> clauseTexts = new EnumMap<>(Clause.class);
        for (Map.Entry<Clause, Integer> entry : starts.entrySet()) {
            int end = boundaryAfter(entry.getValue(), starts, text.length());
            clauseTexts.put(entry.getKey(), slice(text, bodies.get(entry.getKey()), end));
        }

        String selectText = slice(text, select.end(), from.start());
        return new SqlClauses(selectText, fromText, clauseTexts);
    }

    /**
     * Smallest clause start strictly after {@code start}, or {@code length} when none follows.
     */
    private static int boundaryAfter(int start, Map<Clause, Integer> starts, int length) {
        int end = length;
        for (int candidate : starts.values()) {
            if (candidate > start && candidate < end) {
                end = candidate;
            }
        }
        return end;
    }

    private static String slice(String text, int begin, int end) {
        if (end <= begin) {
            return "";
        }
        return text.substring(begin, end).trim();
    }

    public String getSelectList() {
        return selectList;
    }

    /**
     * Text between FROM and the next clause.
     */
    public String getFrom() {
        return from;
    }

    public boolean has(Clause clause) {
        return clauses.containsKey(clause);
    }

    public Optional<String> get(Clause clause) {
        return Optional.ofNullable(clauses.get(clause));
    }
}
