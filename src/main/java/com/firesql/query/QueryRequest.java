package com.firesql.query;

import com.firesql.domain.TimeWindow;

/**
 * A single query to execute: its text, the dashboard's time field and time window.
 */
public class QueryRequest {

    static final String DEFAULT_REF_ID = "A";

    private final String refId;
    private final String query;
    private final String timeField;
    private final TimeWindow window;

    public QueryRequest(String refId, String query, String timeField, TimeWindow window) {
        this.refId = refId != null ? refId : DEFAULT_REF_ID;
        this.query = query;
        this.timeField = timeField;
        this.window = window != null ? window : TimeWindow.NONE;
    }

    public static QueryRequest of(String query, TimeWindow window) {
        return new QueryRequest(DEFAULT_REF_ID, query, null, window);
    }

    public String getRefId() {
        return refId;
    }

    public String getQuery() {
        return query;
    }

    public String getTimeField() {
        return timeField;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public boolean isEmpty() {
        return query == null || query.isBlank();
    }

    @Override
    public String toString() {
        return "QueryRequest{refId=" + refId + ", query=" + query + ", window=" + window + "}";
    }
}
