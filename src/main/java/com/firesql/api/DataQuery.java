package com.firesql.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One query of a query-data request, as sent by the dashboard.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataQuery {
    @JsonProperty("refId")
    private String refId;

    @JsonProperty("query")
    private String query;

    @JsonProperty("timeField")
    private String timeField;

    public DataQuery() {
    }

    public DataQuery(String refId, String query, String timeField) {
        this.refId = refId;
        this.query = query;
        this.timeField = timeField;
    }

    public String getRefId() {
        return refId;
    }

    public void setRefId(String refId) {
        this.refId = refId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getTimeField() {
        return timeField;
    }

    public void setTimeField(String timeField) {
        this.timeField = timeField;
    }
}
