package com.firesql.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Query-data request: a shared time range and the queries to run against it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryDataRequest {
    @JsonProperty("range")
    private TimeRangeDto range;

    @JsonProperty("queries")
    private List<DataQuery> queries = new ArrayList<>();

    public QueryDataRequest() {
    }

    public QueryDataRequest(TimeRangeDto range, List<DataQuery> queries) {
        this.range = range;
        this.queries = queries;
    }

    public TimeRangeDto getRange() {
        return range;
    }

    public void setRange(TimeRangeDto range) {
        this.range = range;
    }

    public List<DataQuery> getQueries() {
        return queries;
    }

    public void setQueries(List<DataQuery> queries) {
        this.queries = queries;
    }
}
