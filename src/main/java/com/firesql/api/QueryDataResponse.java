package com.firesql.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.firesql.domain.DataResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-query responses keyed by refId.
 */
public class QueryDataResponse {
    @JsonProperty("responses")
    private final Map<String, DataResponse> responses;

    public QueryDataResponse(Map<String, DataResponse> responses) {
        this.responses = responses != null ? responses : new LinkedHashMap<>();
    }

    public Map<String, DataResponse> getResponses() {
        return responses;
    }
}
