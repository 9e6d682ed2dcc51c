package com.firesql.query;

import java.util.Map;

/**
 * Sink for structured events emitted while a query is parsed and evaluated.
 * Passed explicitly into each query component.
 */
public interface QueryDiagnostics {

    /**
     * Sink that drops every event.
     */
    QueryDiagnostics NOOP = (event, attributes) -> { };

    /**
     * Emit an event.
     *
     * @param event dotted event name, e.g. {@code parse.where.dropped}
     * @param attributes event attributes, rendered as key=value pairs
     */
    void emit(String event, Map<String, Object> attributes);
}
