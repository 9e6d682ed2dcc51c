package com.firesql.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Default diagnostics sink: writes each event as a debug line with key=value attributes.
 */
@Component
public class LoggingQueryDiagnostics implements QueryDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(LoggingQueryDiagnostics.class);

    @Override
    public void emit(String event, Map<String, Object> attributes) {
        if (!log.isDebugEnabled()) {
            return;
        }
        String rendered = attributes.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(" "));
        log.debug("{} {}", event, rendered);
    }
}
