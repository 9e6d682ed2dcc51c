package com.firesql.query;

import com.firesql.domain.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides whether a query runs on the native plan path or is delegated verbatim.
 *
 * The delegated executor has no dashboard time-variable substitution and no
 * GROUP BY, so queries needing either go native.
 */
@Component
public class QueryRouter {

    public ExecutionPath route(String query, TimeWindow window) {
        if (query == null) {
            return ExecutionPath.DELEGATED;
        }
        if (usesTimeVariables(query) && window != null && window.hasBounds()) {
            return ExecutionPath.NATIVE;
        }
        if (hasGroupBy(query)) {
            return ExecutionPath.NATIVE;
        }
        return ExecutionPath.DELEGATED;
    }

    static boolean usesTimeVariables(String query) {
        return query.contains(QueryParser.FROM_VARIABLE) || query.contains(QueryParser.TO_VARIABLE);
    }

    static boolean hasGroupBy(String query) {
        return query.toLowerCase(Locale.ROOT).contains("group by");
    }
}
