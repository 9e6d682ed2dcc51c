package com.firesql.query;

import com.firesql.domain.Document;
import com.firesql.domain.FieldValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Evaluates WHERE equality filters in memory after retrieval.
 *
 * Filters are ANDed. A field that does not resolve excludes the document.
 * Values compare through {@link FieldValue#looselyEquals(Object)}.
 */
@Component
public class DocumentFilter {

    private final QueryDiagnostics diagnostics;

    public DocumentFilter(QueryDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public List<Document> apply(List<Document> documents, List<FilterInfo> filters) {
        if (filters == null || filters.isEmpty() || documents.isEmpty()) {
            return documents;
        }

        List<Document> included = new ArrayList<>();
        for (Document document : documents) {
            if (document != null && matchesAll(document, filters)) {
                included.add(document);
            }
        }

        diagnostics.emit("filter.complete", Map.of(
            "documents", documents.size(),
            "included", included.size(),
            "excluded", documents.size() - included.size()));
        return included;
    }

    public boolean matchesAll(Document document, List<FilterInfo> filters) {
        for (FilterInfo filter : filters) {
            if (!matches(document, filter)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matches(Document document, FilterInfo filter) {
        FieldValue value = document.resolve(filter.getField());
        if (value.isNull()) {
            return false;
        }
        switch (filter.getOperator()) {
            case EQ:
                return value.looselyEquals(filter.getValue());
            default:
                return false;
        }
    }
}
