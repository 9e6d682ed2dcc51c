package com.firesql.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * A schemaless document retrieved from the store: field name to dynamic value,
 * where values may be nested mappings.
 */
public class Document {

    private final Map<String, Object> data;

    public Document(Map<String, Object> data) {
        this.data = data != null ? data : Collections.emptyMap();
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Set<String> fieldNames() {
        return data.keySet();
    }

    /**
     * Resolve a field reference, descending through nested mappings for dotted
     * paths such as {@code clientData.brand}. A missing key or a non-mapping
     * intermediate yields {@link FieldValue#NULL}.
     */
    public FieldValue resolve(String path) {
        if (path == null || path.isEmpty()) {
            return FieldValue.NULL;
        }
        if (path.indexOf('.') < 0) {
            return FieldValue.of(data.get(path));
        }

        String[] parts = path.split("\\.");
        Map<String, Object> current = data;
        for (int i = 0; i < parts.length - 1; i++) {
            FieldValue next = FieldValue.of(current.get(parts[i]));
            if (next.asMapping().isEmpty()) {
                return FieldValue.NULL;
            }
            current = next.asMapping().get();
        }
        return FieldValue.of(current.get(parts[parts.length - 1]));
    }

    @Override
    public String toString() {
        return "Document" + data;
    }
}
