package com.firesql.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Columnar query result: equal-length named fields.
 */
public class Frame {

    public static final String DEFAULT_NAME = "response";

    @JsonProperty("name")
    private final String name;

    @JsonProperty("fields")
    private final List<FrameField> fields;

    public Frame() {
        this(DEFAULT_NAME);
    }

    public Frame(String name) {
        this.name = name;
        this.fields = new ArrayList<>();
    }

    public String getName() {
        return name;
    }

    public List<FrameField> getFields() {
        return fields;
    }

    public void addField(FrameField field) {
        fields.add(field);
    }

    public Optional<FrameField> field(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    /**
     * Number of rows, taken from the first field.
     */
    @JsonIgnore
    public int getRowCount() {
        return fields.isEmpty() ? 0 : fields.get(0).size();
    }
}
