package com.firesql.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A named, typed column of a {@link Frame}.
 */
public class FrameField {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("type")
    private final FieldType type;

    @JsonProperty("values")
    private final List<Object> values;

    public FrameField(String name, FieldType type) {
        this(name, type, new ArrayList<>());
    }

    public FrameField(String name, FieldType type, List<Object> values) {
        this.name = name;
        this.type = type;
        this.values = values != null ? values : new ArrayList<>();
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public List<Object> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public void append(Object value) {
        values.add(value);
    }

    @Override
    public String toString() {
        return name + ":" + type + values;
    }
}
