package com.firesql.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Column type of a frame field.
 */
public enum FieldType {

    TIME("time"),
    STRING("string"),
    FLOAT64("float64"),
    INT64("int64"),
    BOOLEAN("boolean"),
    JSON("json");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
