package com.firesql.domain;

/**
 * Runtime type tag of a document value.
 */
public enum ValueKind {
    NULL,
    BOOL,
    INT64,
    FLOAT64,
    STRING,
    TIMESTAMP,
    MAPPING,
    SEQUENCE
}
