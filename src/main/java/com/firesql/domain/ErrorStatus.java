package com.firesql.domain;

/**
 * Classification of a failed query response.
 */
public enum ErrorStatus {
    BAD_REQUEST,
    INTERNAL
}
