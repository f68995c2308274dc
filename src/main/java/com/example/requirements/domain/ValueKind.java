package com.example.requirements.domain;

import java.util.List;

/**
 * How a value takes part in a diff.
 */
public enum ValueKind {
    /** Compared element by element. */
    ARRAY,
    /** Never diffed; printed as-is. */
    BOOLEAN,
    /** Converted to a string and diffed character by character. */
    SCALAR;

    public static ValueKind of(Object value) {
        if (value == null) {
            return SCALAR;
        }
        if (value.getClass().isArray() || value instanceof List) {
            return ARRAY;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        return SCALAR;
    }
}
