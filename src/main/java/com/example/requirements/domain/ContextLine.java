package com.example.requirements.domain;

import java.util.Objects;

/**
 * A labeled row of a failure message. An empty label continues the previous entry.
 */
public record ContextLine(String label, String value) {
    public ContextLine {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(value, "value");
    }

    /**
     * @return a row with no label and no value, rendered as a blank line
     */
    public static ContextLine separator() {
        return new ContextLine("", "");
    }
}
