package com.example.requirements.domain;

import java.util.Objects;

/**
 * A contiguous span of text tagged with how it relates the actual value to the expected value.
 */
public record Delta(Type type, String text) {
    public Delta {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public enum Type {
        /** Text present in both values. */
        EQUAL,
        /** Text present in the expected value but not the actual value. */
        INSERT,
        /** Text present in the actual value but not the expected value. */
        DELETE
    }
}
