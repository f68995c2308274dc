package com.example.requirements;

import com.example.requirements.application.Configuration;
import com.example.requirements.application.ContextGenerator;
import com.example.requirements.application.FailureMessage;

import java.util.Objects;

/**
 * Verifies the requirements of a value.
 *
 * @param <T> the type of the value
 */
public final class ObjectRequirement<T> {
    static final String ACTUAL = "Actual";
    static final String EXPECTED = "Expected";

    private final Configuration config;
    private final ContextGenerator contextGenerator;
    private final T actual;
    private final String name;

    ObjectRequirement(Configuration config, ContextGenerator contextGenerator, T actual, String name) {
        this.config = config;
        this.contextGenerator = contextGenerator;
        this.actual = actual;
        this.name = name;
    }

    public T getActual() {
        return actual;
    }

    /**
     * @param expected the expected value
     * @return this
     * @throws IllegalArgumentException if the value is not equal to {@code expected}
     */
    public ObjectRequirement<T> isEqualTo(Object expected) {
        if (Objects.deepEquals(actual, expected)) {
            return this;
        }
        String headline = name + " must be equal to " + config.convertToString(expected) + ".";
        boolean expectedInMessage = headline.length() < config.getTerminalWidth();
        if (!expectedInMessage) {
            headline = name + " had an unexpected value.";
        }
        throw new FailureMessage(config, headline)
                .addContextList(contextGenerator.getContext(ACTUAL, actual, EXPECTED, expected, expectedInMessage))
                .toException();
    }

    /**
     * @param expected the expected value
     * @param name     the name of the expected value
     * @return this
     * @throws NullPointerException     if {@code name} is null
     * @throws IllegalArgumentException if {@code name} is empty or the value is not equal to
     *                                  {@code expected}
     */
    public ObjectRequirement<T> isEqualTo(Object expected, String name) {
        requireThatNameIsValid(name);
        if (Objects.deepEquals(actual, expected)) {
            return this;
        }
        throw new FailureMessage(config, this.name + " must be equal to " + name + ".")
                .addContextList(contextGenerator.getContext(ACTUAL, actual, EXPECTED, expected, false))
                .toException();
    }

    public ObjectRequirement<T> isNotEqualTo(Object value) {
        if (!Objects.deepEquals(actual, value)) {
            return this;
        }
        throw new FailureMessage(config, name + " may not be equal to " + config.convertToString(value) + ".")
                .toException();
    }

    public ObjectRequirement<T> isNotEqualTo(Object value, String name) {
        requireThatNameIsValid(name);
        if (!Objects.deepEquals(actual, value)) {
            return this;
        }
        throw new FailureMessage(config, this.name + " may not be equal to " + name + ".")
                .addContext(ACTUAL, actual)
                .toException();
    }

    private static void requireThatNameIsValid(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name may not be empty");
        }
    }
}
