package com.example.requirements.application;

import com.example.requirements.domain.ContextLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds the message of a failed requirement: a headline followed by left-justified context lines.
 */
public final class FailureMessage {
    private final Configuration config;
    private final String headline;
    private final List<ContextLine> context = new ArrayList<>();

    public FailureMessage(Configuration config, String headline) {
        this.config = Objects.requireNonNull(config, "config");
        this.headline = Objects.requireNonNull(headline, "headline");
    }

    /**
     * @param key   the name of the value
     * @param value the value
     * @return this
     * @throws NullPointerException     if {@code key} is null
     * @throws IllegalArgumentException if {@code key} is empty
     */
    public FailureMessage addContext(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key may not be empty");
        }
        context.add(new ContextLine(key, config.convertToString(value)));
        return this;
    }

    public FailureMessage addContextList(List<ContextLine> lines) {
        Objects.requireNonNull(lines, "lines");
        context.addAll(lines);
        return this;
    }

    public String build() {
        List<ContextLine> lines = new ArrayList<>(context);
        for (Map.Entry<String, Object> entry : config.getContext().entrySet()) {
            lines.add(new ContextLine(entry.getKey(), config.convertToString(entry.getValue())));
        }
        int maxLabelLength = 0;
        for (ContextLine line : lines) {
            maxLabelLength = Math.max(maxLabelLength, line.label().length());
        }
        StringJoiner joiner = new StringJoiner("\n");
        joiner.add(headline);
        for (ContextLine line : lines) {
            if (line.label().isEmpty()) {
                joiner.add(line.value());
            } else {
                joiner.add(alignLeft(line.label(), maxLabelLength) + ": " + line.value());
            }
        }
        return joiner.toString();
    }

    public IllegalArgumentException toException() {
        return new IllegalArgumentException(build());
    }

    private static String alignLeft(String text, int width) {
        return text + " ".repeat(width - text.length());
    }
}
