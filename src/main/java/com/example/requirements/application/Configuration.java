package com.example.requirements.application;

import com.example.requirements.domain.TerminalEncoding;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.lang.reflect.Array;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Settings that control how failure messages are rendered. Instances are immutable.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Configuration {
    public static final int DEFAULT_TERMINAL_WIDTH = 80;

    private final boolean diffEnabled;
    private final TerminalEncoding terminalEncoding;
    private final int terminalWidth;
    /**
     * Name-value pairs appended to every failure message.
     */
    private final Map<String, Object> context;
    @Getter(AccessLevel.NONE)
    private final Map<Class<?>, Function<Object, String>> typeToStringConverter;

    /**
     * Creates a configuration with diffs enabled, no colors and the default terminal width.
     */
    public Configuration() {
        this(true, TerminalEncoding.NONE, DEFAULT_TERMINAL_WIDTH, Map.of(), Map.of());
    }

    public Configuration withDiff() {
        if (diffEnabled) {
            return this;
        }
        return new Configuration(true, terminalEncoding, terminalWidth, context, typeToStringConverter);
    }

    public Configuration withoutDiff() {
        if (!diffEnabled) {
            return this;
        }
        return new Configuration(false, terminalEncoding, terminalWidth, context, typeToStringConverter);
    }

    public Configuration withTerminalEncoding(TerminalEncoding encoding) {
        Objects.requireNonNull(encoding, "encoding");
        if (encoding == terminalEncoding) {
            return this;
        }
        return new Configuration(diffEnabled, encoding, terminalWidth, context, typeToStringConverter);
    }

    /**
     * @param width the number of characters per line
     * @return the updated configuration
     * @throws IllegalArgumentException if {@code width} is zero or negative
     */
    public Configuration withTerminalWidth(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive.\nActual: " + width);
        }
        if (width == terminalWidth) {
            return this;
        }
        return new Configuration(diffEnabled, terminalEncoding, width, context, typeToStringConverter);
    }

    /**
     * @param key   the name of a value
     * @param value the value
     * @return a configuration that appends {@code key: value} to every failure message
     * @throws NullPointerException     if {@code key} is null
     * @throws IllegalArgumentException if {@code key} is empty
     */
    public Configuration withContext(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key may not be empty");
        }
        Map<String, Object> newContext = new LinkedHashMap<>(context);
        newContext.put(key, value);
        return new Configuration(
                diffEnabled,
                terminalEncoding,
                terminalWidth,
                Collections.unmodifiableMap(newContext),
                typeToStringConverter);
    }

    /**
     * Registers a function that converts values of {@code type} to a string. {@code type} must be an
     * exact match; subclasses do not inherit converters from their superclass.
     */
    public <T> Configuration withStringConverter(Class<T> type, Function<? super T, String> converter) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(converter, "converter");
        Map<Class<?>, Function<Object, String>> newConverters = new LinkedHashMap<>(typeToStringConverter);
        newConverters.put(type, value -> converter.apply(type.cast(value)));
        return new Configuration(
                diffEnabled,
                terminalEncoding,
                terminalWidth,
                context,
                Collections.unmodifiableMap(newConverters));
    }

    public Configuration withoutStringConverter(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (!typeToStringConverter.containsKey(type)) {
            return this;
        }
        Map<Class<?>, Function<Object, String>> newConverters = new LinkedHashMap<>(typeToStringConverter);
        newConverters.remove(type);
        return new Configuration(
                diffEnabled,
                terminalEncoding,
                terminalWidth,
                context,
                Collections.unmodifiableMap(newConverters));
    }

    public String convertToString(Object value) {
        if (value == null) {
            return "null";
        }
        Function<Object, String> converter = typeToStringConverter.get(value.getClass());
        if (converter != null) {
            return converter.apply(value);
        }
        if (value.getClass().isArray()) {
            return arrayToString(value);
        }
        return value.toString();
    }

    private String arrayToString(Object array) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (int i = 0, size = Array.getLength(array); i < size; ++i) {
            joiner.add(convertToString(Array.get(array, i)));
        }
        return joiner.toString();
    }
}
