package com.example.requirements.application;

import java.util.regex.Pattern;

/**
 * Sentinels that appear verbatim in rendered diffs.
 */
public final class DiffConstants {
    /** Rendered in place of a line terminator. */
    public static final String NEWLINE_MARKER = "\\n";
    /** Rendered once at the end of each compared value. */
    public static final String EOS_MARKER = "\\0";
    /** Line terminators inside compared values. */
    public static final Pattern NEWLINE_PATTERN = Pattern.compile("\\r?\\n");

    private DiffConstants() {
    }
}
