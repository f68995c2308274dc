package com.example.requirements.infrastructure;

import com.example.requirements.application.ColorScheme;
import com.example.requirements.domain.Delta;
import com.example.requirements.domain.TerminalEncoding;

/**
 * Renders diffs without colors. Changes are marked by a line of diff symbols beneath the actual value.
 */
public final class TextOnlyColorScheme implements ColorScheme {
    static final char PADDING_MARKER = '/';
    static final char DIFF_EQUAL = '=';
    static final char DIFF_INSERT = '+';
    static final char DIFF_DELETE = '-';

    @Override
    public TerminalEncoding getEncoding() {
        return TerminalEncoding.NONE;
    }

    @Override
    public char getPaddingMarker() {
        return PADDING_MARKER;
    }

    @Override
    public String decorateEqualText(String text) {
        return text;
    }

    @Override
    public String decorateInsertedText(String text) {
        return text;
    }

    @Override
    public String decorateDeletedText(String text) {
        return text;
    }

    @Override
    public String decoratePadding(int length) {
        return String.valueOf(PADDING_MARKER).repeat(length);
    }

    @Override
    public boolean rendersDiffLines() {
        return true;
    }

    @Override
    public char getDiffSymbol(Delta.Type type) {
        return switch (type) {
            case EQUAL -> DIFF_EQUAL;
            case INSERT -> DIFF_INSERT;
            case DELETE -> DIFF_DELETE;
        };
    }

    @Override
    public boolean isPadding(String line) {
        return !line.isEmpty() && line.chars().allMatch(c -> c == PADDING_MARKER);
    }
}
