package com.example.requirements.infrastructure;

import com.example.requirements.application.ColorScheme;
import com.example.requirements.domain.Delta;

import java.util.regex.Pattern;

/**
 * Renders diffs using ANSI escape codes. Changes are denoted by background colors, so no diff line is
 * rendered and padding is a colored space.
 */
public abstract class AbstractAnsiColorScheme implements ColorScheme {
    static final String RESET = "\u001B[0m";
    static final char PADDING_MARKER = ' ';
    private static final Pattern ESCAPE_SEQUENCE = Pattern.compile("\u001B\\[[;\\d]*m");

    /**
     * @return the escape code that starts text present in both values
     */
    protected abstract String getEqualPrefix();

    /**
     * @return the escape code that starts text present in the expected value only
     */
    protected abstract String getInsertPrefix();

    /**
     * @return the escape code that starts text present in the actual value only
     */
    protected abstract String getDeletePrefix();

    protected abstract String getPaddingPrefix();

    @Override
    public char getPaddingMarker() {
        return PADDING_MARKER;
    }

    @Override
    public String decorateEqualText(String text) {
        return decorate(getEqualPrefix(), text);
    }

    @Override
    public String decorateInsertedText(String text) {
        return decorate(getInsertPrefix(), text);
    }

    @Override
    public String decorateDeletedText(String text) {
        return decorate(getDeletePrefix(), text);
    }

    @Override
    public String decoratePadding(int length) {
        return decorate(getPaddingPrefix(), String.valueOf(PADDING_MARKER).repeat(length));
    }

    @Override
    public boolean rendersDiffLines() {
        return false;
    }

    @Override
    public char getDiffSymbol(Delta.Type type) {
        throw new UnsupportedOperationException(getEncoding() + " does not render diff lines");
    }

    @Override
    public boolean isPadding(String line) {
        String text = ESCAPE_SEQUENCE.matcher(line).replaceAll("");
        if (text.isEmpty()) {
            return false;
        }
        return line.equals(decoratePadding(text.length()));
    }

    private static String decorate(String prefix, String text) {
        if (text.isEmpty()) {
            return "";
        }
        return prefix + text + RESET;
    }
}
