package com.example.requirements.infrastructure;

import com.example.requirements.domain.TerminalEncoding;

/**
 * The colors of {@link Ansi256ColorScheme} expressed as 24-bit RGB values.
 */
public final class Ansi16MillionColorScheme extends AbstractAnsiColorScheme {
    private static final String EQUAL = rgb(255, 255, 255, 0, 0, 0);
    private static final String INSERT = rgb(255, 255, 255, 0, 135, 0);
    private static final String DELETE = rgb(255, 255, 255, 175, 0, 0);
    private static final String PADDING = rgb(0, 0, 0, 0, 0, 0);

    private static String rgb(int fgRed, int fgGreen, int fgBlue, int bgRed, int bgGreen, int bgBlue) {
        return String.format(
                "\u001B[38;2;%d;%d;%d;48;2;%d;%d;%dm", fgRed, fgGreen, fgBlue, bgRed, bgGreen, bgBlue);
    }

    @Override
    public TerminalEncoding getEncoding() {
        return TerminalEncoding.ANSI_16MILLION_COLORS;
    }

    @Override
    protected String getEqualPrefix() {
        return EQUAL;
    }

    @Override
    protected String getInsertPrefix() {
        return INSERT;
    }

    @Override
    protected String getDeletePrefix() {
        return DELETE;
    }

    @Override
    protected String getPaddingPrefix() {
        return PADDING;
    }
}
