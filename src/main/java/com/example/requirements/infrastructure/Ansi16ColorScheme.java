package com.example.requirements.infrastructure;

import com.example.requirements.domain.TerminalEncoding;

/**
 * White text on a black, green or red background, using the 16-color palette.
 */
public final class Ansi16ColorScheme extends AbstractAnsiColorScheme {
    private static final String EQUAL = "\u001B[97;40m";
    private static final String INSERT = "\u001B[97;42m";
    private static final String DELETE = "\u001B[97;41m";
    private static final String PADDING = "\u001B[30;40m";

    @Override
    public TerminalEncoding getEncoding() {
        return TerminalEncoding.ANSI_16_COLORS;
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
