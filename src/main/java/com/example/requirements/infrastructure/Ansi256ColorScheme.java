package com.example.requirements.infrastructure;

import com.example.requirements.domain.TerminalEncoding;

public final class Ansi256ColorScheme extends AbstractAnsiColorScheme {
    // 15 = white, 16 = black, 28 = green, 124 = red
    private static final String EQUAL = "\u001B[38;5;15;48;5;16m";
    private static final String INSERT = "\u001B[38;5;15;48;5;28m";
    private static final String DELETE = "\u001B[38;5;15;48;5;124m";
    private static final String PADDING = "\u001B[38;5;16;48;5;16m";

    @Override
    public TerminalEncoding getEncoding() {
        return TerminalEncoding.ANSI_256_COLORS;
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
