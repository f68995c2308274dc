package com.example.requirements.domain;

import java.util.Comparator;

/**
 * The ANSI escape codes supported by a terminal, ordered by increasing number of colors.
 */
public enum TerminalEncoding {
    /** A terminal that does not support any colors. */
    NONE,
    /** A terminal that supports a 16-color palette. */
    ANSI_16_COLORS,
    /** A terminal that supports a 256-color palette. */
    ANSI_256_COLORS,
    /** A terminal that supports a 24-bit color palette. */
    ANSI_16MILLION_COLORS;

    /**
     * @return a comparator that places encodings supporting more colors first
     */
    public static Comparator<TerminalEncoding> sortByDecreasingRank() {
        return Comparator.comparingInt(TerminalEncoding::ordinal).reversed();
    }
}
