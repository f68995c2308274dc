package com.example.requirements.infrastructure;

import com.example.requirements.application.ColorScheme;
import com.example.requirements.domain.TerminalEncoding;

import java.util.Objects;

/**
 * Looks up the color scheme of a terminal encoding.
 */
public final class ColorSchemes {
    private static final ColorScheme TEXT_ONLY = new TextOnlyColorScheme();
    private static final ColorScheme ANSI_16 = new Ansi16ColorScheme();
    private static final ColorScheme ANSI_256 = new Ansi256ColorScheme();
    private static final ColorScheme ANSI_16MILLION = new Ansi16MillionColorScheme();

    private ColorSchemes() {
    }

    public static ColorScheme forEncoding(TerminalEncoding encoding) {
        Objects.requireNonNull(encoding, "encoding");
        return switch (encoding) {
            case NONE -> TEXT_ONLY;
            case ANSI_16_COLORS -> ANSI_16;
            case ANSI_256_COLORS -> ANSI_256;
            case ANSI_16MILLION_COLORS -> ANSI_16MILLION;
        };
    }
}
