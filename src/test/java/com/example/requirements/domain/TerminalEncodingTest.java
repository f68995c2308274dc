package com.example.requirements.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TerminalEncodingTest {

    @Test
    void sortByDecreasingRank() {
        List<TerminalEncoding> encodings = new ArrayList<>(List.of(TerminalEncoding.values()));

        encodings.sort(TerminalEncoding.sortByDecreasingRank());

        assertEquals(
                List.of(
                        TerminalEncoding.ANSI_16MILLION_COLORS,
                        TerminalEncoding.ANSI_256_COLORS,
                        TerminalEncoding.ANSI_16_COLORS,
                        TerminalEncoding.NONE),
                encodings);
    }

    @Test
    void sortByDecreasingRankIgnoresInputOrder() {
        List<TerminalEncoding> encodings =
                new ArrayList<>(List.of(TerminalEncoding.ANSI_16_COLORS, TerminalEncoding.NONE, TerminalEncoding.ANSI_256_COLORS));

        encodings.sort(TerminalEncoding.sortByDecreasingRank());

        assertEquals(
                List.of(TerminalEncoding.ANSI_256_COLORS, TerminalEncoding.ANSI_16_COLORS, TerminalEncoding.NONE),
                encodings);
    }
}
