package com.example.requirements.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DiffResultTest {

    @Test
    void rejectsMismatchedLineCounts() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new DiffResult(List.of("a", "b"), List.of(), List.of("a"), '/'));
        assertThrows(
                IllegalArgumentException.class,
                () -> new DiffResult(List.of("a"), List.of("=", "="), List.of("a"), '/'));
    }

    @Test
    void copiesLines() {
        List<String> actual = new ArrayList<>(List.of("a"));
        DiffResult result = new DiffResult(actual, List.of(), List.of("b"), ' ');

        actual.add("c");

        assertEquals(List.of("a"), result.getActualLines());
        assertThrows(UnsupportedOperationException.class, () -> result.getActualLines().add("d"));
    }
}
