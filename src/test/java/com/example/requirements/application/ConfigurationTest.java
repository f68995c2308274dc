package com.example.requirements.application;

import com.example.requirements.domain.TerminalEncoding;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigurationTest {

    private final Configuration config = new Configuration();

    @Test
    void defaults() {
        assertThat(config.isDiffEnabled()).isTrue();
        assertEquals(TerminalEncoding.NONE, config.getTerminalEncoding());
        assertEquals(Configuration.DEFAULT_TERMINAL_WIDTH, config.getTerminalWidth());
        assertThat(config.getContext()).isEmpty();
    }

    @Test
    void mutatorsReturnNewInstances() {
        Configuration updated = config.withoutDiff().withTerminalWidth(120);

        assertThat(updated.isDiffEnabled()).isFalse();
        assertEquals(120, updated.getTerminalWidth());
        assertThat(config.isDiffEnabled()).isTrue();
        assertSame(config, config.withDiff());
        assertSame(config, config.withTerminalEncoding(TerminalEncoding.NONE));
    }

    @Test
    void withTerminalWidthRejectsNonPositiveValues() {
        assertThrows(IllegalArgumentException.class, () -> config.withTerminalWidth(0));
        assertThrows(IllegalArgumentException.class, () -> config.withTerminalWidth(-1));
    }

    @Test
    void withContextPreservesInsertionOrder() {
        Configuration updated = config.withContext("b", 1).withContext("a", 2);

        assertThat(updated.getContext()).containsExactly(Map.entry("b", 1), Map.entry("a", 2));
        assertThrows(IllegalArgumentException.class, () -> config.withContext("", 1));
    }

    @Test
    void convertToString() {
        assertEquals("null", config.convertToString(null));
        assertEquals("[1, 2, 3]", config.convertToString(new int[] {1, 2, 3}));
        assertEquals("[[a], [b, null]]", config.convertToString(new String[][] {{"a"}, {"b", null}}));
        assertEquals("[x, y]", config.convertToString(List.of("x", "y")));
    }

    @Test
    void stringConvertersMatchExactType() {
        Configuration updated = config.withStringConverter(Integer.class, value -> "#" + value);

        assertEquals("#5", updated.convertToString(5));
        assertEquals("5", updated.convertToString(5L));
        assertEquals("[#1, #2]", updated.convertToString(new Integer[] {1, 2}));
        assertEquals("5", updated.withoutStringConverter(Integer.class).convertToString(5));
    }
}
