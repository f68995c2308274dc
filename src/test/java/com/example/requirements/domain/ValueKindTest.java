package com.example.requirements.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ValueKindTest {

    @Test
    void of() {
        assertEquals(ValueKind.ARRAY, ValueKind.of(new int[0]));
        assertEquals(ValueKind.ARRAY, ValueKind.of(new String[] {"a"}));
        assertEquals(ValueKind.ARRAY, ValueKind.of(List.of(1)));
        assertEquals(ValueKind.BOOLEAN, ValueKind.of(Boolean.TRUE));
        assertEquals(ValueKind.SCALAR, ValueKind.of(null));
        assertEquals(ValueKind.SCALAR, ValueKind.of("text"));
        assertEquals(ValueKind.SCALAR, ValueKind.of(Set.of(1)));
    }
}
