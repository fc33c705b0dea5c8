package com.e2eq.cnl.rest.resources;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NbhParamTest {

    @Test
    void testEmptyValues() {
        assertTrue(NbhParam.parse(null).isEmpty());
        assertTrue(NbhParam.parse("  ").isEmpty());
    }

    @Test
    void testPairsKeepOrder() {
        Map<String, String> parsed = NbhParam.parse(" water:water::frozen , plato:plato::young,");
        assertEquals(List.of("water", "plato"), List.copyOf(parsed.keySet()));
        assertEquals("water::frozen", parsed.get("water"));
        assertEquals("plato::young", parsed.get("plato"));
    }

    @Test
    void testNodeIdWithDoubleColon() {
        Map<String, String> parsed = NbhParam.parse("c::d:c::d::young");
        assertEquals("c::d::young", parsed.get("c::d"));
    }

    @Test
    void testMalformedPair() {
        assertThrows(IllegalArgumentException.class, () -> NbhParam.parse("water"));
        assertThrows(IllegalArgumentException.class, () -> NbhParam.parse(":water::frozen"));
        assertThrows(IllegalArgumentException.class, () -> NbhParam.parse("water:"));
        assertThrows(IllegalArgumentException.class, () -> NbhParam.parse("water::frozen"));
    }
}
