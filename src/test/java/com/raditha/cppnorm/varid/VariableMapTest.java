package com.raditha.cppnorm.varid;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VariableMapTest {

    private VariableMap map;

    @BeforeEach
    void setUp() {
        map = new VariableMap();
    }

    @Test
    void testInnerBindingShadowsAndIsRestored() {
        map.bind("x", 1, VariableMap.Origin.GLOBAL);
        map.enterScope();
        map.bind("x", 2, VariableMap.Origin.LOCAL);
        map.bind("y", 3, VariableMap.Origin.LOCAL);
        assertEquals(2, map.find("x").orElseThrow().id());
        assertTrue(map.isBoundInCurrentScope("y"));

        map.leaveScope();
        assertEquals(new VariableMap.Binding(1, VariableMap.Origin.GLOBAL), map.find("x").orElseThrow());
        assertFalse(map.isVariable("y"));
        assertEquals(0, map.depth());
    }

    @Test
    void testGlobalLookup() {
        map.bind("g", 7, VariableMap.Origin.GLOBAL);
        map.enterScope();
        map.bind("g", 8, VariableMap.Origin.LOCAL);
        assertEquals(7, map.global("g").getAsInt());
        assertTrue(map.global("h").isEmpty());
        assertFalse(map.isBoundInCurrentScope("h"));
    }

    @Test
    void testLeavingFileScopeFails() {
        assertThrows(IllegalStateException.class, () -> map.leaveScope());
    }
}
