package com.raditha.cppnorm.output;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private final DiffGenerator generator = new DiffGenerator();

    @Test
    void testEqualListingsGiveNoDiff() {
        List<String> lines = List.of("int x ;", "int y ;");
        assertEquals("", generator.generateUnifiedDiff("a.cpp", lines, lines));
    }

    @Test
    void testChangedLine() {
        String diff = generator.generateUnifiedDiff("a.cpp",
                List.of("typedef int T ;", "T v ;"),
                List.of("", "int v ;"));

        assertTrue(diff.startsWith("--- a/a.cpp\n+++ b/a.cpp\n@@"), diff);
        assertTrue(diff.contains("-typedef int T ;"));
        assertTrue(diff.contains("-T v ;"));
        assertTrue(diff.contains("+int v ;"));
    }

    @Test
    void testContextIsLimited() {
        List<String> original = List.of("a", "b", "c", "d", "e", "f", "g");
        List<String> revised = List.of("a", "b", "c", "D", "e", "f", "g");

        String narrow = generator.generateUnifiedDiff("x.c", original, revised, 1);
        assertTrue(narrow.contains("@@ -3,3 +3,3 @@"), narrow);
        assertFalse(narrow.contains("\n b\n"));
    }
}
