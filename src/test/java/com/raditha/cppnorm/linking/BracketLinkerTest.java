package com.raditha.cppnorm.linking;

import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.model.TokenList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BracketLinkerTest {

    private BracketLinker linker;

    @BeforeEach
    void setUp() {
        linker = new BracketLinker();
    }

    private static TokenList lex(String code) {
        return new CppLexer(true).tokenize(code, "test.cpp");
    }

    @Test
    void testLinksAllBracketKinds() {
        TokenList tokens = lex("void f(int a[3]) { g(a); }");
        assertEquals(4, linker.linkBrackets(tokens));

        assertSame(tokens.get(8), tokens.get(2).link());
        assertSame(tokens.get(2), tokens.get(8).link());
        assertSame(tokens.get(7), tokens.get(5).link());
        assertSame(tokens.get(15), tokens.get(9).link());
        assertSame(tokens.get(13), tokens.get(11).link());
        assertNull(tokens.get(0).link());
    }

    @Test
    void testMismatchedCloserIsFatal() {
        TokenList tokens = lex("f( a ];");
        SimplifyException e = assertThrows(SimplifyException.class, () -> linker.linkBrackets(tokens));
        assertEquals(SimplifyException.Kind.SYNTAX, e.kind());
        assertEquals(6, e.location().column());
    }

    @Test
    void testUnmatchedClosingBraceIsFatal() {
        TokenList tokens = lex("int x; }");
        SimplifyException e = assertThrows(SimplifyException.class, () -> linker.linkBrackets(tokens));
        assertTrue(e.getMessage().contains("}"));
    }

    @Test
    void testUnclosedOpenerIsFatal() {
        TokenList tokens = lex("void f() {\n  if (x) {\n}");
        SimplifyException e = assertThrows(SimplifyException.class, () -> linker.linkBrackets(tokens));
        assertEquals(1, e.location().line());
        assertEquals(10, e.location().column());
    }

    @Test
    void testEmptyList() {
        assertEquals(0, linker.linkBrackets(lex("")));
    }
}
