package com.raditha.cppnorm.model;

import com.raditha.cppnorm.lexer.CppLexer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenPatternTest {

    private static Token first(String code) {
        return new CppLexer(true).tokenize(code, "test.cpp").front();
    }

    @Test
    void testLiteralAndClasses() {
        Token tok = first("int x = 42 ;");
        assertTrue(TokenPattern.match(tok, "int %name% = %num% ;"));
        assertTrue(TokenPattern.match(tok, "%type% %name% %assign%"));
        assertFalse(TokenPattern.match(tok, "int %name% ;"));
        assertTrue(TokenPattern.simpleMatch(tok, "int x ="));
    }

    @Test
    void testAlternativesAndOptionalElements() {
        Token tok = first("const char * p ;");
        assertTrue(TokenPattern.match(tok, "const|volatile char *|& %name%"));
        assertTrue(TokenPattern.match(tok.next(), "const| char * %name%"));
        assertTrue(TokenPattern.match(tok, "static| const char"));
    }

    @Test
    void testNegation() {
        Token tok = first("a . b");
        assertTrue(TokenPattern.match(tok, "%name% !!-> %name%"));
        assertFalse(TokenPattern.match(tok, "%name% !!. %name%"));
    }

    @Test
    void testVarRequiresVarId() {
        Token tok = first("x ;");
        assertFalse(TokenPattern.match(tok, "%var%"));
        tok.setVarId(3);
        assertTrue(TokenPattern.match(tok, "%var% ;"));
        assertFalse(TokenPattern.match(tok, "%type%"));
    }

    @Test
    void testNullSafety() {
        assertFalse(TokenPattern.match(null, "x"));
        assertFalse(TokenPattern.simpleMatch(null, "x"));
        Token tok = first("x");
        assertFalse(TokenPattern.match(tok, "x y"));
    }

    @Test
    void testFindMatch() {
        Token tok = first("a b ; c d ;");
        Token found = TokenPattern.findMatch(tok, "c %name%", null);
        assertNotNull(found);
        assertEquals("c", found.str());
        assertNull(TokenPattern.findMatch(tok, "c %name%", tok.tokAt(2)));
    }
}
