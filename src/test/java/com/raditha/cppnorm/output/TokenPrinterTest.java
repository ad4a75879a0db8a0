package com.raditha.cppnorm.output;

import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenPrinterTest {

    private TokenList tokens;

    @BeforeEach
    void setUp() {
        tokens = new CppLexer(true).tokenize("""
                int x;

                int y = x;
                """, "t.cpp");
        tokens.get(1).setVarId(1);
        tokens.get(4).setVarId(2);
        tokens.get(6).setVarId(1);
    }

    @Test
    void testCode() {
        assertEquals("int x ; int y = x ;", new TokenPrinter(false).toCode(tokens));
        assertEquals("int x@1 ; int y@2 = x@1 ;", new TokenPrinter(true).toCode(tokens));
    }

    @Test
    void testLinesKeepSourceLines() {
        assertEquals(List.of("int x ;", "", "int y = x ;"), new TokenPrinter(false).toLines(tokens));
    }

    @Test
    void testListingSkipsEmptyLines() {
        assertEquals("1: int x@1 ;\n3: int y@2 = x@1 ;\n", new TokenPrinter(true).toListing(tokens));
    }

    @Test
    void testInsertedTokenStaysOnItsLine() {
        Token star = tokens.insertAfter(tokens.get(3), "*");
        assertEquals(3, star.line());
        assertEquals("int * y = x ;", new TokenPrinter(false).toLines(tokens).get(2));
    }
}
