package com.raditha.cppnorm.model;

import com.raditha.cppnorm.lexer.CppLexer;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TokenListTest {

    private static TokenList lex(String code) {
        return new CppLexer(true).tokenize(code, "test.cpp");
    }

    @Test
    void testAppendAndNavigate() {
        TokenList list = new TokenList(true);
        int file = list.addFile("a.cpp");
        Token a = list.append("int", file, 1, 1);
        Token b = list.append("x", file, 1, 5);
        Token c = list.append(";", file, 1, 6);

        assertEquals(3, list.size());
        assertSame(a, list.front());
        assertSame(c, list.back());
        assertSame(b, a.next());
        assertSame(a, b.previous());
        assertSame(c, a.tokAt(2));
        assertSame(a, c.tokAt(-2));
        assertNull(c.next());
        assertEquals("a.cpp", list.file(b.fileIndex()));
        assertEquals(TokenKind.STANDARD_TYPE, a.kind());
        assertEquals(TokenKind.NAME, b.kind());
    }

    @Test
    void testInsertTakesPositionOfNeighbour() {
        TokenList list = lex("int x ;\nint y ;");
        Token y = list.get(4);
        Token star = list.insertBefore(y, "*");

        assertEquals(List.of("int", "x", ";", "int", "*", "y", ";"), list.texts());
        assertEquals(2, star.line());
        assertEquals(y.column(), star.column());

        Token front = list.insertAfter(null, "extern");
        assertSame(front, list.front());
    }

    @Test
    void testDeleteClearsLinkAndVarId() {
        TokenList list = lex("f ( a ) ;");
        Token open = list.get(1);
        Token close = list.get(3);
        list.createLink(open, close);
        Token a = list.get(2);
        a.setVarId(4);

        list.delete(a);
        assertTrue(a.isDeleted());
        assertEquals(0, a.varId());
        assertSame(close, open.next());

        list.delete(open);
        assertNull(close.link());
        assertEquals(List.of("f", ")", ";"), list.texts());
        assertEquals(3, list.size());
    }

    @Test
    void testOperationsOnDeletedTokenFail() {
        TokenList list = lex("a b");
        Token a = list.front();
        list.delete(a);
        assertThrows(IllegalStateException.class, () -> list.insertAfter(a, "c"));
        assertThrows(IllegalStateException.class, () -> list.delete(a));
    }

    @Test
    void testDeleteRange() {
        TokenList list = lex("a b c d e");
        list.deleteRange(list.get(1), list.get(3));
        assertEquals(List.of("a", "e"), list.texts());
    }

    @Test
    void testDeleteRangeWithUnreachableEndFails() {
        TokenList list = lex("a b c");
        Token c = list.get(2);
        Token a = list.get(0);
        assertThrows(IllegalArgumentException.class, () -> list.deleteRange(c, a));
    }

    @Test
    void testCopyRangeRelinksBrackets() {
        TokenList list = lex("( a [ b ] ) ;");
        list.createLink(list.get(0), list.get(5));
        list.createLink(list.get(2), list.get(4));

        Token last = list.copyRange(list.get(6), list.get(0), list.get(5));

        assertEquals(List.of("(", "a", "[", "b", "]", ")", ";", "(", "a", "[", "b", "]", ")"), list.texts());
        assertSame(list.back(), last);
        Token copyOpen = list.get(6).next();
        assertEquals("(", copyOpen.str());
        assertSame(last, copyOpen.link());
        assertSame(copyOpen.tokAt(4), copyOpen.tokAt(2).link());
        // originals keep their own links
        assertSame(list.get(5), list.get(0).link());
    }

    @Test
    void testCopyTokensLinksPairsAcrossCalls() {
        TokenList list = lex("( x ) ;");
        Token open = list.get(0);
        Token close = list.get(2);
        list.createLink(open, close);
        open.addFlag(TokenFlag.EXPANDED_ALIAS);
        open.setOriginalName("T");

        Map<Integer, Token> copies = new HashMap<>();
        Token end = list.copyTokens(list.back(), List.of(open), copies);
        end = list.copyTokens(end, List.of(close), copies);

        Token copyOpen = copies.get(open.index());
        assertSame(end, copyOpen.link());
        assertTrue(copyOpen.hasFlag(TokenFlag.EXPANDED_ALIAS));
        assertEquals("T", copyOpen.originalName());
    }

    @Test
    void testCreateLinkReplacesOldLinks() {
        TokenList list = lex("( ( ) )");
        list.createLink(list.get(0), list.get(3));
        list.createLink(list.get(0), list.get(2));
        assertNull(list.get(3).link());
        assertSame(list.get(0), list.get(2).link());
    }

    @Test
    void testSetStrReclassifies() {
        TokenList list = lex("x");
        Token tok = list.front();
        tok.setStr("int");
        assertEquals(TokenKind.STANDARD_TYPE, tok.kind());
        tok.setStr("==");
        assertEquals(TokenKind.COMPARISON_OP, tok.kind());
        assertThrows(IllegalArgumentException.class, () -> tok.setStr(""));
    }

    @Test
    void testIndicesAreNeverReused() {
        TokenList list = lex("a b");
        Token b = list.get(1);
        list.delete(b);
        Token c = list.insertAfter(list.front(), "c");
        assertEquals(2, c.index());
        assertSame(b, list.get(1));
    }
}
