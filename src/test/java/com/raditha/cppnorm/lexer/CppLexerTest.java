package com.raditha.cppnorm.lexer;

import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenKind;
import com.raditha.cppnorm.model.TokenList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CppLexerTest {

    private final CppLexer lexer = new CppLexer(true);

    @Test
    void testBasicTokens() {
        TokenList tokens = lexer.tokenize("int main() { return a->b >> 2; }", "main.cpp");
        assertEquals(List.of("int", "main", "(", ")", "{", "return", "a", "->", "b", ">>", "2", ";", "}"),
                tokens.texts());
    }

    @Test
    void testCommentsAndDirectivesAreSkipped() {
        String code = """
                # 1 "main.cpp"
                // comment
                int /* inline */ x;
                #pragma once
                """;
        TokenList tokens = lexer.tokenize(code, "main.cpp");
        assertEquals(List.of("int", "x", ";"), tokens.texts());
        assertEquals(3, tokens.front().line());
    }

    @Test
    void testPositions() {
        TokenList tokens = lexer.tokenize("a\n  bb c", "p.cpp");
        Token bb = tokens.get(1);
        assertEquals(2, bb.line());
        assertEquals(3, bb.column());
        assertEquals("p.cpp:2:3", bb.location().toDisplayString());
    }

    @Test
    void testLiterals() {
        TokenList tokens = lexer.tokenize("s = \"a\\\"b\"; c = 'x'; n = 1.5e+3; u = u8\"t\"; r = R\"(a)\";", "l.cpp");
        assertEquals(TokenKind.STRING, tokens.get(2).kind());
        assertEquals("\"a\\\"b\"", tokens.get(2).str());
        assertEquals(TokenKind.CHAR, tokens.get(6).kind());
        assertEquals("1.5e+3", tokens.get(10).str());
        assertEquals(TokenKind.NUMBER, tokens.get(10).kind());
        assertEquals("u8\"t\"", tokens.get(14).str());
        assertEquals("R\"(a)\"", tokens.get(18).str());
    }

    @Test
    void testKeywordsDependOnLanguage() {
        TokenList c = new CppLexer(false).tokenize("class x;", "x.c");
        assertEquals(TokenKind.NAME, c.front().kind());
        TokenList cpp = lexer.tokenize("class x;", "x.cpp");
        assertEquals(TokenKind.KEYWORD, cpp.front().kind());
    }

    @Test
    void testUnterminatedCommentIsSyntaxError() {
        SimplifyException e = assertThrows(SimplifyException.class,
                () -> lexer.tokenize("int x; /* open", "bad.cpp"));
        assertEquals(SimplifyException.Kind.SYNTAX, e.kind());
        assertEquals(1, e.location().line());
        assertEquals(8, e.location().column());
    }

    @Test
    void testUnterminatedStringIsSyntaxError() {
        SimplifyException e = assertThrows(SimplifyException.class,
                () -> lexer.tokenize("s = \"abc\n;", "bad.cpp"));
        assertEquals("syntaxError", e.toDiagnostic().id());
    }
}
