package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.analyzer.SimplifyContext;
import com.raditha.cppnorm.config.SimplifierConfig;
import com.raditha.cppnorm.diagnostics.CollectingErrorReporter;
import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.model.TokenList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UsingSimplifierTest {

    private UsingSimplifier simplifier;
    private CollectingErrorReporter reporter;
    private SimplifyContext ctx;

    @BeforeEach
    void setUp() {
        simplifier = new UsingSimplifier();
        reporter = new CollectingErrorReporter();
        ctx = SimplifyContext.of(SimplifierConfig.cpp().withDebugWarnings(true), reporter);
    }

    private String simplify(String code) {
        TokenList tokens = TypedefSimplifierTest.prepare(code);
        simplifier.simplify(tokens, ctx);
        return String.join(" ", tokens.texts());
    }

    @Test
    void testAliasToRecord() {
        assertEquals("struct S { int m ; } ; S v ; v . m = 1 ;",
                simplify("struct S { int m; }; using T = S; T v; v.m = 1;"));
        assertEquals(1, ctx.aliasUseSites());
    }

    @Test
    void testPointerAlias() {
        assertEquals("const char * p , * q ;", simplify("using Str = const char*; Str p, q;"));
    }

    @Test
    void testConstParameterOfPointerAlias() {
        assertEquals("void g ( char * const s ) ;", simplify("using P = char*; void g(const P s);"));
    }

    @Test
    void testFunctionPointerAlias() {
        assertEquals("int ( * cb ) ( int , int ) ;", simplify("using Cb = int(*)(int, int); Cb cb;"));
    }

    @Test
    void testUsingDeclarationBecomesAlias() {
        assertEquals("namespace N { int x ; } int y = N :: x ;",
                simplify("namespace N { int x; } using N::x; int y = x;"));
    }

    @Test
    void testMemberUsingDeclarationIsKept() {
        String code = "struct B { int v ; } ; struct D : B { using B :: v ; } ;";
        assertEquals(code, simplify(code));
    }

    @Test
    void testAliasTemplateIsKept() {
        String code = "template < class T > using Vec = std :: vector < T > ; Vec < int > v ;";
        assertEquals(code, simplify(code));
        assertEquals(1, ctx.aliasesSkipped());
        assertEquals(1, reporter.withId(UsingSimplifier.DIAGNOSTIC_ID).size());
    }

    @Test
    void testNestedScopeUsesQualifiedBase() {
        assertEquals("namespace A { struct R { } ; } A :: R r ;",
                simplify("namespace A { struct R {}; using RR = R; } A::RR r;"));
    }

    @Test
    void testAliasIsNotVisibleOutsideItsNamespace() {
        assertEquals("namespace A { } RR r ;", simplify("namespace A { using RR = int; } RR r;"));
    }

    @Test
    void testCIsUntouched() {
        TokenList tokens = new CppLexer(false).tokenize("using T = int; T x;", "t.c");
        assertEquals(0, simplifier.simplify(tokens, ctx));
        assertEquals(8, tokens.size());
    }
}
