package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.analyzer.Deadline;
import com.raditha.cppnorm.analyzer.SimplifyContext;
import com.raditha.cppnorm.config.SimplifierConfig;
import com.raditha.cppnorm.diagnostics.CollectingErrorReporter;
import com.raditha.cppnorm.diagnostics.Diagnostic;
import com.raditha.cppnorm.diagnostics.Severity;
import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.linking.BracketLinker;
import com.raditha.cppnorm.linking.TemplateLinker;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenFlag;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypedefSimplifierTest {

    private TypedefSimplifier simplifier;
    private CollectingErrorReporter reporter;
    private SimplifyContext ctx;

    @BeforeEach
    void setUp() {
        simplifier = new TypedefSimplifier();
        reporter = new CollectingErrorReporter();
        ctx = SimplifyContext.of(SimplifierConfig.cpp().withDebugWarnings(true), reporter);
    }

    static TokenList prepare(String code) {
        TokenList tokens = new CppLexer(true).tokenize(code, "t.cpp");
        new BracketLinker().linkBrackets(tokens);
        new TemplateLinker().linkTemplates(tokens);
        return tokens;
    }

    private String simplify(String code) {
        TokenList tokens = prepare(code);
        simplifier.simplify(tokens, ctx);
        return String.join(" ", tokens.texts());
    }

    @Test
    void testPointerTypedefAppliesToEveryDeclarator() {
        assertEquals("int * a , * b ;", simplify("typedef int* IntPtr; IntPtr a, b;"));
        assertEquals(1, ctx.aliasesInlined());
        assertEquals(1, ctx.aliasUseSites());
    }

    @Test
    void testFunctionPointer() {
        TokenList tokens = prepare("typedef void (*Fn)(int); Fn f;");
        assertEquals(1, simplifier.simplify(tokens, ctx));
        assertEquals(List.of("void", "(", "*", "f", ")", "(", "int", ")", ";"), tokens.texts());

        Token open = tokens.front().next();
        assertEquals(")", open.link().str());
        assertSame(TokenPattern.findMatch(tokens.front(), "f", null).next(), open.link());
        Token params = open.link().next();
        assertEquals(")", params.link().str());
        assertTrue(open.hasFlag(TokenFlag.EXPANDED_ALIAS));
        assertEquals("Fn", open.originalName());
    }

    @Test
    void testConstBeforePointerTypedefQualifiesThePointer() {
        assertEquals("int * const p = 0 ; int * const q = 0 ;",
                simplify("typedef int *P; const P p = 0; P const q = 0;"));
    }

    @Test
    void testConstBeforeBlockPointerTypedef() {
        assertEquals("void f ( ) { int * const p = 0 ; }",
                simplify("void f() { typedef int *P; const P p = 0; }"));
    }

    @Test
    void testConstPointerTypedefAppliesToEveryDeclarator() {
        assertEquals("int * const a , * const b ;", simplify("typedef int *P; const P a, b;"));
    }

    @Test
    void testConstFunctionPointerTypedef() {
        assertEquals("void ( * const f ) ( int ) ;", simplify("typedef void (*Fn)(int); const Fn f;"));
    }

    @Test
    void testQualifierIsNotRepeatedOrAppliedToReference() {
        assertEquals("int * const x ;", simplify("typedef int * const CP; const CP x;"));
        assertEquals("void g ( int & r ) ;", simplify("typedef int &R; void g(const R r);"));
    }

    @Test
    void testAnonymousStructIsNamed() {
        assertEquals("struct Unnamed0 { int x ; } ; struct Unnamed0 s ;",
                simplify("typedef struct { int x; } S; S s;"));
    }

    @Test
    void testNamedStructDefinitionKeepsItsName() {
        assertEquals("struct P { int x ; } ; struct P * p ;",
                simplify("typedef struct P { int x; } *PP; PP p;"));
    }

    @Test
    void testSeveralNamesInOneTypedef() {
        TokenList tokens = prepare("typedef int A, *B; A a; B b;");
        assertEquals(1, simplifier.simplify(tokens, ctx));
        assertEquals("int a ; int * b ;", String.join(" ", tokens.texts()));
        assertEquals(2, ctx.aliasesInlined());
    }

    @Test
    void testLocalVariableHidesTypedef() {
        assertEquals("void f ( ) { int T = 1 ; } int g ;",
                simplify("typedef int T; void f() { int T = 1; } T g;"));
    }

    @Test
    void testQualifiedUseOfNamespaceTypedef() {
        assertEquals("namespace N { } int x ;", simplify("namespace N { typedef int T; } N::T x;"));
    }

    @Test
    void testBlockTypedefEndsWithItsBlock() {
        assertEquals("void f ( ) { long v ; } T w ;",
                simplify("void f() { typedef long T; T v; } T w;"));
    }

    @Test
    void testSecondRunChangesNothing() {
        TokenList tokens = prepare("typedef unsigned int U; U a; typedef U *UP; UP p;");
        simplifier.simplify(tokens, ctx);
        List<String> once = tokens.texts();
        assertEquals("unsigned int a ; unsigned int * p ;", String.join(" ", once));

        assertEquals(0, simplifier.simplify(tokens, ctx));
        assertEquals(once, tokens.texts());
    }

    @Test
    void testUnparseableTypedefIsKept() {
        assertEquals("typedef int A B ; A x ;", simplify("typedef int A B; A x;"));
        List<Diagnostic> skipped = reporter.withId(TypedefSimplifier.DIAGNOSTIC_ID);
        assertEquals(1, skipped.size());
        assertEquals(Severity.DEBUG, skipped.get(0).severity());
        assertEquals(1, ctx.aliasesSkipped());
    }

    @Test
    void testExpiredDeadlineStopsInlining() {
        SimplifyContext expired = new SimplifyContext(SimplifierConfig.cpp(), reporter,
                new Deadline(Instant.EPOCH, Clock.systemUTC()), () -> false);
        TokenList tokens = prepare("typedef int T; T x;");

        assertEquals(0, simplifier.simplify(tokens, expired));
        assertEquals("typedef int T ; T x ;", String.join(" ", tokens.texts()));
        List<Diagnostic> timeouts = reporter.withId(TypedefSimplifier.MAX_TIME_ID);
        assertEquals(1, timeouts.size());
        assertEquals(Severity.INFORMATION, timeouts.get(0).severity());
    }
}
