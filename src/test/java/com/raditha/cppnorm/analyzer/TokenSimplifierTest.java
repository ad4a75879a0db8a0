package com.raditha.cppnorm.analyzer;

import com.raditha.cppnorm.alias.TypedefSimplifier;
import com.raditha.cppnorm.alias.UsingSimplifier;
import com.raditha.cppnorm.config.SimplifierConfig;
import com.raditha.cppnorm.config.Standard;
import com.raditha.cppnorm.diagnostics.CollectingErrorReporter;
import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.linking.BracketLinker;
import com.raditha.cppnorm.linking.TemplateLinker;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenFlag;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.output.TokenPrinter;
import com.raditha.cppnorm.varid.VariableIdAssigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TokenSimplifierTest {

    private CollectingErrorReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new CollectingErrorReporter();
    }

    private SimplifyContext context(SimplifierConfig config) {
        return SimplifyContext.of(config, reporter);
    }

    @Test
    void testAllPhasesRun() {
        TokenList tokens = new CppLexer(true).tokenize("""
                typedef unsigned int uint;
                template <class T> struct Box { T value; };
                uint f(Box<uint> b) { uint n = b.value; return n; }
                """, "t.cpp");

        SimplificationStats stats = new TokenSimplifier().simplify(tokens, context(SimplifierConfig.cpp()));

        assertTrue(stats.completed());
        assertEquals(1, stats.typedefsRemoved());
        assertEquals(0, stats.usingsRemoved());
        assertEquals(2, stats.templatePairs());
        assertEquals(3, stats.aliasUseSites());
        assertEquals(3, stats.bracketPairs());
        String code = new TokenPrinter(true).toCode(tokens);
        assertTrue(code.startsWith("template < class T > struct Box { T value@1 ;"), code);
        assertTrue(code.contains("unsigned int n@3 = b@2 . value@4 ; return n@3 ;"), code);
    }

    @Test
    void testUnmatchedBraceStopsBeforeAliasPhases() {
        BracketLinker linker = new BracketLinker();
        TypedefSimplifier typedefs = mock(TypedefSimplifier.class);
        UsingSimplifier usings = mock(UsingSimplifier.class);
        VariableIdAssigner varIds = mock(VariableIdAssigner.class);
        TokenSimplifier simplifier = new TokenSimplifier(linker, TemplateLinker::new, typedefs, usings, varIds);
        TokenList tokens = new CppLexer(true).tokenize("typedef int T; }", "t.cpp");

        SimplifyException e = assertThrows(SimplifyException.class,
                () -> simplifier.simplify(tokens, context(SimplifierConfig.cpp())));

        assertEquals(SimplifyException.Kind.SYNTAX, e.kind());
        verify(typedefs, never()).simplify(any(), any());
        verify(usings, never()).simplify(any(), any());
        verify(varIds, never()).assign(any());
    }

    @Test
    void testStopFlagAbortsRemainingPhases() {
        AtomicInteger checks = new AtomicInteger();
        SimplifyContext ctx = new SimplifyContext(SimplifierConfig.cpp(), reporter, Deadline.none(),
                () -> checks.incrementAndGet() > 2);
        VariableIdAssigner varIds = mock(VariableIdAssigner.class);
        TokenSimplifier simplifier = new TokenSimplifier(new BracketLinker(), TemplateLinker::new,
                new TypedefSimplifier(), new UsingSimplifier(), varIds);
        TokenList tokens = new CppLexer(true).tokenize("typedef int T; T x;", "t.cpp");

        SimplificationStats stats = simplifier.simplify(tokens, ctx);

        assertFalse(stats.completed());
        assertEquals(0, stats.typedefsRemoved());
        verify(varIds, never()).assign(any());
        assertEquals("typedef int T ; T x ;", new TokenPrinter(false).toCode(tokens));
    }

    @Test
    void testAliasedRecordKeepsVariableAndMemberIds() {
        TokenList tokens = new CppLexer(true).tokenize("""
                struct S { int m; };
                using T = S;
                void f() { T v; S w; v.m = 1; w.m = 2; v.m = 3; }
                """, "t.cpp");

        SimplificationStats stats = new TokenSimplifier().simplify(tokens, context(SimplifierConfig.cpp()));

        assertTrue(stats.completed());
        assertEquals(1, stats.usingsRemoved());
        Token declared = TokenPattern.findMatch(tokens.front(), "S v ;", null);
        assertTrue(declared.hasFlag(TokenFlag.EXPANDED_ALIAS));
        assertEquals("T", declared.originalName());

        Token v = declared.next();
        Token first = TokenPattern.findMatch(tokens.front(), "v . m = 1", null);
        Token last = TokenPattern.findMatch(tokens.front(), "v . m = 3", null);
        Token other = TokenPattern.findMatch(tokens.front(), "w . m = 2", null);
        assertNotEquals(0, v.varId());
        assertEquals(v.varId(), first.varId());
        assertEquals(v.varId(), last.varId());
        assertNotEquals(v.varId(), other.varId());

        int member = first.tokAt(2).varId();
        assertNotEquals(0, member);
        assertEquals(member, last.tokAt(2).varId());
        assertNotEquals(member, other.tokAt(2).varId());
        assertNotEquals(0, other.tokAt(2).varId());
    }

    @Test
    void testPointerToMemberTypedefGetsVariableId() {
        TokenList tokens = new CppLexer(true).tokenize(
                "struct C { int v; }; typedef int (C::*Pm)(int); Pm pm; void h() { pm = 0; }", "t.cpp");

        SimplificationStats stats = new TokenSimplifier().simplify(tokens, context(SimplifierConfig.cpp()));

        assertEquals(1, stats.typedefsRemoved());
        assertEquals("struct C { int v@1 ; } ; int ( C :: * pm@2 ) ( int ) ; void h ( ) { pm@2 = 0 ; }",
                new TokenPrinter(true).toCode(tokens));
    }

    @Test
    void testAliasBudgetStartsAfterLinking() {
        DeadlineTest.ManualClock clock = new DeadlineTest.ManualClock();
        SimplifierConfig cpp = SimplifierConfig.cpp();
        SimplifierConfig config = new SimplifierConfig(cpp.language(), cpp.standard(), Duration.ofSeconds(5), false);
        SimplifyContext ctx = new SimplifyContext(config, reporter,
                Deadline.pending(config.aliasTimeBudget(), clock), () -> false);
        BracketLinker linker = spy(new BracketLinker());
        doAnswer(inv -> {
            clock.advance(Duration.ofSeconds(10));
            return inv.callRealMethod();
        }).when(linker).linkBrackets(any());
        TokenSimplifier simplifier = new TokenSimplifier(linker, TemplateLinker::new,
                new TypedefSimplifier(), new UsingSimplifier(), new VariableIdAssigner());
        TokenList tokens = new CppLexer(true).tokenize("typedef int T; T x;", "t.cpp");

        SimplificationStats stats = simplifier.simplify(tokens, ctx);

        assertTrue(ctx.deadline().isStarted());
        assertFalse(ctx.deadline().isExpired());
        assertEquals(1, stats.typedefsRemoved());
        assertTrue(reporter.withId(TypedefSimplifier.MAX_TIME_ID).isEmpty());
        assertEquals("int x@1 ;", new TokenPrinter(true).toCode(tokens));
    }

    @Test
    void testSplitShiftFollowsStandard() {
        String code = "std::vector<std::vector<int>> v;";
        TokenList cpp03 = new CppLexer(true).tokenize(code, "t.cpp");
        SimplificationStats old = new TokenSimplifier()
                .simplify(cpp03, context(SimplifierConfig.cpp().withStandard(Standard.CPP03)));
        assertEquals(0, old.templatePairs());

        TokenList cpp11 = new CppLexer(true).tokenize(code, "t.cpp");
        SimplificationStats current = new TokenSimplifier()
                .simplify(cpp11, context(SimplifierConfig.cpp().withStandard(Standard.CPP11)));
        assertEquals(2, current.templatePairs());
    }

    @Test
    void testCSkipsTemplatesAndUsing() {
        TokenList tokens = new CppLexer(false).tokenize("typedef int T; T a; int b = a;", "t.c");
        SimplificationStats stats = new TokenSimplifier().simplify(tokens, context(SimplifierConfig.c()));

        assertTrue(stats.completed());
        assertEquals(0, stats.templatePairs());
        assertEquals(1, stats.typedefsRemoved());
        assertEquals("int a@1 ; int b@2 = a@1 ;", new TokenPrinter(true).toCode(tokens));
    }
}
