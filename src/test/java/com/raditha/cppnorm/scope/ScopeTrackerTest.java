package com.raditha.cppnorm.scope;

import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.linking.BracketLinker;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTrackerTest {

    private static TokenList tokenize(String code) {
        TokenList tokens = new CppLexer(true).tokenize(code, "t.cpp");
        new BracketLinker().linkBrackets(tokens);
        return tokens;
    }

    /**
     * Feed every token before the first match of {@code pattern}.
     */
    private static ScopeTracker trackTo(TokenList tokens, String pattern) {
        Token stop = TokenPattern.findMatch(tokens.front(), pattern, null);
        assertNotNull(stop, "pattern not found: " + pattern);
        ScopeTracker tracker = new ScopeTracker();
        for (Token t = tokens.front(); t != stop; t = t.next()) {
            assertTrue(tracker.update(t));
        }
        return tracker;
    }

    @Test
    void testNestedNamespaces() {
        TokenList tokens = tokenize("namespace A { namespace B { int x; } } int y;");

        ScopeTracker inside = trackTo(tokens, "x");
        assertEquals(ScopeKind.NAMESPACE, inside.current().kind());
        assertEquals("A::B", inside.current().fullName());
        assertEquals("B", inside.current().name());
        assertTrue(inside.isInside("A"));
        assertFalse(inside.isInside("B"));

        ScopeTracker after = trackTo(tokens, "y");
        assertTrue(after.current().isGlobal());
        assertEquals(1, after.root().children().size());
    }

    @Test
    void testInlineMemberFunctionOfDerivedClass() {
        TokenList tokens = tokenize("""
                struct Base { int a; };
                struct D : public Base { void f() { a = 1; } };
                """);
        ScopeTracker tracker = trackTo(tokens, "a = 1");

        ScopeInfo body = tracker.current();
        assertEquals(ScopeKind.OTHER, body.kind());
        assertTrue(body.isFunctionBody());
        assertTrue(body.isMemberFunctionBody());

        ScopeInfo record = tracker.enclosingRecord().orElseThrow();
        assertEquals("D", record.fullName());
        assertEquals(Set.of("Base"), record.baseTypes());
        assertTrue(tracker.inheritsFrom("Base"));
        assertEquals(Set.of("Base", "D"), tracker.root().recordTypes());
    }

    @Test
    void testOutOfClassMemberFunction() {
        TokenList tokens = tokenize("class A { int x; void f(); }; void A::f() { x = 1; }");
        ScopeTracker tracker = trackTo(tokens, "x = 1");

        assertEquals(ScopeKind.MEMBER_FUNCTION, tracker.current().kind());
        assertEquals("A", tracker.current().fullName());
        assertTrue(tracker.current().isMemberFunctionBody());
        assertEquals("A", tracker.enclosingRecord().orElseThrow().fullName());
    }

    @Test
    void testUsingNamespaceMakesTypesVisible() {
        TokenList tokens = tokenize("namespace N { struct S {}; } using namespace N; S s;");
        ScopeTracker tracker = trackTo(tokens, "S s");

        assertTrue(tracker.seesNamespace("N"));
        assertEquals("N", tracker.findTypeOwner("S").orElseThrow().fullName());
        assertEquals("N::S", tracker.findRecord("S").orElseThrow().fullName());
        assertTrue(tracker.findTypeOwner("T").isEmpty());
    }

    @Test
    void testReopenedNamespaceSeesEarlierTypes() {
        TokenList tokens = tokenize("namespace N { struct S {}; } namespace N { S s; }");
        ScopeTracker tracker = trackTo(tokens, "S s");

        assertEquals("N", tracker.findTypeOwner("S").orElseThrow().fullName());
    }

    @Test
    void testExternCAndForwardDeclarations() {
        TokenList tokens = tokenize("extern \"C\" { class Fwd; int g; }");
        ScopeTracker tracker = trackTo(tokens, "g");

        assertEquals(ScopeKind.NAMESPACE, tracker.current().kind());
        assertEquals("", tracker.current().fullName());
        assertTrue(tracker.current().recordTypes().contains("Fwd"));
    }

    @Test
    void testUnmatchedCloseBrace() {
        TokenList tokens = new CppLexer(true).tokenize("int x; }", "t.cpp");
        ScopeTracker tracker = new ScopeTracker();
        Token close = TokenPattern.findMatch(tokens.front(), "}", null);
        for (Token t = tokens.front(); t != close; t = t.next()) {
            assertTrue(tracker.update(t));
        }
        assertFalse(tracker.update(close));
        assertTrue(tracker.current().isGlobal());
    }

    @Test
    void testCopyIsIndependent() {
        TokenList tokens = tokenize("namespace A { int x; } int y;");
        ScopeTracker tracker = trackTo(tokens, "x");
        ScopeTracker copy = tracker.copy();

        Token t = TokenPattern.findMatch(tokens.front(), "x", null);
        for (; !t.is("y"); t = t.next()) {
            copy.update(t);
        }
        assertTrue(copy.current().isGlobal());
        assertEquals("A", tracker.current().fullName());
    }
}
