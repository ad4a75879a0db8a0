package com.raditha.cppnorm.varid;

import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.output.TokenPrinter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClassMemberIdAssignerTest {

    private static String assign(String code) {
        TokenList tokens = VariableIdAssignerTest.prepare(code, true);
        new VariableIdAssigner().assign(tokens);
        return new TokenPrinter(true).toCode(tokens);
    }

    @Test
    void testOutOfClassMemberFunction() {
        assertEquals("class A { int n@1 ; void set ( int v@2 ) ; } ; void A :: set ( int v@3 ) { n@1 = v@3 ; }",
                assign("class A { int n; void set(int v); }; void A::set(int v) { n = v; }"));
    }

    @Test
    void testMemberDeclaredAfterInlineBody() {
        assertEquals("struct S { int get ( ) { return v@1 ; } int v@1 ; } ;",
                assign("struct S { int get() { return v; } int v; };"));
    }

    @Test
    void testLocalHidesMember() {
        assertEquals("struct S { int k@1 ; void f ( ) { int k@2 = 0 ; k@2 ++ ; } } ;",
                assign("struct S { int k; void f() { int k = 0; k++; } };"));
    }

    @Test
    void testInheritedMemberAndThis() {
        assertEquals("struct B { int base@1 ; } ; struct D : B { void f ( ) { this -> base@1 = 1 ; base@1 = 2 ; } } ;",
                assign("struct B { int base; }; struct D : B { void f() { this->base = 1; base = 2; } };"));
    }

    @Test
    void testConstructorInitializerList() {
        assertEquals("class C { int m@1 ; C ( int a@2 ) ; } ; C :: C ( int a@3 ) : m@1 ( a@3 ) { }",
                assign("class C { int m; C(int a); }; C::C(int a) : m(a) {}"));
    }

    @Test
    void testNoMembersStampsNothing() {
        TokenList tokens = VariableIdAssignerTest.prepare("int g; void f() { g = 1; }", true);
        VariableIdAssigner.Summary summary = new VariableIdAssigner().assignStructural(tokens);
        assertEquals(0, new ClassMemberIdAssigner().assign(tokens, summary));
    }
}
