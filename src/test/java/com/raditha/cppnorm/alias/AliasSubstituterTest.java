package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AliasSubstituterTest {

    /**
     * A use site whose qualifier does not lead up to the alias name lets the splice
     * start and then fail while removing the use.
     */
    static AliasSubstituter.UseSite brokenSite(Token use) {
        return new AliasSubstituter.UseSite(use, use.next());
    }

    @Test
    void testSubstituteAtPlainUse() {
        TokenList tokens = TypedefSimplifierTest.prepare("typedef int *P; P p;");
        AliasDeclaration decl = new DeclaratorParser().parseTypedef(tokens.front(), null).get(0);
        Token use = TokenPattern.findMatch(tokens.front(), "P p ;", null);

        Token resume = new AliasSubstituter().substitute(new AliasSubstituter.UseSite(use), decl, null, tokens);

        assertEquals("*", resume.str());
        assertEquals("typedef int * P ; int * p ;", String.join(" ", tokens.texts()));
    }

    @Test
    void testFailedSpliceIsSyntaxError() {
        TokenList tokens = TypedefSimplifierTest.prepare("typedef int *P;\nP p;");
        AliasDeclaration decl = new DeclaratorParser().parseTypedef(tokens.front(), null).get(0);
        Token use = TokenPattern.findMatch(tokens.front(), "P p ;", null);

        SimplifyException e = assertThrows(SimplifyException.class,
                () -> new AliasSubstituter().substitute(brokenSite(use), decl, null, tokens));

        assertEquals(SimplifyException.Kind.SYNTAX, e.kind());
        assertEquals(2, e.location().line());
        assertTrue(e.getMessage().contains("'P'"), e.getMessage());
    }
}
