package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.scope.ScopeKind;
import com.raditha.cppnorm.scope.ScopeTracker;

/**
 * Rewrites {@code using N::x;} as {@code using x = N::x;} so that single-name imports
 * are inlined like aliases. Member using-declarations inside classes keep their
 * meaning and are left alone.
 */
public class UsingDeclarationNormalizer {

    /**
     * @return number of rewritten declarations
     */
    public int normalize(TokenList tokens) {
        ScopeTracker tracker = new ScopeTracker();
        int rewritten = 0;
        for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
            if (!tracker.update(tok)) {
                break;
            }
            if (!tok.is("using") || tracker.current().kind() == ScopeKind.RECORD) {
                continue;
            }
            Token last = importedName(tok);
            if (last != null) {
                Token name = tokens.insertAfter(tok, last.str());
                tokens.insertAfter(name, "=");
                rewritten++;
            }
        }
        return rewritten;
    }

    /**
     * The imported name of {@code using [::] A :: ... :: x ;}, or null when the
     * statement is something else.
     */
    static Token importedName(Token using) {
        Token t = using.next();
        if (TokenPattern.simpleMatch(t, "::")) {
            t = t.next();
        }
        boolean qualified = false;
        while (t != null && t.isIdentifier()) {
            if (TokenPattern.simpleMatch(t.next(), ";")) {
                return qualified ? t : null;
            }
            if (!TokenPattern.simpleMatch(t.next(), "::")) {
                return null;
            }
            qualified = true;
            t = t.tokAt(2);
        }
        return null;
    }
}
