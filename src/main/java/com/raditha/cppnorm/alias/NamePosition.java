package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenPattern;

/**
 * Local checks on the position of a name that equals an alias name.
 */
final class NamePosition {

    /** What an occurrence of the name declares, if anything. */
    enum Declares { NONE, VARIABLE, RECORD }

    private NamePosition() {
    }

    /**
     * Whether {@code tok} declares something with its name: a variable, parameter,
     * function or alias ({@code VARIABLE}), or a class, struct, union or enum
     * ({@code RECORD}).
     */
    static Declares declaration(Token tok) {
        Token prev = tok.previous();
        Token next = tok.next();
        if (prev == null) {
            return Declares.NONE;
        }
        if (TokenPattern.match(prev, "class|struct|union|enum") && TokenPattern.match(next, "{|:|;|final")) {
            return Declares.RECORD;
        }
        if (prev.is("using") && TokenPattern.simpleMatch(next, "=")) {
            return Declares.VARIABLE;
        }
        if (!isTypeLike(prev)) {
            return Declares.NONE;
        }
        if (TokenPattern.match(next, ";|=|,|[|)|{|:")) {
            return Declares.VARIABLE;
        }
        if (TokenPattern.simpleMatch(next, "(")
                && (prev.isStandardType() || prev.isIdentifier() || (prev.is(">") && prev.link() != null))) {
            return Declares.VARIABLE;
        }
        return Declares.NONE;
    }

    /**
     * Whether a type name written before a declared name could end at {@code prev}.
     */
    static boolean isTypeLike(Token prev) {
        if (prev.isStandardType() || (prev.is(">") && prev.link() != null)) {
            return true;
        }
        Token before = prev.previous();
        if (prev.isIdentifier()) {
            return before == null || !(TokenPattern.match(before, ".|->")
                    || (before.isOp() && !TokenPattern.match(before, "*|&|&&")));
        }
        if (!TokenPattern.match(prev, "*|&|&&")) {
            return false;
        }
        return before != null && (before.isStandardType() || before.isIdentifier()
                || TokenPattern.match(before, "*|&|&&|const") || (before.is(">") && before.link() != null));
    }

    /**
     * Whether the name at {@code tok} cannot be a use of the alias: a member access,
     * a destructor, an elaborated type name, a label or a scope access on an alias
     * that is not a plain type.
     */
    static boolean isExcluded(Token tok, DeclaratorShape shape) {
        Token prev = tok.previous();
        Token next = tok.next();
        if (TokenPattern.match(prev, ".|->|.*|->*|~|class|struct|union|enum|goto|namespace")) {
            return true;
        }
        if (TokenPattern.match(next, ".|->")) {
            return true;
        }
        if (TokenPattern.simpleMatch(next, "::") && !shape.allowsScopeAccess()) {
            return true;
        }
        return TokenPattern.simpleMatch(next, ":") && (prev == null || TokenPattern.match(prev, ";|{|}"));
    }
}
