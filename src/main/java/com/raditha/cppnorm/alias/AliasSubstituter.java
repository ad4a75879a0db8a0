package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.model.CppKeywords;
import com.raditha.cppnorm.model.SourceLocation;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenFlag;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.scope.ScopeTracker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces one use of an alias by the aliased type.
 * <p>
 * The base type and the part of the declarator left of the alias name go where the
 * use was; the part right of the name goes after the declarator the user wrote. For
 * {@code typedef void (*Fn)(int);} the statement {@code Fn f;} becomes
 * {@code void ( * f ) ( int ) ;}. Bracket pairs are linked as they are copied.
 */
public class AliasSubstituter {

    private static final String DECL_SPECIFIERS =
            "const|volatile|static|extern|typedef|mutable|inline|constexpr|register|thread_local|friend|virtual|explicit";

    /**
     * A use of an alias name, with the first token of its qualifier when written as
     * {@code N::Alias}.
     */
    public record UseSite(Token token, Token qualifierStart) {

        public UseSite(Token token) {
            this(token, null);
        }

        Token first() {
            return qualifierStart == null ? token : qualifierStart;
        }
    }

    record Range(Token first, Token last) {
    }

    /**
     * Substitute {@code decl} at {@code site}.
     *
     * @param scope tracker positioned at the use, or null on the file-scope fast path
     * @return the last token of the inserted base type and left declarator part,
     *         from which the caller resumes scanning
     * @throws SimplifyException when the token list cannot take the expansion
     */
    public Token substitute(UseSite site, AliasDeclaration decl, ScopeTracker scope, TokenList tokens) {
        Token use = site.token();
        SourceLocation location = use.location();
        try {
            return expand(site, decl, scope, tokens);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new SimplifyException(SimplifyException.Kind.SYNTAX, location,
                    "Failed to expand alias '" + decl.name() + "': " + e.getMessage());
        }
    }

    private Token expand(UseSite site, AliasDeclaration decl, ScopeTracker scope, TokenList tokens) {
        Token use = site.token();
        Token declaratorStart = use.next();
        boolean declarationStart = startsDeclaration(site.first());
        List<Token> inserted = new ArrayList<>();
        Map<Integer, Token> copies = new HashMap<>();

        Token cursor = use;
        boolean qualify = decl.baseQualifier() != null && (scope == null || !scope.isInside(decl.baseQualifier()));
        for (Token base : decl.base()) {
            if (qualify && base == decl.baseNameToken()) {
                for (String part : decl.baseQualifier().split("::")) {
                    cursor = insert(tokens, cursor, part, inserted);
                    cursor = insert(tokens, cursor, "::", inserted);
                }
            }
            cursor = copy(tokens, cursor, List.of(base), copies, inserted);
        }
        Token leftStart = cursor;
        cursor = copy(tokens, cursor, decl.left(), copies, inserted);
        List<String> qualifiers = leadingQualifiers(tokens, site.first(), decl);
        Token moved = placeQualifiers(tokens, leftStart, cursor, qualifiers);
        if (moved != null && moved.previous() == cursor) {
            cursor = moved;
        }
        Token resume = cursor;

        Range declarator = userDeclarator(declaratorStart);
        Token after = declarator == null ? declaratorStart : declarator.last().next();
        if (!decl.right().isEmpty()) {
            after = appendRight(tokens, cursor, declarator, decl, copies, inserted).next();
        }
        if (declarationStart && decl.hasDeclarator()) {
            expandFollowingDeclarators(tokens, after, decl, qualifiers, inserted);
        }

        for (Token t : inserted) {
            t.addFlag(TokenFlag.EXPANDED_ALIAS);
            t.setOriginalName(decl.name());
        }
        tokens.deleteRange(site.first(), use);
        return resume;
    }

    /**
     * Put the right declarator part after the user's declarator, parenthesising the
     * user's declarator where a pointer would otherwise bind to the wrong side.
     *
     * @return the last token of the inserted right part
     */
    private static Token appendRight(TokenList tokens, Token cursor, Range declarator, AliasDeclaration decl,
            Map<Integer, Token> copies, List<Token> inserted) {
        List<Token> right = decl.right();
        if (declarator == null) {
            return copy(tokens, cursor, right, copies, inserted);
        }
        Token last = declarator.last();
        if (TokenPattern.match(declarator.first(), "*|&|&&|^") && TokenPattern.match(right.get(0), "(|[")) {
            Token open = tokens.insertBefore(declarator.first(), "(");
            Token close = tokens.insertAfter(last, ")");
            tokens.createLink(open, close);
            inserted.add(open);
            inserted.add(close);
            last = close;
        }
        return copy(tokens, last, right, copies, inserted);
    }

    /**
     * Repeat the declarator parts around every further declarator of a declaration
     * statement, so that {@code IntPtr a, b;} declares two pointers.
     */
    private static void expandFollowingDeclarators(TokenList tokens, Token t, AliasDeclaration decl,
            List<String> qualifiers, List<Token> inserted) {
        while (true) {
            t = skipInitializer(t);
            if (t == null || !t.is(",")) {
                return;
            }
            Range declarator = userDeclarator(t.next());
            if (declarator == null) {
                return;
            }
            Map<Integer, Token> copies = new HashMap<>();
            Token leftEnd = copy(tokens, t, decl.left(), copies, inserted);
            placeQualifiers(tokens, t, leftEnd, qualifiers);
            Token last = declarator.last();
            if (!decl.right().isEmpty()) {
                last = appendRight(tokens, last, declarator, decl, copies, inserted);
            }
            t = last.next();
        }
    }

    /**
     * Take the cv-qualifiers written directly before a use of a pointer or reference
     * alias off the list. {@code const P p} with {@code P} a pointer alias qualifies the
     * pointer, not the pointee, so the qualifiers have to move behind the pointer
     * operator once the alias is expanded.
     *
     * @return the removed qualifiers in source order, empty when the alias declares
     *         no pointer operator
     */
    private static List<String> leadingQualifiers(TokenList tokens, Token first, AliasDeclaration decl) {
        if (lastPointerOperator(decl.left()) == null) {
            return List.of();
        }
        List<Token> found = new ArrayList<>();
        for (Token t = first.previous(); t != null && CppKeywords.isCvQualifier(t.str()); t = t.previous()) {
            found.add(0, t);
        }
        List<String> qualifiers = new ArrayList<>();
        for (Token t : found) {
            qualifiers.add(t.str());
            tokens.delete(t);
        }
        return qualifiers;
    }

    /**
     * Insert {@code qualifiers} after the last pointer operator in the copied left
     * declarator part {@code (leftStart, leftEnd]}. Qualifiers on a reference are
     * dropped, and a qualifier the alias already applies to the pointer is not repeated.
     *
     * @return the last inserted qualifier, or null when nothing was inserted
     */
    private static Token placeQualifiers(TokenList tokens, Token leftStart, Token leftEnd, List<String> qualifiers) {
        if (qualifiers.isEmpty() || leftStart == leftEnd) {
            return null;
        }
        List<Token> copied = new ArrayList<>();
        for (Token t = leftStart.next(); ; t = t.next()) {
            copied.add(t);
            if (t == leftEnd) {
                break;
            }
        }
        Token op = lastPointerOperator(copied);
        if (op == null || TokenPattern.match(op, "&|&&")) {
            return null;
        }
        List<String> present = new ArrayList<>();
        for (Token t = op.next(); t != null && CppKeywords.isCvQualifier(t.str()); t = t.next()) {
            present.add(t.str());
        }
        Token cursor = op;
        Token last = null;
        for (String q : qualifiers) {
            if (!present.contains(q)) {
                cursor = tokens.insertAfter(cursor, q);
                last = cursor;
            }
        }
        return last;
    }

    private static Token lastPointerOperator(List<Token> declaratorTokens) {
        Token op = null;
        for (Token t : declaratorTokens) {
            if (TokenPattern.match(t, "*|&|&&|^")) {
                op = t;
            }
        }
        return op;
    }

    /**
     * Whether the use is the type of a declaration statement, possibly after
     * declaration specifiers.
     */
    static boolean startsDeclaration(Token first) {
        Token prev = first.previous();
        while (prev != null && TokenPattern.match(prev, DECL_SPECIFIERS)) {
            prev = prev.previous();
        }
        if (prev == null || TokenPattern.match(prev, ";|{|}")) {
            return true;
        }
        if (prev.is(":")) {
            return TokenPattern.match(prev.previous(), "public|private|protected");
        }
        return prev.is("(") && TokenPattern.simpleMatch(prev.previous(), "for");
    }

    /**
     * The declarator written after a type: pointer operators, a possibly qualified
     * name, array dimensions and a parameter list, or a parenthesised declarator.
     * Null when there is none, as in a cast or an unnamed parameter.
     */
    static Range userDeclarator(Token start) {
        Token first = null;
        Token last = null;
        Token t = start;
        while (t != null && (TokenPattern.match(t, "*|&|&&|^") || CppKeywords.isCvQualifier(t.str()))) {
            if (first == null) {
                first = t;
            }
            last = t;
            t = t.next();
        }
        if (t != null && t.isIdentifier()) {
            if (first == null) {
                first = t;
            }
            while (TokenPattern.match(t, "%name% :: ~| %name%")) {
                t = t.next().next();
                if (t.is("~")) {
                    t = t.next();
                }
            }
            last = t;
            t = t.next();
        } else if (t != null && t.is("(") && t.link() != null && TokenPattern.match(t.next(), "*|&|&&|^")) {
            if (first == null) {
                first = t;
            }
            last = t.link();
            t = last.next();
        } else {
            return first == null ? null : new Range(first, last);
        }
        while (t != null && t.is("[") && t.link() != null) {
            last = t.link();
            t = last.next();
        }
        if (t != null && t.is("(") && t.link() != null && looksLikeParameters(t)) {
            last = t.link();
            t = last.next();
            while (TokenPattern.match(t, "const|volatile|noexcept|override|final")) {
                last = t;
                t = t.next();
            }
        }
        return new Range(first, last);
    }

    private static boolean looksLikeParameters(Token open) {
        Token first = open.next();
        if (first == open.link() || first.is("void")) {
            return true;
        }
        if (first.isStandardType() || CppKeywords.isCvQualifier(first.str())
                || TokenPattern.match(first, "struct|class|union|enum|typename|unsigned|signed")) {
            return true;
        }
        return TokenPattern.match(first, "%name% %name%|*|&|&&") && first.isIdentifier();
    }

    /**
     * Skip an initializer ({@code = expr}, {@code (args)} or {@code {args}}) and
     * return the token after it.
     */
    private static Token skipInitializer(Token t) {
        if (t == null) {
            return null;
        }
        if (TokenPattern.match(t, "(|{") && t.link() != null) {
            return t.link().next();
        }
        if (!t.is("=")) {
            return t;
        }
        for (t = t.next(); t != null; t = t.next()) {
            if (TokenPattern.match(t, ",|;")) {
                return t;
            }
            if (TokenPattern.match(t, "(|[|{|<") && t.link() != null) {
                t = t.link();
            } else if (TokenPattern.match(t, ")|]|}")) {
                return t;
            }
        }
        return null;
    }

    private static Token insert(TokenList tokens, Token cursor, String str, List<Token> inserted) {
        Token tok = tokens.insertAfter(cursor, str);
        inserted.add(tok);
        return tok;
    }

    private static Token copy(TokenList tokens, Token cursor, List<Token> sources, Map<Integer, Token> copies,
            List<Token> inserted) {
        Token last = tokens.copyTokens(cursor, sources, copies);
        if (last != cursor) {
            for (Token t = cursor.next(); ; t = t.next()) {
                inserted.add(t);
                if (t == last) {
                    break;
                }
            }
        }
        return last;
    }
}
