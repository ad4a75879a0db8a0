package com.raditha.cppnorm.varid;

import com.raditha.cppnorm.model.CppKeywords;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Recognises variable and function declarations by their local shape.
 * <p>
 * A declaration is a run of declaration specifiers, a type, and one or more
 * declarators. The type is a sequence of fundamental type keywords, an elaborated
 * {@code struct X}, {@code decltype(..)}, or a possibly qualified name with linked
 * template arguments. Declarators are pointer operators, an optional parenthesised
 * nest for function pointers, a name, and array or parameter suffixes. Anything that
 * does not fit is not a declaration.
 */
public class DeclarationParser {

    /** Words that never start a declaration. */
    static final Set<String> EXCLUDED = Set.of(
            "return", "delete", "new", "throw", "goto", "case", "default", "sizeof", "if", "else",
            "while", "do", "for", "switch", "break", "continue", "typedef", "using", "namespace",
            "template", "operator", "co_return", "co_await", "co_yield", "alignof", "typeid",
            "static_assert", "_Static_assert", "this", "nullptr", "true", "false", "public", "private",
            "protected", "asm", "try", "catch", "requires", "concept", "export");

    private static final String SPECIFIERS =
            "static|extern|const|volatile|mutable|inline|constexpr|constinit|consteval|register|thread_local|"
                    + "virtual|explicit|friend|typename|_Thread_local|__restrict|restrict";

    /**
     * A recognised declaration.
     *
     * @param typeEnd  last token of the type; scanning resumes after it
     * @param names    declared variable names, empty for functions and qualified definitions
     * @param params   opening parenthesis of a function's parameter list, or null
     */
    public record Declaration(Token typeEnd, List<Token> names, Token params) {

        public boolean isFunction() {
            return params != null;
        }
    }

    private record Declarator(Token name, Token after, Token params, boolean qualified, List<Token> bindings) {
    }

    /**
     * Parse a declaration at {@code start}.
     *
     * @param executable whether the position is inside a function body, where
     *                   {@code T x(args)} constructs a variable
     * @param single     whether only one declarator may follow, as in a parameter list
     * @param isVariable tells which names are currently bound to variables
     */
    public Optional<Declaration> parse(Token start, boolean executable, boolean single, Predicate<String> isVariable) {
        Token t = skipSpecifiers(start);
        if (t == null || EXCLUDED.contains(t.str())) {
            return Optional.empty();
        }
        if (!executable && TokenPattern.match(t, "~ %name% (") && t.next().isIdentifier()) {
            return Optional.of(new Declaration(t.next(), List.of(), t.tokAt(2)));
        }
        Token typeEnd = typeEnd(t, isVariable);
        if (typeEnd == null) {
            return Optional.empty();
        }
        Token after = typeEnd.next();
        while (after != null && CppKeywords.isCvQualifier(after.str())) {
            typeEnd = after;
            after = after.next();
        }
        if (TokenPattern.match(after, ":: ~ %name% (")) {
            return Optional.of(new Declaration(typeEnd, List.of(), after.tokAt(3)));
        }
        if (after != null && after.is("(") && !executable && !TokenPattern.match(after.next(), "*|&|&&|^")
                && !isMemberPointer(after.next())) {
            // constructor, or a function-like macro at file scope
            return t.isName() && !t.isKeyword()
                    ? Optional.of(new Declaration(typeEnd, List.of(), after))
                    : Optional.empty();
        }
        return declarators(typeEnd, after, executable, single, typeEnd.is("auto"), isVariable);
    }

    /**
     * Parse the declarators following a record or enum body, as in {@code struct S {..} s, *p;}.
     */
    public Optional<Declaration> parseAfterBody(Token closingBrace, boolean executable, Predicate<String> isVariable) {
        return declarators(closingBrace, closingBrace.next(), executable, false, false, isVariable);
    }

    private Optional<Declaration> declarators(Token typeEnd, Token t, boolean executable, boolean single,
            boolean auto, Predicate<String> isVariable) {
        List<Token> names = new ArrayList<>();
        while (true) {
            Declarator d = declarator(t, executable, auto, isVariable);
            if (d == null) {
                return Optional.empty();
            }
            if (d.params() != null) {
                return names.isEmpty() ? Optional.of(new Declaration(typeEnd, List.of(), d.params()))
                        : Optional.empty();
            }
            if (!TokenPattern.match(d.after(), ";|,|)|=|{|:|(")) {
                return Optional.empty();
            }
            if (d.bindings() != null) {
                names.addAll(d.bindings());
            } else if (!d.qualified()) {
                names.add(d.name());
            }
            Token next = skipInitializer(d.after());
            if (single || next == null || !next.is(",")) {
                return Optional.of(new Declaration(typeEnd, names, null));
            }
            t = next.next();
        }
    }

    /**
     * Last token of the type starting at {@code t}, or null.
     */
    static Token typeEnd(Token t, Predicate<String> isVariable) {
        if (TokenPattern.match(t, "struct|class|union|enum")) {
            Token name = t.next();
            if (t.is("enum") && TokenPattern.match(name, "class|struct")) {
                name = name.next();
            }
            return name != null && (name.isIdentifier() || name.is("::")) ? qualifiedNameEnd(name) : null;
        }
        if (CppKeywords.isFundamentalSpecifier(t.str())) {
            Token end = t;
            while (end.next() != null && (CppKeywords.isFundamentalSpecifier(end.next().str())
                    || CppKeywords.isCvQualifier(end.next().str()))) {
                end = end.next();
            }
            return end;
        }
        if (TokenPattern.match(t, "decltype|typeof|__typeof__ (") && t.next().link() != null) {
            return t.next().link();
        }
        Token first = t.is("::") ? t.next() : t;
        if (first == null || !first.isIdentifier() || isVariable.test(first.str())) {
            return null;
        }
        if (TokenPattern.match(t.is("::") ? first.next() : t.next(), ".|->")) {
            return null;
        }
        return qualifiedNameEnd(t);
    }

    /**
     * End of {@code [::] A [<..>] :: B [<..>]}; a trailing {@code ::*} is not consumed.
     */
    static Token qualifiedNameEnd(Token t) {
        if (t.is("::")) {
            t = t.next();
        }
        Token end = null;
        while (t != null && t.isIdentifier()) {
            end = t;
            Token next = t.next();
            if (next != null && next.is("<") && next.link() != null) {
                end = next.link();
                next = end.next();
            }
            if (!TokenPattern.match(next, ":: template| %name%") || !next.next().isName()) {
                return end;
            }
            t = next.next();
            if (t.is("template")) {
                t = t.next();
            }
        }
        return end;
    }

    private static Declarator declarator(Token t, boolean executable, boolean auto,
            Predicate<String> isVariable) {
        while (t != null && (TokenPattern.match(t, "*|&|&&|^") || CppKeywords.isCvQualifier(t.str())
                || isMemberPointer(t))) {
            if (isMemberPointer(t)) {
                t = memberPointerStar(t);
            }
            t = t.next();
        }
        if (t == null) {
            return null;
        }
        if (t.is("operator")) {
            Token open = t.next();
            if (TokenPattern.simpleMatch(open, "( )")) {
                open = open.next().next();
            }
            while (open != null && !open.is("(") && !TokenPattern.match(open, ";|{|}")) {
                open = open.is("<") && open.link() != null ? open.link().next() : open.next();
            }
            return open != null && open.is("(") ? new Declarator(t, open, open, false, null) : null;
        }
        if (auto && t.is("[") && t.link() != null) {
            List<Token> bindings = structuredBindings(t);
            return bindings == null ? null : new Declarator(null, t.link().next(), null, false, bindings);
        }

        Token name;
        Token after;
        boolean qualified = false;
        if (t.is("(") && t.link() != null && (TokenPattern.match(t.next(), "*|&|&&|^") || isMemberPointer(t.next()))) {
            Token inner = t.next();
            while (inner != t.link() && (!inner.isIdentifier() || isMemberPointer(inner))) {
                inner = isMemberPointer(inner) ? memberPointerStar(inner).next() : inner.next();
            }
            if (inner == t.link() || TokenPattern.simpleMatch(inner.next(), "::")) {
                return null;
            }
            name = inner;
            after = t.link().next();
            if (after == null || !TokenPattern.match(after, "(|[")) {
                // "f(*p);" is a call
                return null;
            }
            while (after != null && TokenPattern.match(after, "(|[") && after.link() != null) {
                after = after.link().next();
            }
            return new Declarator(name, after, null, false, null);
        }
        if (!t.isIdentifier()) {
            return null;
        }
        name = t;
        while (TokenPattern.match(name, "%name% :: ~| %name%|operator")) {
            qualified = true;
            name = name.tokAt(2);
            if (name.is("~")) {
                name = name.next();
            }
        }
        if (name.is("operator")) {
            Declarator op = declarator(name, executable, false, isVariable);
            return op == null ? null : new Declarator(op.name(), op.after(), op.params(), true, null);
        }
        after = name.next();
        while (after != null && after.is("[") && after.link() != null) {
            after = after.link().next();
        }
        if (after != null && after.is("(") && after.link() != null) {
            if (qualified || !executable || isFunctionDeclaration(after, isVariable)) {
                return new Declarator(name, after, after, qualified, null);
            }
        }
        return new Declarator(name, after, null, qualified, null);
    }

    /** {@code C :: *} or {@code A :: C :: *}. */
    private static boolean isMemberPointer(Token t) {
        return memberPointerStar(t) != null;
    }

    private static Token memberPointerStar(Token t) {
        while (t != null && t.isIdentifier() && TokenPattern.simpleMatch(t.next(), "::")) {
            t = t.tokAt(2);
            if (t != null && t.is("*")) {
                return t;
            }
        }
        return null;
    }

    private static List<Token> structuredBindings(Token open) {
        List<Token> names = new ArrayList<>();
        for (Token t = open.next(); t != open.link(); t = t.next()) {
            if (!t.isIdentifier()) {
                return null;
            }
            names.add(t);
            t = t.next();
            if (t == open.link()) {
                break;
            }
            if (!t.is(",")) {
                return null;
            }
        }
        return names.isEmpty() ? null : names;
    }

    /**
     * Inside a function body, whether {@code name(...)} declares a function rather than
     * a variable initialised with constructor arguments.
     */
    static boolean isFunctionDeclaration(Token open, Predicate<String> isVariable) {
        Token first = open.next();
        if (first == open.link()) {
            return true;
        }
        if (first.isStandardType() || CppKeywords.isCvQualifier(first.str())
                || TokenPattern.match(first, "struct|class|union|enum|unsigned|signed|typename")) {
            return !TokenPattern.match(first.next(), "(|{");
        }
        if (!first.isIdentifier() || isVariable.test(first.str())) {
            return false;
        }
        Token second = first.next();
        return second.isIdentifier() || (TokenPattern.match(second, "*|&|&&") && TokenPattern.match(second.next(), "%name%|,|)"));
    }

    private static Token skipSpecifiers(Token t) {
        while (t != null) {
            if (TokenPattern.match(t, SPECIFIERS)) {
                t = t.next();
            } else if (TokenPattern.match(t, "%str%") && TokenPattern.simpleMatch(t.previous(), "extern")) {
                t = t.next();
            } else if (TokenPattern.simpleMatch(t, "[ [") && t.link() != null) {
                t = t.link().next();
            } else if (TokenPattern.match(t, "__attribute__|__declspec|alignas|_Alignas (") && t.next().link() != null) {
                t = t.next().link().next();
            } else {
                return t;
            }
        }
        return null;
    }

    /**
     * Skip an initializer and return the token after it: the {@code ,} before the next
     * declarator, the terminator, or null.
     */
    static Token skipInitializer(Token t) {
        if (t == null) {
            return null;
        }
        if (TokenPattern.match(t, "(|{") && t.link() != null) {
            t = t.link().next();
        }
        if (t == null || !TokenPattern.match(t, "=|:")) {
            return t;
        }
        for (t = t.next(); t != null; t = t.next()) {
            if (TokenPattern.match(t, ",|;|)|}")) {
                return t;
            }
            if (TokenPattern.match(t, "(|[|{|<") && t.link() != null) {
                t = t.link();
            }
        }
        return null;
    }

    /**
     * The opening brace of the body following a parameter list, skipping trailing
     * qualifiers, a trailing return type and a constructor initializer list. Null when
     * the parameter list ends a declaration without a body.
     */
    public static Token functionBodyAfter(Token close) {
        boolean initializers = false;
        for (Token t = close.next(); t != null; t = t.next()) {
            if (t.is("{")) {
                if (initializers && (t.previous().isIdentifier() || t.previous().is(">")) && t.link() != null) {
                    t = t.link();
                    continue;
                }
                return t;
            }
            if (TokenPattern.match(t, ";|}") || (!initializers && TokenPattern.match(t, ",|)|="))) {
                return null;
            }
            if (t.is(":")) {
                initializers = true;
            } else if (TokenPattern.match(t, "(|[|<") && t.link() != null) {
                t = t.link();
            }
        }
        return null;
    }
}
