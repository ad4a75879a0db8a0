package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.model.CppKeywords;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.scope.ScopeInfo;
import com.raditha.cppnorm.scope.ScopeKind;
import com.raditha.cppnorm.scope.ScopeTracker;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses typedef and using alias declarations into {@link AliasDeclaration}s.
 * <p>
 * The parser recognises a base type followed by a declarator built from pointer
 * operators, parenthesised nests, array dimensions and parameter lists. Anything else
 * is reported as unparseable by returning an empty result; the caller leaves such
 * declarations untouched.
 */
public class DeclaratorParser {

    /** Kind of suffix following the name or the innermost nest. */
    enum Suffix { NONE, ARRAY, PARAMS }

    record BaseType(List<Token> tokens, Token next, Token nameToken, boolean typeOf) {
    }

    record Declarator(List<Token> left, Token name, List<Token> right, Token next, int nest,
            boolean pointer, boolean memberPointer, boolean paramsInsideNest, Suffix suffix) {
    }

    /**
     * Parse the typedef starting at {@code typedefTok}. A typedef declaring several names
     * ({@code typedef int A, *B;}) gives one declaration per name, sharing the base.
     *
     * @param tracker tracker positioned at the typedef, or null for file scope
     * @return the declarations, empty when the typedef cannot be parsed
     */
    public List<AliasDeclaration> parseTypedef(Token typedefTok, ScopeTracker tracker) {
        Token end = statementEnd(typedefTok.next());
        if (end == null) {
            return List.of();
        }
        BaseType base = parseBaseType(typedefTok.next(), end);
        if (base == null) {
            return List.of();
        }
        List<AliasDeclaration> result = new ArrayList<>();
        Token t = base.next();
        while (true) {
            Declarator d = parseDeclarator(t, end, true);
            if (d == null || d.name() == null) {
                return List.of();
            }
            Token next = skipAttributes(d.next(), end);
            if (next != end && !TokenPattern.simpleMatch(next, ",")) {
                return List.of();
            }
            result.add(build(typedefTok, d.name(), base, d, end, tracker));
            if (next == end) {
                return result;
            }
            t = next.next();
        }
    }

    /**
     * Parse {@code using Name = type-id ;}. Alias templates are not supported.
     *
     * @param tracker tracker positioned at the using, or null for file scope
     */
    public Optional<AliasDeclaration> parseUsing(Token usingTok, ScopeTracker tracker) {
        if (isAliasTemplate(usingTok)) {
            return Optional.empty();
        }
        Token nameTok = usingTok.next();
        if (nameTok == null || !nameTok.isIdentifier()) {
            return Optional.empty();
        }
        Token eq = skipAttributes(nameTok.next(), null);
        if (eq == null || !eq.is("=")) {
            return Optional.empty();
        }
        Token end = statementEnd(eq.next());
        if (end == null) {
            return Optional.empty();
        }
        BaseType base = parseBaseType(eq.next(), end);
        if (base == null) {
            return Optional.empty();
        }
        Declarator d = parseDeclarator(base.next(), end, false);
        if (d == null || skipAttributes(d.next(), end) != end) {
            return Optional.empty();
        }
        return Optional.of(build(usingTok, nameTok, base, d, end, tracker));
    }

    /**
     * Whether the using declaration is preceded by a template header.
     */
    public static boolean isAliasTemplate(Token usingTok) {
        Token prev = usingTok.previous();
        return prev != null && prev.is(">") && prev.link() != null
                && TokenPattern.simpleMatch(prev.link().previous(), "template");
    }

    private static AliasDeclaration build(Token keyword, Token nameTok, BaseType base, Declarator d, Token end,
            ScopeTracker tracker) {
        String scope = "";
        Token scopeStart = null;
        Token rescanEnd = null;
        String baseQualifier = null;
        Token baseName = null;
        if (tracker != null) {
            ScopeInfo current = tracker.current();
            scope = current.fullName();
            scopeStart = current.bodyStart();
            if (current.kind() == ScopeKind.OTHER || current.kind() == ScopeKind.MEMBER_FUNCTION) {
                rescanEnd = current.bodyEnd();
            }
            if (base.nameToken() != null && isUnqualified(base.nameToken())) {
                Optional<ScopeInfo> owner = tracker.findTypeOwner(base.nameToken().str());
                if (owner.isPresent()) {
                    baseQualifier = owner.get().fullName();
                    baseName = base.nameToken();
                }
            }
        }
        return new AliasDeclaration(keyword, nameTok.str(), nameTok, scope, scopeStart, rescanEnd,
                classify(d, base.typeOf()), base.tokens(), baseName, baseQualifier, d.left(), d.right(), end);
    }

    private static boolean isUnqualified(Token name) {
        return !TokenPattern.simpleMatch(name.previous(), "::") && !TokenPattern.simpleMatch(name.next(), "::");
    }

    static DeclaratorShape classify(Declarator d, boolean typeOf) {
        if (d.memberPointer()) {
            return DeclaratorShape.POINTER_TO_MEMBER;
        }
        if (d.nest() >= 2 || (d.nest() == 1 && d.paramsInsideNest())) {
            return DeclaratorShape.FUNCTION_RETURNING_FUNCTION_POINTER;
        }
        if (d.nest() == 1) {
            return switch (d.suffix()) {
                case ARRAY -> DeclaratorShape.POINTER_TO_ARRAY;
                case PARAMS -> DeclaratorShape.FUNCTION_POINTER;
                default -> d.pointer() ? DeclaratorShape.POINTER : DeclaratorShape.PLAIN;
            };
        }
        return switch (d.suffix()) {
            case PARAMS -> DeclaratorShape.FUNCTION;
            case ARRAY -> DeclaratorShape.ARRAY;
            default -> {
                if (d.pointer()) {
                    yield DeclaratorShape.POINTER;
                }
                yield typeOf ? DeclaratorShape.TYPEOF : DeclaratorShape.PLAIN;
            }
        };
    }

    /**
     * Parse a base type: cv-qualifiers, an elaborated or qualified type name with
     * template arguments, a sequence of fundamental type keywords, or decltype/typeof.
     *
     * @return the base type, or null when there is none before {@code end}
     */
    static BaseType parseBaseType(Token start, Token end) {
        List<Token> tokens = new ArrayList<>();
        Token nameToken = null;
        boolean fundamental = false;
        boolean named = false;
        boolean typeOf = false;
        Token t = start;
        while (t != null && t != end) {
            if (CppKeywords.isCvQualifier(t.str()) || t.is("typename")) {
                tokens.add(t);
                t = t.next();
            } else if (TokenPattern.match(t, "struct|class|union|enum")) {
                if (named || fundamental) {
                    break;
                }
                tokens.add(t);
                t = t.next();
                if (TokenPattern.match(t, "class|struct")) {
                    tokens.add(t);
                    t = t.next();
                }
                if (!startsQualifiedName(t)) {
                    return null;
                }
                nameToken = firstName(t);
                t = consumeQualifiedName(t, tokens);
                named = true;
            } else if (CppKeywords.isFundamentalSpecifier(t.str())) {
                if (named) {
                    break;
                }
                fundamental = true;
                tokens.add(t);
                t = t.next();
            } else if (TokenPattern.match(t, "decltype|typeof|__typeof__|__typeof (") && t.next().link() != null) {
                if (named || fundamental) {
                    break;
                }
                Token close = t.next().link();
                addRange(tokens, t, close);
                t = close.next();
                named = true;
                typeOf = true;
            } else if (startsQualifiedName(t)) {
                if (named || fundamental) {
                    break;
                }
                nameToken = firstName(t);
                t = consumeQualifiedName(t, tokens);
                named = true;
            } else {
                break;
            }
        }
        if (!named && !fundamental) {
            return null;
        }
        return new BaseType(tokens, t, nameToken, typeOf);
    }

    private static boolean startsQualifiedName(Token t) {
        if (t == null) {
            return false;
        }
        if (t.is("::")) {
            return t.next() != null && t.next().isIdentifier();
        }
        return t.isIdentifier();
    }

    private static Token firstName(Token t) {
        return t.is("::") ? t.next() : t;
    }

    /**
     * Consume {@code [::] A [<..>] :: B [<..>] ...} into {@code tokens}.
     *
     * @return the token after the name
     */
    private static Token consumeQualifiedName(Token t, List<Token> tokens) {
        if (t.is("::")) {
            tokens.add(t);
            t = t.next();
        }
        while (t != null) {
            tokens.add(t);
            t = t.next();
            if (t != null && t.is("<") && t.link() != null) {
                Token close = t.link();
                addRange(tokens, t, close);
                t = close.next();
            }
            if (!TokenPattern.match(t, ":: template| %name%") || TokenPattern.match(t, ":: *")) {
                return t;
            }
            tokens.add(t);
            t = t.next();
            if (t.is("template")) {
                tokens.add(t);
                t = t.next();
            }
            if (!t.isIdentifier()) {
                return t;
            }
        }
        return null;
    }

    /**
     * Parse a declarator up to {@code limit}.
     *
     * @param named true for typedef declarators, which must contain a name; false for
     *              the abstract declarator of a using alias, whose name position is left empty
     * @return the declarator, or null when it cannot be parsed
     */
    static Declarator parseDeclarator(Token start, Token limit, boolean named) {
        List<Token> left = new ArrayList<>();
        List<Token> right = new ArrayList<>();
        boolean pointer = false;
        boolean memberPointer = false;
        Token t = start;
        while (t != null && t != limit) {
            if (TokenPattern.match(t, "*|&|&&|^")) {
                left.add(t);
                pointer = true;
                t = t.next();
            } else if (CppKeywords.isCvQualifier(t.str())) {
                left.add(t);
                t = t.next();
            } else if (isMemberPointer(t)) {
                while (!t.is("*")) {
                    left.add(t);
                    t = t.next();
                }
                left.add(t);
                t = t.next();
                pointer = true;
                memberPointer = true;
            } else {
                break;
            }
        }

        Token name = null;
        int nest = 0;
        boolean paramsInsideNest = false;
        if (named && t != null && t != limit && t.isIdentifier()) {
            name = t;
            t = t.next();
        } else if (t != null && t != limit && t.is("(") && t.link() != null && isNest(t, named)) {
            Token close = t.link();
            Declarator inner = parseDeclarator(t.next(), close, named);
            if (inner == null || inner.next() != close) {
                return null;
            }
            left.add(t);
            left.addAll(inner.left());
            name = inner.name();
            right.addAll(inner.right());
            right.add(close);
            nest = inner.nest() + 1;
            pointer |= inner.pointer();
            memberPointer |= inner.memberPointer();
            paramsInsideNest = inner.suffix() == Suffix.PARAMS || inner.paramsInsideNest();
            t = close.next();
        } else if (named) {
            return null;
        }

        Suffix suffix = Suffix.NONE;
        while (t != null && t != limit && t.is("[") && t.link() != null) {
            addRange(right, t, t.link());
            t = t.link().next();
            suffix = Suffix.ARRAY;
        }
        if (suffix == Suffix.NONE && t != null && t != limit && t.is("(") && t.link() != null) {
            addRange(right, t, t.link());
            t = t.link().next();
            suffix = Suffix.PARAMS;
            while (t != null && t != limit && TokenPattern.match(t, "const|volatile|&|&&|noexcept|throw")) {
                if (TokenPattern.match(t, "noexcept|throw (") && t.next().link() != null) {
                    addRange(right, t, t.next().link());
                    t = t.next().link().next();
                } else {
                    right.add(t);
                    t = t.next();
                }
            }
        }
        return new Declarator(left, name, right, t, nest, pointer, memberPointer, paramsInsideNest, suffix);
    }

    /** {@code A :: *} or {@code A :: B :: *}. */
    private static boolean isMemberPointer(Token t) {
        while (t != null && t.isIdentifier() && TokenPattern.simpleMatch(t.next(), "::")) {
            t = t.tokAt(2);
            if (t != null && t.is("*")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code (} opens a nested declarator rather than a parameter list.
     */
    private static boolean isNest(Token open, boolean named) {
        Token first = open.next();
        if (first == open.link()) {
            return false;
        }
        if (TokenPattern.match(first, "*|&|&&|^") || isMemberPointer(first)) {
            return true;
        }
        // parenthesised name: typedef int (T);
        return named && first.isIdentifier() && first.next() == open.link();
    }

    /**
     * The {@code ;} ending the statement that contains {@code start}, skipping linked
     * brackets. Null when a brace or the end of the list comes first.
     */
    static Token statementEnd(Token start) {
        for (Token t = start; t != null; t = t.next()) {
            if (t.is(";")) {
                return t;
            }
            if (TokenPattern.match(t, "{|}")) {
                return null;
            }
            if (TokenPattern.match(t, "(|[|<") && t.link() != null) {
                t = t.link();
            }
        }
        return null;
    }

    private static Token skipAttributes(Token t, Token limit) {
        while (t != null && t != limit) {
            if (TokenPattern.match(t, "__attribute__|__declspec|alignas (") && t.next().link() != null) {
                t = t.next().link().next();
            } else if (TokenPattern.simpleMatch(t, "[ [") && t.link() != null) {
                t = t.link().next();
            } else {
                break;
            }
        }
        return t;
    }

    private static void addRange(List<Token> tokens, Token first, Token last) {
        for (Token t = first; t != null; t = t.next()) {
            tokens.add(t);
            if (t == last) {
                return;
            }
        }
    }
}
