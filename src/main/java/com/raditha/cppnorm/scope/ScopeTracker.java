package com.raditha.cppnorm.scope;

import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenKind;
import com.raditha.cppnorm.model.TokenPattern;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the scope tree while a caller walks the token list forward.
 * <p>
 * Feed every token to {@link #update(Token)} in order. Each opening brace opens a child
 * of the current scope and the matching closing brace returns to its parent. The tracker
 * never looks ahead of the token it is given except to classify an opening brace, so
 * the caller may rewrite tokens behind the cursor freely.
 * <p>
 * Name lookup follows unqualified C++ lookup closely enough for alias and member
 * resolution: the scope itself, its {@code using namespace} targets, other scopes
 * with the same qualified name (a reopened namespace, or the class of an out-of-class
 * member function), then the enclosing scopes.
 */
public class ScopeTracker {

    private final ScopeInfo root;
    private final Map<String, List<ScopeInfo>> scopesByName = new HashMap<>();
    private ScopeInfo current;

    public ScopeTracker() {
        this.root = ScopeInfo.global();
        this.current = root;
        register(root);
    }

    private ScopeTracker(ScopeInfo root) {
        this.root = root;
        this.current = root;
    }

    public ScopeInfo root() {
        return root;
    }

    public ScopeInfo current() {
        return current;
    }

    /**
     * Advance the tracker over {@code tok}.
     *
     * @return false when {@code tok} is a closing brace that matches no open scope;
     *         the tree is left unchanged in that case
     */
    public boolean update(Token tok) {
        if (tok.is("{")) {
            open(tok);
        } else if (tok.is("}")) {
            return close(tok);
        } else if (TokenPattern.simpleMatch(tok, "using namespace")) {
            String target = qualifiedName(tok.tokAt(2));
            if (!target.isEmpty()) {
                current.usingNamespaces().add(target);
            }
        } else if (TokenPattern.match(tok, "class|struct|union %name% ;")
                && !TokenPattern.match(tok.previous(), "friend|enum")) {
            current.recordTypes().add(tok.next().str());
        }
        return true;
    }

    /**
     * Deep copy of the tree with the cursor at the same scope. Tokens are shared.
     */
    public ScopeTracker copy() {
        Map<ScopeInfo, ScopeInfo> mapping = new IdentityHashMap<>();
        ScopeInfo rootCopy = ScopeInfo.global();
        mapping.put(root, rootCopy);
        ScopeTracker copy = new ScopeTracker(rootCopy);
        copy.copyChildren(root, rootCopy, mapping);
        copyContents(root, rootCopy);
        copy.register(rootCopy);
        copy.current = mapping.get(current);
        return copy;
    }

    private void copyChildren(ScopeInfo source, ScopeInfo target, Map<ScopeInfo, ScopeInfo> mapping) {
        for (ScopeInfo child : source.children()) {
            ScopeInfo childCopy = new ScopeInfo(child.kind(), child.name(), child.fullName(), target,
                    child.bodyStart(), child.isFunctionBody());
            copyContents(child, childCopy);
            mapping.put(child, childCopy);
            register(childCopy);
            copyChildren(child, childCopy, mapping);
        }
    }

    private static void copyContents(ScopeInfo source, ScopeInfo target) {
        target.recordTypes().addAll(source.recordTypes());
        target.baseTypes().addAll(source.baseTypes());
        target.usingNamespaces().addAll(source.usingNamespaces());
    }

    private void open(Token lbrace) {
        String namespace = namespaceName(lbrace);
        if (namespace != null) {
            if (namespace.isEmpty()) {
                push(ScopeKind.NAMESPACE, "", current.fullName(), lbrace, false);
            } else {
                push(ScopeKind.NAMESPACE, namespace, qualify(current.fullName(), namespace), lbrace, false);
            }
            return;
        }
        Token prev = lbrace.previous();
        if (prev != null && prev.kind() == TokenKind.STRING && TokenPattern.simpleMatch(prev.previous(), "extern")) {
            push(ScopeKind.NAMESPACE, "", current.fullName(), lbrace, false);
            return;
        }
        Token keyword = recordKeyword(lbrace);
        if (keyword != null) {
            openRecord(keyword, lbrace);
            return;
        }
        Token functionName = functionName(lbrace);
        if (functionName != null) {
            String path = classPath(functionName);
            if (!path.isEmpty()) {
                String fullName = resolveQualified(path);
                int sep = fullName.lastIndexOf("::");
                push(ScopeKind.MEMBER_FUNCTION, sep < 0 ? fullName : fullName.substring(sep + 2),
                        fullName, lbrace, true);
            } else {
                push(ScopeKind.OTHER, "", current.fullName(), lbrace, true);
            }
            return;
        }
        push(ScopeKind.OTHER, "", current.fullName(), lbrace, false);
    }

    private boolean close(Token rbrace) {
        for (ScopeInfo s = current; s != null && !s.isGlobal(); s = s.parent()) {
            if (s.bodyEnd() == rbrace) {
                current = s.parent();
                return true;
            }
        }
        return false;
    }

    private void push(ScopeKind kind, String name, String fullName, Token lbrace, boolean functionBody) {
        ScopeInfo scope = new ScopeInfo(kind, name, fullName, current, lbrace, functionBody);
        register(scope);
        current = scope;
    }

    private void register(ScopeInfo scope) {
        scopesByName.computeIfAbsent(scope.fullName(), k -> new ArrayList<>()).add(scope);
    }

    private void openRecord(Token keyword, Token lbrace) {
        boolean isEnum = keyword.is("enum") || TokenPattern.simpleMatch(keyword.previous(), "enum");
        Token tok = keyword.next();
        if (TokenPattern.match(tok, "alignas|__declspec|__attribute__ (")) {
            tok = tok.next().link().next();
        }
        String name = "";
        List<String> parts = new ArrayList<>();
        while (tok != null && tok.isIdentifier()) {
            parts.add(tok.str());
            tok = tok.next();
            if (tok != null && tok.is("<") && tok.link() != null) {
                tok = tok.link().next();
            }
            if (tok == null || !tok.is("::")) {
                break;
            }
            tok = tok.next();
        }
        if (!parts.isEmpty()) {
            name = parts.get(parts.size() - 1);
        }
        if (tok != null && tok.is("final")) {
            tok = tok.next();
        }
        if (tok == null || !TokenPattern.match(tok, "{|:")) {
            // "struct S s {..}": brace initializer of a variable
            push(ScopeKind.OTHER, "", current.fullName(), lbrace, false);
            return;
        }
        if (isEnum) {
            if (!name.isEmpty()) {
                current.recordTypes().add(name);
            }
            push(ScopeKind.OTHER, "", current.fullName(), lbrace, false);
            return;
        }
        if (!name.isEmpty()) {
            current.recordTypes().add(name);
        }
        String fullName = name.isEmpty() ? current.fullName() : qualify(current.fullName(), String.join("::", parts));
        push(ScopeKind.RECORD, name, fullName, lbrace, false);
        if (tok.is(":")) {
            parseBases(tok.next(), lbrace);
        }
    }

    private void parseBases(Token start, Token lbrace) {
        StringBuilder base = new StringBuilder();
        int angle = 0;
        for (Token tok = start; tok != null && tok != lbrace; tok = tok.next()) {
            if (tok.is("<")) {
                if (tok.link() != null) {
                    tok = tok.link();
                } else {
                    angle++;
                }
            } else if (tok.is(">") && angle > 0) {
                angle--;
            } else if (angle > 0) {
                continue;
            } else if (tok.is(",")) {
                addBase(base);
            } else if (tok.is("::") || tok.isIdentifier()) {
                base.append(tok.str());
            }
        }
        addBase(base);
    }

    private void addBase(StringBuilder base) {
        String name = base.toString();
        if (name.startsWith("::")) {
            name = name.substring(2);
        }
        if (!name.isEmpty()) {
            current.baseTypes().add(name);
        }
        base.setLength(0);
    }

    /**
     * Name after {@code namespace} for {@code namespace A::B}, empty for an anonymous
     * namespace, null when the brace does not open a namespace.
     */
    private static String namespaceName(Token lbrace) {
        Deque<String> parts = new ArrayDeque<>();
        Token t = lbrace.previous();
        while (t != null && t.isIdentifier()) {
            parts.addFirst(t.str());
            t = t.previous();
            if (t == null || !t.is("::")) {
                break;
            }
            t = t.previous();
        }
        if (t != null && t.is("namespace")) {
            return String.join("::", parts);
        }
        return null;
    }

    /**
     * The class, struct, union or enum keyword of a record head ending at {@code lbrace},
     * or null when the brace does not open a record body.
     */
    static Token recordKeyword(Token lbrace) {
        Token t = lbrace.previous();
        while (t != null) {
            if (t.is(">") && t.link() != null) {
                t = t.link().previous();
            } else if (t.is(")") && t.link() != null
                    && TokenPattern.match(t.link().previous(), "alignas|__declspec|__attribute__")) {
                t = t.link().tokAt(-2);
            } else if (TokenPattern.match(t, "class|struct|union|enum")) {
                return t;
            } else if (t.isIdentifier()
                    || TokenPattern.match(t, "::|,|:|final|public|protected|private|virtual|%type%")) {
                t = t.previous();
            } else {
                return null;
            }
        }
        return null;
    }

    /**
     * Name token of the function whose body starts at {@code lbrace}, or null when the
     * brace is not a function body. Walks back over trailing qualifiers, a trailing
     * return type and a constructor initializer list to the parameter list. For
     * operators the {@code operator} keyword is returned.
     */
    static Token functionName(Token lbrace) {
        Token t = lbrace.previous();
        while (t != null) {
            if (t.is(")") && t.link() != null) {
                Token before = skipTemplateArgs(t.link().previous());
                if (before == null) {
                    return null;
                }
                if (TokenPattern.match(before, "noexcept|throw|decltype|alignas|__attribute__")) {
                    t = before.previous();
                    continue;
                }
                if (TokenPattern.simpleMatch(before.previous(), "operator")) {
                    return before.previous();
                }
                if (before.is(")") && before.link() != null
                        && TokenPattern.simpleMatch(before.link().previous(), "operator")) {
                    return before.link().previous();
                }
                if (!before.isIdentifier()) {
                    return null;
                }
                if (isInitializerEntry(before)) {
                    t = before.tokAt(-2);
                    continue;
                }
                return before;
            }
            if (t.is("}") && t.link() != null) {
                Token name = skipTemplateArgs(t.link().previous());
                if (name == null || !name.isIdentifier() || !isInitializerEntry(name)) {
                    return null;
                }
                t = name.tokAt(-2);
            } else if (TokenPattern.match(t, "const|volatile|override|final|mutable|noexcept|constexpr|&|&&")) {
                t = t.previous();
            } else {
                Token arrow = trailingReturnArrow(t);
                if (arrow == null) {
                    return null;
                }
                t = arrow.previous();
            }
        }
        return null;
    }

    private static Token skipTemplateArgs(Token tok) {
        if (tok != null && tok.is(">") && tok.link() != null) {
            return tok.link().previous();
        }
        return tok;
    }

    /**
     * Whether {@code name} starts an entry of a constructor initializer list, that is,
     * it follows the list's {@code :} or a {@code ,} separating two entries.
     */
    private static boolean isInitializerEntry(Token name) {
        Token sep = name.previous();
        if (sep == null) {
            return false;
        }
        if (sep.is(",")) {
            return true;
        }
        return sep.is(":") && !TokenPattern.match(sep.previous(), "public|protected|private|case|default");
    }

    /**
     * The {@code ->} of a trailing return type that ends at {@code last}, or null.
     */
    private static Token trailingReturnArrow(Token last) {
        Token t = last;
        int count = 0;
        while (t != null) {
            if (t.is("->")) {
                return count > 0 ? t : null;
            }
            if (t.is(">") && t.link() != null) {
                t = t.link();
            } else if (t.is(")") && t.link() != null && TokenPattern.simpleMatch(t.link().previous(), "decltype")) {
                t = t.link().previous();
            } else if (!t.isName() && !TokenPattern.match(t, "::|*|&|&&")) {
                return null;
            }
            count++;
            t = t.previous();
        }
        return null;
    }

    /**
     * Class path of a qualified function name: {@code "A::B"} for {@code A::B::f} or
     * {@code A::B::~B}, empty for an unqualified name.
     */
    private static String classPath(Token name) {
        Deque<String> parts = new ArrayDeque<>();
        Token t = name.previous();
        if (t != null && t.is("~")) {
            t = t.previous();
        }
        while (t != null && t.is("::")) {
            Token seg = t.previous();
            if (seg != null && seg.is(">") && seg.link() != null) {
                seg = seg.link().previous();
            }
            if (seg == null || !seg.isIdentifier()) {
                break;
            }
            parts.addFirst(seg.str());
            t = seg.previous();
        }
        return String.join("::", parts);
    }

    /** {@code A :: B} starting at {@code tok} as {@code "A::B"}. */
    private static String qualifiedName(Token tok) {
        StringBuilder sb = new StringBuilder();
        for (Token t = tok; t != null && (t.isIdentifier() || t.is("::")); t = t.next()) {
            sb.append(t.str());
        }
        String name = sb.toString();
        return name.startsWith("::") ? name.substring(2) : name;
    }

    public static String qualify(String scope, String name) {
        return scope.isEmpty() ? name : scope + "::" + name;
    }

    /**
     * Whether the cursor is inside the scope named {@code scopeName}, or a scope nested
     * in it. Every position is inside the global scope ({@code ""}).
     */
    public boolean isInside(String scopeName) {
        if (scopeName.isEmpty()) {
            return true;
        }
        String name = current.fullName();
        return name.equals(scopeName) || name.startsWith(scopeName + "::");
    }

    /**
     * Whether a {@code using namespace} directive visible at the cursor names {@code namespace}.
     */
    public boolean seesNamespace(String namespace) {
        for (ScopeInfo s = current; s != null; s = s.parent()) {
            for (String target : s.usingNamespaces()) {
                if (resolveFrom(s, target).equals(namespace)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whether the class enclosing the cursor derives, directly or indirectly, from the
     * record named {@code scopeName}.
     */
    public boolean inheritsFrom(String scopeName) {
        return enclosingRecord().map(r -> inherits(r, scopeName, new HashSet<>())).orElse(false);
    }

    private boolean inherits(ScopeInfo record, String target, Set<String> seen) {
        if (!seen.add(record.fullName())) {
            return false;
        }
        for (String base : record.baseTypes()) {
            String full = resolveFrom(record.parent(), base);
            if (full.equals(target)) {
                return true;
            }
            Optional<ScopeInfo> baseScope = recordByFullName(full);
            if (baseScope.isPresent() && inherits(baseScope.get(), target, seen)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolve a qualifier such as {@code "B::C"} written at the cursor to the qualified
     * name of an existing scope. Returns the qualifier itself when nothing matches.
     */
    public String resolveQualified(String qualifier) {
        if (qualifier.startsWith("::")) {
            return qualifier.substring(2);
        }
        return resolveFrom(current, qualifier);
    }

    private String resolveFrom(ScopeInfo from, String name) {
        if (name.startsWith("::")) {
            return name.substring(2);
        }
        for (ScopeInfo s = from; s != null; s = s.parent()) {
            String candidate = qualify(s.fullName(), name);
            if (scopesByName.containsKey(candidate)) {
                return candidate;
            }
        }
        return name;
    }

    /**
     * The record a member name at the cursor may refer to: the enclosing class body,
     * or the class of an out-of-class member function.
     */
    public Optional<ScopeInfo> enclosingRecord() {
        for (ScopeInfo s = current; s != null; s = s.parent()) {
            if (s.kind() == ScopeKind.RECORD) {
                return Optional.of(s);
            }
            if (s.kind() == ScopeKind.MEMBER_FUNCTION) {
                return recordByFullName(s.fullName());
            }
        }
        return Optional.empty();
    }

    public Optional<ScopeInfo> recordByFullName(String fullName) {
        for (ScopeInfo s : scopesByName.getOrDefault(fullName, List.of())) {
            if (s.kind() == ScopeKind.RECORD && !s.name().isEmpty()) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Find the record scope of class {@code name} as seen from the cursor. Qualified
     * names are resolved like {@link #resolveQualified(String)}.
     */
    public Optional<ScopeInfo> findRecord(String name) {
        return findRecord(current, name);
    }

    /**
     * Find the record scope of class {@code name} as seen from {@code from}.
     */
    public Optional<ScopeInfo> findRecord(ScopeInfo from, String name) {
        if (name.contains("::")) {
            return recordByFullName(resolveFrom(from, name));
        }
        return lookupOwner(from, name).flatMap(owner -> recordByFullName(qualify(owner.fullName(), name)));
    }

    /**
     * The named namespace or class that declares type {@code name} as seen from the
     * cursor. Empty when the type is global, local to a function, or unknown.
     */
    public Optional<ScopeInfo> findTypeOwner(String name) {
        return lookupOwner(current, name)
                .filter(s -> s.kind() == ScopeKind.NAMESPACE || s.kind() == ScopeKind.RECORD)
                .filter(s -> !s.fullName().isEmpty());
    }

    private Optional<ScopeInfo> lookupOwner(ScopeInfo from, String name) {
        for (ScopeInfo s = from; s != null; s = s.parent()) {
            if (s.recordTypes().contains(name)) {
                return Optional.of(s);
            }
            for (String target : s.usingNamespaces()) {
                for (ScopeInfo ns : namedScopes(resolveFrom(s, target))) {
                    if (ns.recordTypes().contains(name)) {
                        return Optional.of(ns);
                    }
                }
            }
            if (s.kind() == ScopeKind.OTHER) {
                continue;
            }
            for (ScopeInfo sibling : namedScopes(s.fullName())) {
                if (sibling != s && sibling.recordTypes().contains(name)) {
                    return Optional.of(sibling);
                }
            }
        }
        return Optional.empty();
    }

    /** Namespace, record and global scopes with the given qualified name. */
    private List<ScopeInfo> namedScopes(String fullName) {
        List<ScopeInfo> result = new ArrayList<>();
        for (ScopeInfo s : scopesByName.getOrDefault(fullName, List.of())) {
            if (s.kind() != ScopeKind.OTHER && s.kind() != ScopeKind.MEMBER_FUNCTION) {
                result.add(s);
            }
        }
        return result;
    }
}
