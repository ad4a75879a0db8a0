package com.raditha.cppnorm.scope;

import com.raditha.cppnorm.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node in the scope tree built by {@link ScopeTracker}.
 * <p>
 * The parent is a back reference; children are owned. The body start is the opening
 * brace and {@code bodyStart().link()} is the closing brace, so the scope's extent
 * always follows the current links of the token list.
 */
public class ScopeInfo {

    private final ScopeKind kind;
    private final String name;
    private final String fullName;
    private final ScopeInfo parent;
    private final Token bodyStart;
    private final boolean functionBody;
    private final List<ScopeInfo> children = new ArrayList<>();
    private final Set<String> recordTypes = new LinkedHashSet<>();
    private final Set<String> baseTypes = new LinkedHashSet<>();
    private final Set<String> usingNamespaces = new LinkedHashSet<>();

    ScopeInfo(ScopeKind kind, String name, String fullName, ScopeInfo parent, Token bodyStart,
            boolean functionBody) {
        this.kind = kind;
        this.name = name;
        this.fullName = fullName;
        this.parent = parent;
        this.bodyStart = bodyStart;
        this.functionBody = functionBody;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    static ScopeInfo global() {
        return new ScopeInfo(ScopeKind.GLOBAL, "", "", null, null, false);
    }

    public ScopeKind kind() {
        return kind;
    }

    /** Simple name, empty for anonymous scopes and plain blocks. */
    public String name() {
        return name;
    }

    /** Qualified name such as {@code "A::B"}; empty for the global scope. */
    public String fullName() {
        return fullName;
    }

    public ScopeInfo parent() {
        return parent;
    }

    public List<ScopeInfo> children() {
        return Collections.unmodifiableList(children);
    }

    /** Opening brace, null for the global scope. */
    public Token bodyStart() {
        return bodyStart;
    }

    /** Closing brace, null for the global scope. */
    public Token bodyEnd() {
        return bodyStart == null ? null : bodyStart.link();
    }

    /** Whether the braces are the body of a function, inline member functions included. */
    public boolean isFunctionBody() {
        return functionBody;
    }

    public boolean isGlobal() {
        return kind == ScopeKind.GLOBAL;
    }

    /** Names of classes, structs, unions and enums declared directly in this scope. */
    public Set<String> recordTypes() {
        return recordTypes;
    }

    /** Base class names of a record, qualified as written. */
    public Set<String> baseTypes() {
        return baseTypes;
    }

    /** Targets of {@code using namespace} directives in this scope, as written. */
    public Set<String> usingNamespaces() {
        return usingNamespaces;
    }

    /**
     * Whether this scope is a body in which the members of a class are visible without
     * qualification: an out-of-class member function, or a function defined inside a
     * record.
     */
    public boolean isMemberFunctionBody() {
        return kind == ScopeKind.MEMBER_FUNCTION
                || (functionBody && parent != null && parent.kind == ScopeKind.RECORD);
    }

    @Override
    public String toString() {
        return kind + (fullName.isEmpty() ? "" : " " + fullName);
    }
}
