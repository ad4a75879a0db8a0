package com.raditha.cppnorm.scope;

/**
 * Kind of a node in the scope tree.
 */
public enum ScopeKind {
    /** File scope, the root of every tree. */
    GLOBAL,

    /** Named, inline or anonymous namespace, or an {@code extern "C"} block. */
    NAMESPACE,

    /** Body of a class, struct or union. */
    RECORD,

    /** Body of a member function defined outside its class ({@code void A::f() { }}). */
    MEMBER_FUNCTION,

    /** Any other braces: free or inline function bodies, blocks, enum bodies, initializers. */
    OTHER
}
