package com.raditha.cppnorm.alias;

/**
 * Structural classification of the type named by an alias.
 */
public enum DeclaratorShape {
    /** {@code typedef int T;} */
    PLAIN,

    /** {@code typedef int *T;}, references included. */
    POINTER,

    /** {@code typedef int T[3];} */
    ARRAY,

    /** {@code typedef void T(int);} */
    FUNCTION,

    /** {@code typedef void (*T)(int);} */
    FUNCTION_POINTER,

    /** {@code typedef void (*(*T)(int))(double);} */
    FUNCTION_RETURNING_FUNCTION_POINTER,

    /** {@code typedef int (*T)[3];} */
    POINTER_TO_ARRAY,

    /** {@code typedef int A::*T;} and {@code typedef void (A::*T)(int);} */
    POINTER_TO_MEMBER,

    /** {@code typedef decltype(x) T;} and {@code typedef typeof(x) T;} */
    TYPEOF;

    /** Whether the alias can be used as a qualifier ({@code T::member}). */
    public boolean allowsScopeAccess() {
        return this == PLAIN;
    }
}
