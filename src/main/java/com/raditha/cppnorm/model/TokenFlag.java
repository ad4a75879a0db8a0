package com.raditha.cppnorm.model;

/**
 * Mutable markers attached to tokens by the simplification passes.
 */
public enum TokenFlag {
    /** Token was spliced in by typedef/using inlining. */
    EXPANDED_ALIAS,

    /** Second half of a {@code >>} that was split to close two template argument lists. */
    SPLIT_SHIFT,

    /** Parenthesis or template bracket of a cast. */
    CAST,

    /** Name generated for an anonymous struct/union/enum. */
    ANONYMOUS_NAME
}
