package com.raditha.cppnorm.model;

import java.util.Set;

/**
 * Syntactic category of a token.
 * The category is derived from the token text and recomputed whenever the text is
 * replaced, so substitutions never leave a stale category behind.
 */
public enum TokenKind {
    /** Identifier that is not a keyword (variables, types, functions, namespaces). */
    NAME,

    /** Language keyword other than the fundamental types and boolean literals. */
    KEYWORD,

    /** Fundamental type keyword (int, char, void, ...). */
    STANDARD_TYPE,

    /** Integer or floating literal. */
    NUMBER,

    /** String literal, including prefixed and raw strings. */
    STRING,

    /** Character literal. */
    CHAR,

    /** true or false */
    BOOLEAN,

    /** + - * / % */
    ARITHMETIC_OP,

    /** == != < <= > >= <=> */
    COMPARISON_OP,

    /** = += -= and friends */
    ASSIGNMENT_OP,

    /** && || ! */
    LOGICAL_OP,

    /** & | ^ ~ << >> */
    BIT_OP,

    /** ++ -- */
    INC_DEC_OP,

    /** Punctuation: brackets, ; , : :: ? . -> ... */
    EXTENDED_OP,

    /** Angle bracket linked as a template delimiter. */
    BRACKET,

    /** Anything else. */
    OTHER;

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");
    private static final Set<String> COMPARISON = Set.of("==", "!=", "<", "<=", ">", ">=", "<=>");
    private static final Set<String> ASSIGNMENT = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=");
    private static final Set<String> LOGICAL = Set.of("&&", "||", "!");
    private static final Set<String> BIT = Set.of("&", "|", "^", "~", "<<", ">>");
    private static final Set<String> EXTENDED = Set.of(
            "{", "}", "(", ")", "[", "]", ";", ",", ":", "::", "?", ".", "->", "...", ".*", "->*", "#", "##");

    /**
     * Classify token text.
     *
     * @param str token text, never empty
     * @param cpp whether C++ keywords apply
     */
    public static TokenKind classify(String str, boolean cpp) {
        char first = str.charAt(0);
        if (Character.isLetter(first) || first == '_' || first == '$') {
            if (isStringPrefix(str)) {
                return str.endsWith("'") ? CHAR : STRING;
            }
            if (str.equals("true") || str.equals("false")) {
                return cpp ? BOOLEAN : NAME;
            }
            if (CppKeywords.isStandardType(str) && CppKeywords.isKeyword(str, cpp)) {
                return STANDARD_TYPE;
            }
            return CppKeywords.isKeyword(str, cpp) ? KEYWORD : NAME;
        }
        if (Character.isDigit(first) || (first == '.' && str.length() > 1 && Character.isDigit(str.charAt(1)))) {
            return NUMBER;
        }
        if (first == '"') {
            return STRING;
        }
        if (first == '\'') {
            return CHAR;
        }
        if (ARITHMETIC.contains(str)) {
            return ARITHMETIC_OP;
        }
        if (COMPARISON.contains(str)) {
            return COMPARISON_OP;
        }
        if (ASSIGNMENT.contains(str)) {
            return ASSIGNMENT_OP;
        }
        if (LOGICAL.contains(str)) {
            return LOGICAL_OP;
        }
        if (BIT.contains(str)) {
            return BIT_OP;
        }
        if (str.equals("++") || str.equals("--")) {
            return INC_DEC_OP;
        }
        if (EXTENDED.contains(str)) {
            return EXTENDED_OP;
        }
        return OTHER;
    }

    /** Literal with an encoding prefix such as L"x", u8"x" or R"(x)". */
    private static boolean isStringPrefix(String str) {
        int quote = indexOfQuote(str);
        return quote > 0 && quote <= 3 && str.length() > quote + 1;
    }

    private static int indexOfQuote(String str) {
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '"' || c == '\'') {
                return i;
            }
            if (!Character.isLetterOrDigit(c)) {
                return -1;
            }
        }
        return -1;
    }

    public boolean isOperator() {
        return this == ARITHMETIC_OP || this == COMPARISON_OP || this == ASSIGNMENT_OP
                || this == LOGICAL_OP || this == BIT_OP || this == INC_DEC_OP;
    }

    public boolean isConstantOperator() {
        return this == ARITHMETIC_OP || this == COMPARISON_OP || this == LOGICAL_OP || this == BIT_OP;
    }

    public boolean isLiteral() {
        return this == NUMBER || this == STRING || this == CHAR || this == BOOLEAN;
    }
}
