package com.raditha.cppnorm.model;

import java.util.Set;

/**
 * Keyword tables for C and C++.
 * C++-only keywords are ordinary names when the token list is C.
 */
public final class CppKeywords {

    /** Keywords shared by C and C++. */
    private static final Set<String> C_KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
            "_Bool", "_Complex", "_Static_assert", "_Alignas", "_Alignof", "_Thread_local",
            "typeof", "__typeof__", "__restrict", "__restrict__");

    /** Additional C++ keywords. */
    private static final Set<String> CPP_KEYWORDS = Set.of(
            "alignas", "alignof", "asm", "bool", "catch", "char8_t", "char16_t", "char32_t",
            "class", "concept", "consteval", "constexpr", "constinit", "const_cast", "co_await",
            "co_return", "co_yield", "decltype", "delete", "dynamic_cast", "explicit", "export",
            "false", "friend", "mutable", "namespace", "new", "noexcept", "nullptr", "operator",
            "private", "protected", "public", "reinterpret_cast", "requires", "static_assert",
            "static_cast", "template", "this", "thread_local", "throw", "true", "try", "typeid",
            "typename", "using", "virtual", "wchar_t");

    /** Fundamental types, the {@link TokenKind#STANDARD_TYPE} category. */
    private static final Set<String> STANDARD_TYPES = Set.of(
            "bool", "_Bool", "char", "char8_t", "char16_t", "char32_t", "double", "float",
            "int", "long", "short", "void", "wchar_t");

    /** Tokens that may appear in a fundamental type specifier sequence. */
    private static final Set<String> FUNDAMENTAL_SPECIFIERS = Set.of(
            "bool", "_Bool", "char", "char8_t", "char16_t", "char32_t", "double", "float",
            "int", "long", "short", "void", "wchar_t", "signed", "unsigned", "auto", "_Complex");

    private static final Set<String> CV_QUALIFIERS = Set.of(
            "const", "volatile", "restrict", "__restrict", "__restrict__");

    private static final Set<String> CAST_KEYWORDS = Set.of(
            "static_cast", "dynamic_cast", "const_cast", "reinterpret_cast");

    private CppKeywords() {
    }

    public static boolean isKeyword(String str, boolean cpp) {
        return C_KEYWORDS.contains(str) || (cpp && CPP_KEYWORDS.contains(str));
    }

    public static boolean isStandardType(String str) {
        return STANDARD_TYPES.contains(str);
    }

    public static boolean isFundamentalSpecifier(String str) {
        return FUNDAMENTAL_SPECIFIERS.contains(str);
    }

    public static boolean isCvQualifier(String str) {
        return CV_QUALIFIERS.contains(str);
    }

    public static boolean isCastKeyword(String str) {
        return CAST_KEYWORDS.contains(str);
    }
}
