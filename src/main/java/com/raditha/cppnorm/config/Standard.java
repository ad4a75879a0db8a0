package com.raditha.cppnorm.config;

/**
 * Language standard revision.
 */
public enum Standard {
    C89(Language.C, "c89"),
    C99(Language.C, "c99"),
    C11(Language.C, "c11"),
    C17(Language.C, "c17"),
    C23(Language.C, "c23"),
    CPP03(Language.CPP, "c++03"),
    CPP11(Language.CPP, "c++11"),
    CPP14(Language.CPP, "c++14"),
    CPP17(Language.CPP, "c++17"),
    CPP20(Language.CPP, "c++20"),
    CPP23(Language.CPP, "c++23");

    private final Language language;
    private final String cliName;

    Standard(Language language, String cliName) {
        this.language = language;
        this.cliName = cliName;
    }

    public Language language() {
        return language;
    }

    /**
     * Latest supported revision of a language.
     */
    public static Standard latest(Language language) {
        return language == Language.C ? C17 : CPP20;
    }

    /**
     * Convert a string value such as "c++17" or "c11" to a Standard.
     *
     * @throws IllegalArgumentException if the value is not a valid standard
     */
    public static Standard fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Standard value cannot be null");
        }
        String normalized = value.toLowerCase().replace("cpp", "c++");
        for (Standard standard : values()) {
            if (standard.cliName.equals(normalized)) {
                return standard;
            }
        }
        throw new IllegalArgumentException("Invalid standard: " + value);
    }

    public boolean isAtLeast(Standard other) {
        return language == other.language && ordinal() >= other.ordinal();
    }

    public String toCliString() {
        return cliName;
    }
}
