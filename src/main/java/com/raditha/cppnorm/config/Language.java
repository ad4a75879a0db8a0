package com.raditha.cppnorm.config;

/**
 * Source language of the token stream.
 */
public enum Language {
    C,
    CPP;

    /**
     * Convert a string value to a Language.
     *
     * @param value "c", "c++" or "cpp" (case-insensitive)
     * @throws IllegalArgumentException if the value is not a valid language
     */
    public static Language fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Language value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "c" -> C;
            case "c++", "cpp", "cxx" -> CPP;
            default -> throw new IllegalArgumentException(
                    "Invalid language: " + value + ". Must be: c or c++");
        };
    }

    /**
     * Guess the language from a file name; headers count as C++.
     */
    public static Language fromFileName(String fileName) {
        return fileName.toLowerCase().endsWith(".c") ? C : CPP;
    }

    public String toCliString() {
        return this == C ? "c" : "c++";
    }
}
