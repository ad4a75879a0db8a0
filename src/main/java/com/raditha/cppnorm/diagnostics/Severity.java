package com.raditha.cppnorm.diagnostics;

/**
 * Severity of a reported diagnostic.
 */
public enum Severity {
    /** Fatal problem; the file could not be processed. */
    ERROR,

    WARNING,

    /** Informational message such as an exhausted time budget. */
    INFORMATION,

    /** Recoverable heuristic miss, only reported when debug warnings are enabled. */
    DEBUG;

    /**
     * Convert a string value to a Severity.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding Severity
     * @throws IllegalArgumentException if the value is not a valid severity
     */
    public static Severity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "error" -> ERROR;
            case "warning" -> WARNING;
            case "information" -> INFORMATION;
            case "debug" -> DEBUG;
            default -> throw new IllegalArgumentException("Invalid severity: " + value);
        };
    }

    public String toCliString() {
        return name().toLowerCase();
    }
}
