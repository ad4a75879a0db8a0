package com.raditha.cppnorm.cli;

/**
 * How normalized tokens are printed.
 */
public enum OutputFormat {
    /**
     * Line-numbered token listing.
     */
    TEXT,

    /**
     * Line-numbered token listing with {@code @varid} suffixes on variables.
     */
    VARID,

    /**
     * JSON dump of every token with kind, position, link, variable id and flags.
     */
    JSON;

    /**
     * Convert a string value to OutputFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding format
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static OutputFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OutputFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "text" -> TEXT;
            case "varid" -> VARID;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                    "Invalid output format: " + value + ". Must be: text, varid, or json");
        };
    }

    public String toCliString() {
        return name().toLowerCase();
    }
}
