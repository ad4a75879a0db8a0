package com.raditha.cppnorm.model;

/**
 * Position of a token in its source file.
 *
 * @param file   file name from the token list's file table
 * @param line   line number (1-indexed)
 * @param column column number (1-indexed)
 */
public record SourceLocation(String file, int line, int column) {

    /**
     * Format as "file:line:column" for display.
     */
    public String toDisplayString() {
        return file + ":" + line + ":" + column;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
