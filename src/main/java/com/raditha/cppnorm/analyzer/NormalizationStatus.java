package com.raditha.cppnorm.analyzer;

/**
 * Outcome of normalizing one file.
 */
public enum NormalizationStatus {
    /** All phases ran. */
    OK,
    /** A fatal syntax or internal error stopped the file; no tokens are kept. */
    FAILED,
    /** The stop flag was raised between phases. */
    ABORTED;

    public String toCliString() {
        return name().toLowerCase();
    }
}
