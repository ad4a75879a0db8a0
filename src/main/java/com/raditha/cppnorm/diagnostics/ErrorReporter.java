package com.raditha.cppnorm.diagnostics;

/**
 * Sink for diagnostics. Formatting and transport belong to the implementation.
 */
@FunctionalInterface
public interface ErrorReporter {

    void report(Diagnostic diagnostic);
}
