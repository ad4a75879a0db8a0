package com.raditha.cppnorm.diagnostics;

import com.raditha.cppnorm.model.SourceLocation;
import com.raditha.cppnorm.model.Token;

/**
 * A message reported by one of the simplification passes.
 *
 * @param severity severity of the message
 * @param id       stable identifier, e.g. "syntaxError" or "simplifyTypedef"
 * @param message  human readable text
 * @param location token position, or null when the message is not tied to a token
 */
public record Diagnostic(Severity severity, String id, String message, SourceLocation location) {

    public Diagnostic {
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
    }

    /**
     * Create a diagnostic located at a token; a null token gives no location.
     */
    public static Diagnostic at(Token tok, Severity severity, String id, String message) {
        return new Diagnostic(severity, id, message, tok == null ? null : tok.location());
    }

    /**
     * Format as "file:line:column: severity: message [id]".
     */
    public String toDisplayString() {
        String prefix = location == null ? "" : location.toDisplayString() + ": ";
        return prefix + severity.toCliString() + ": " + message + " [" + id + "]";
    }
}
