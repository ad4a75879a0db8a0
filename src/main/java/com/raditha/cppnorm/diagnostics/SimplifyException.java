package com.raditha.cppnorm.diagnostics;

import com.raditha.cppnorm.model.SourceLocation;
import com.raditha.cppnorm.model.Token;

/**
 * Fatal structural error. The token list can no longer be trusted, so processing of
 * the current input stops and no partial result is produced.
 */
public class SimplifyException extends RuntimeException {

    /**
     * Category of the fatal error.
     */
    public enum Kind {
        /** Malformed input: unmatched brackets, an alias that cannot be expanded. */
        SYNTAX("syntaxError"),

        /** Inconsistent internal state, e.g. scope tracking out of step with the braces. */
        INTERNAL("internalError");

        private final String id;

        Kind(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }
    }

    private final Kind kind;
    private final transient SourceLocation location;

    public SimplifyException(Kind kind, Token tok, String message) {
        super(message);
        this.kind = kind;
        this.location = tok == null ? null : tok.location();
    }

    public SimplifyException(Kind kind, SourceLocation location, String message) {
        super(message);
        this.kind = kind;
        this.location = location;
    }

    public static SimplifyException syntax(Token tok, String message) {
        return new SimplifyException(Kind.SYNTAX, tok, message);
    }

    public static SimplifyException internal(Token tok, String message) {
        return new SimplifyException(Kind.INTERNAL, tok, message);
    }

    public Kind kind() {
        return kind;
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * The error as an ERROR-severity diagnostic.
     */
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Severity.ERROR, kind.id(), getMessage(), location);
    }
}
