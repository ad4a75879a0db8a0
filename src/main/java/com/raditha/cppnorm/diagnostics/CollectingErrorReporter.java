package com.raditha.cppnorm.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every reported diagnostic in memory, optionally forwarding to another reporter.
 */
public class CollectingErrorReporter implements ErrorReporter {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final ErrorReporter delegate;

    public CollectingErrorReporter() {
        this(null);
    }

    public CollectingErrorReporter(ErrorReporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (delegate != null) {
            delegate.report(diagnostic);
        }
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Diagnostics with the given id, in report order.
     */
    public List<Diagnostic> withId(String id) {
        return diagnostics.stream()
                .filter(d -> d.id().equals(id))
                .toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    public void clear() {
        diagnostics.clear();
    }
}
