package com.raditha.cppnorm.analyzer;

import com.raditha.cppnorm.config.SimplifierConfig;
import com.raditha.cppnorm.diagnostics.Diagnostic;
import com.raditha.cppnorm.diagnostics.ErrorReporter;
import com.raditha.cppnorm.diagnostics.Severity;
import com.raditha.cppnorm.model.Token;

import java.time.Clock;
import java.util.function.BooleanSupplier;

/**
 * Per-file state threaded through the simplification phases: configuration, the
 * diagnostic sink, the alias deadline, the counter for generated type names and the
 * statistics collected for the report.
 */
public class SimplifyContext {

    private final SimplifierConfig config;
    private final ErrorReporter reporter;
    private final Deadline deadline;
    private final BooleanSupplier stopRequested;
    private int unnamedCounter;
    private int aliasesInlined;
    private int aliasesSkipped;
    private int aliasUseSites;

    public SimplifyContext(SimplifierConfig config, ErrorReporter reporter, Deadline deadline,
            BooleanSupplier stopRequested) {
        this.config = config;
        this.reporter = reporter;
        this.deadline = deadline;
        this.stopRequested = stopRequested;
    }

    /**
     * Context with no stop flag and a pending deadline derived from the configured
     * budget, which {@link TokenSimplifier} starts when the alias phases begin.
     */
    public static SimplifyContext of(SimplifierConfig config, ErrorReporter reporter) {
        return new SimplifyContext(config, reporter,
                Deadline.pending(config.aliasTimeBudget(), Clock.systemUTC()), () -> false);
    }

    public SimplifierConfig config() {
        return config;
    }

    public ErrorReporter reporter() {
        return reporter;
    }

    public Deadline deadline() {
        return deadline;
    }

    public boolean isStopRequested() {
        return stopRequested.getAsBoolean();
    }

    /**
     * Next number for a generated name such as {@code Unnamed0}.
     */
    public int nextUnnamed() {
        return unnamedCounter++;
    }

    /**
     * Report a construct the heuristics skipped. Only emitted with debug warnings on.
     */
    public void reportDebug(Token tok, String id, String message) {
        if (config.debugWarnings()) {
            reporter.report(Diagnostic.at(tok, Severity.DEBUG, id, message));
        }
    }

    public void reportInformation(Token tok, String id, String message) {
        reporter.report(Diagnostic.at(tok, Severity.INFORMATION, id, message));
    }

    public void aliasInlined(int useSites) {
        aliasesInlined++;
        aliasUseSites += useSites;
    }

    public void aliasSkipped() {
        aliasesSkipped++;
    }

    public int aliasesInlined() {
        return aliasesInlined;
    }

    public int aliasesSkipped() {
        return aliasesSkipped;
    }

    public int aliasUseSites() {
        return aliasUseSites;
    }
}
