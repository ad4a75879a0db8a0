package com.raditha.cppnorm.analyzer;

import com.raditha.cppnorm.diagnostics.Diagnostic;
import com.raditha.cppnorm.diagnostics.Severity;
import com.raditha.cppnorm.model.TokenList;

import java.time.Duration;
import java.util.List;

/**
 * Result of normalizing a single file.
 *
 * @param fileName    name of the normalized file
 * @param status      outcome
 * @param tokens      the normalized tokens; null when {@code status} is FAILED
 * @param stats       phase counters, zero for phases that did not run
 * @param diagnostics everything reported while the file was processed
 * @param elapsed     wall clock time spent on the file
 */
public record NormalizationReport(
        String fileName,
        NormalizationStatus status,
        TokenList tokens,
        SimplificationStats stats,
        List<Diagnostic> diagnostics,
        Duration elapsed) {

    public NormalizationReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isOk() {
        return status == NormalizationStatus.OK;
    }

    public int tokenCount() {
        return tokens == null ? 0 : tokens.size();
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    /**
     * One line summary for console output.
     */
    public String getSummary() {
        return String.format("%s: %s, %d tokens, %d brackets, %d templates, %d aliases inlined, %d variables (%d ms)",
                fileName,
                status.toCliString(),
                tokenCount(),
                stats.bracketPairs(),
                stats.templatePairs(),
                stats.typedefsRemoved() + stats.usingsRemoved(),
                stats.variableIds(),
                elapsed.toMillis());
    }
}
