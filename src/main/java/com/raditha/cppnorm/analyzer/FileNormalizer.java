package com.raditha.cppnorm.analyzer;

import com.raditha.cppnorm.config.SimplifierConfig;
import com.raditha.cppnorm.diagnostics.CollectingErrorReporter;
import com.raditha.cppnorm.diagnostics.ErrorReporter;
import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.model.TokenList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Normalizes source files one at a time.
 * <p>
 * Each file gets its own context, deadline and diagnostic list. A fatal error is
 * reported once at ERROR severity and only fails the file it occurred in.
 */
public class FileNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(FileNormalizer.class);

    private final TokenSimplifier simplifier;
    private final ErrorReporter reporter;
    private final BooleanSupplier stopRequested;
    private final Clock clock;

    public FileNormalizer(ErrorReporter reporter) {
        this(new TokenSimplifier(), reporter, () -> false, Clock.systemUTC());
    }

    /**
     * @param reporter      receives every diagnostic in addition to the per-file report
     * @param stopRequested polled between phases; when it answers true the file is ABORTED
     */
    public FileNormalizer(TokenSimplifier simplifier, ErrorReporter reporter, BooleanSupplier stopRequested,
            Clock clock) {
        this.simplifier = simplifier;
        this.reporter = reporter;
        this.stopRequested = stopRequested;
        this.clock = clock;
    }

    /**
     * Read and normalize a file.
     *
     * @param configFor configuration for the file, usually derived from its name
     * @throws IOException if the file cannot be read
     */
    public NormalizationReport normalizeFile(Path file, Function<String, SimplifierConfig> configFor)
            throws IOException {
        String fileName = file.toString();
        String source = Files.readString(file);
        return normalize(source, fileName, configFor.apply(fileName));
    }

    /**
     * Normalize source text that has already been preprocessed.
     */
    public NormalizationReport normalize(String source, String fileName, SimplifierConfig config) {
        Instant start = clock.instant();
        CollectingErrorReporter collector = new CollectingErrorReporter(reporter);
        SimplifyContext ctx = new SimplifyContext(config, collector,
                Deadline.pending(config.aliasTimeBudget(), clock), stopRequested);

        TokenList tokens = null;
        SimplificationStats stats = SimplificationStats.empty();
        NormalizationStatus status;
        try {
            tokens = new CppLexer(config.isCpp()).tokenize(source, fileName);
            stats = simplifier.simplify(tokens, ctx);
            status = stats.completed() ? NormalizationStatus.OK : NormalizationStatus.ABORTED;
        } catch (SimplifyException e) {
            collector.report(e.toDiagnostic());
            tokens = null;
            status = NormalizationStatus.FAILED;
        }

        Duration elapsed = Duration.between(start, clock.instant());
        logger.info("{}: {} in {} ms", fileName, status.toCliString(), elapsed.toMillis());
        return new NormalizationReport(fileName, status, tokens, stats, collector.diagnostics(), elapsed);
    }

    /**
     * Normalize several files, stopping early only when the stop flag is raised.
     *
     * @throws IOException if one of the files cannot be read
     */
    public List<NormalizationReport> normalizeAll(List<Path> files, Function<String, SimplifierConfig> configFor)
            throws IOException {
        List<NormalizationReport> reports = new ArrayList<>();
        for (Path file : files) {
            if (stopRequested.getAsBoolean()) {
                logger.info("Stop requested, {} file(s) not processed", files.size() - reports.size());
                break;
            }
            reports.add(normalizeFile(file, configFor));
        }
        return reports;
    }
}
