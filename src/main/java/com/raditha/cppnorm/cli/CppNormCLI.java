package com.raditha.cppnorm.cli;

import com.raditha.cppnorm.analyzer.FileNormalizer;
import com.raditha.cppnorm.analyzer.NormalizationReport;
import com.raditha.cppnorm.analyzer.NormalizationStatus;
import com.raditha.cppnorm.config.SimplifierConfig;
import com.raditha.cppnorm.config.SimplifierSettings;
import com.raditha.cppnorm.diagnostics.LoggingErrorReporter;
import com.raditha.cppnorm.lexer.CppLexer;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.output.DiffGenerator;
import com.raditha.cppnorm.output.MetricsExporter;
import com.raditha.cppnorm.output.TokenJsonExporter;
import com.raditha.cppnorm.output.TokenPrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line interface for the token normalizer.
 * <p>
 * Usage:
 * java -jar cppnorm.jar [options] &lt;file&gt;...
 * <p>
 * Configuration priority: CLI arguments > cppnorm.yml > defaults
 */
@Command(name = "cppnorm", mixinStandardHelpOptions = true, version = "cppnorm v1.0.0",
        description = "Links brackets, inlines typedef and using aliases and assigns variable ids in preprocessed C/C++")
@SuppressWarnings("java:S106")
public class CppNormCLI implements Callable<Integer> {

    static final String DEFAULT_CONFIG = "cppnorm.yml";

    @Parameters(arity = "1..*", paramLabel = "<file>", description = "Preprocessed C or C++ source files")
    private List<Path> files;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--language", description = "Source language: c or c++ (default: from file extension)",
            paramLabel = "<lang>")
    private String language;

    @Option(names = "--std", description = "Language standard, e.g. c++17 or c11 (default: latest)",
            paramLabel = "<std>")
    private String standard;

    @Option(names = "--time-budget", description = "Seconds allowed for alias inlining per file, 0 = unlimited",
            paramLabel = "<seconds>")
    private int timeBudget = -1; // -1 = use YAML/default

    @Option(names = "--debug-warnings", description = "Report constructs the simplifier skipped")
    private boolean debugWarnings = false;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}", paramLabel = "<format>",
            converter = OutputFormatConverter.class)
    private OutputFormat format = OutputFormat.TEXT;

    @Option(names = "--diff", description = "Print a unified diff of the token listing before and after")
    private boolean diff = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Write results to this directory instead of stdout",
            paramLabel = "<path>")
    private String outputPath;

    private PrintWriter out = new PrintWriter(System.out, true);

    /**
     * Picocli call method - executes the main logic.
     *
     * @return 0 when every file was normalized, 1 when at least one failed
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        SimplifierSettings settings = loadSettings();
        Function<String, SimplifierConfig> configFor =
                name -> settings.loadConfig(language, standard, timeBudget, debugWarnings, name);

        FileNormalizer normalizer = new FileNormalizer(new LoggingErrorReporter());
        List<NormalizationReport> reports = normalizer.normalizeAll(files, configFor);

        printReports(reports);
        if (diff) {
            printDiffs(reports, configFor);
        }
        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(reports);
        }
        printSummary(reports);

        boolean failed = reports.stream().anyMatch(r -> r.status() == NormalizationStatus.FAILED);
        return failed ? 1 : 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine(new CppNormCLI()).execute(args));
    }

    /**
     * Command line with the exit code mapping used by {@link #main(String[])}.
     */
    static CommandLine createCommandLine(CppNormCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    void setOut(PrintWriter out) {
        this.out = out;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (timeBudget < -1) {
            throw new IllegalArgumentException("Time budget must not be negative, got: " + timeBudget);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String exp = exportFormat.toLowerCase();
            if (!exp.equals("csv") && !exp.equals("json") && !exp.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
            exportFormat = exp;
        }

        if (configFile != null && !Files.exists(Paths.get(configFile))) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            Path outputDir = Paths.get(outputPath);
            if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private SimplifierSettings loadSettings() throws IOException {
        if (configFile != null) {
            return SimplifierSettings.load(Paths.get(configFile));
        }
        Path defaultConfig = Paths.get(DEFAULT_CONFIG);
        return Files.isRegularFile(defaultConfig) ? SimplifierSettings.load(defaultConfig) : SimplifierSettings.defaults();
    }

    private void printReports(List<NormalizationReport> reports) throws IOException {
        if (format == OutputFormat.JSON) {
            String json = new TokenJsonExporter().toJson(reports);
            if (outputPath != null) {
                Path jsonPath = outputDirectory().resolve("cppnorm-tokens.json");
                Files.writeString(jsonPath, json);
                out.println("✓ Tokens exported to: " + jsonPath.toAbsolutePath());
            } else {
                out.println(json);
            }
            return;
        }

        TokenPrinter printer = new TokenPrinter(format == OutputFormat.VARID);
        for (NormalizationReport report : reports) {
            if (report.tokens() == null) {
                continue;
            }
            String listing = printer.toListing(report.tokens());
            if (outputPath != null) {
                Path target = outputDirectory().resolve(Paths.get(report.fileName()).getFileName() + ".norm.txt");
                Files.writeString(target, listing);
            } else {
                out.println("=== " + report.fileName() + " ===");
                out.print(listing);
            }
        }
    }

    private void printDiffs(List<NormalizationReport> reports, Function<String, SimplifierConfig> configFor)
            throws IOException {
        DiffGenerator generator = new DiffGenerator();
        TokenPrinter printer = new TokenPrinter(false);
        for (NormalizationReport report : reports) {
            if (report.tokens() == null) {
                continue;
            }
            SimplifierConfig config = configFor.apply(report.fileName());
            TokenList original = new CppLexer(config.isCpp())
                    .tokenize(Files.readString(Paths.get(report.fileName())), report.fileName());
            String unified = generator.generateUnifiedDiff(Paths.get(report.fileName()).getFileName().toString(),
                    printer.toLines(original), printer.toLines(report.tokens()));
            if (!unified.isEmpty()) {
                out.println(unified);
            }
        }
    }

    private void printSummary(List<NormalizationReport> reports) {
        out.println("=".repeat(80));
        out.println("SUMMARY");
        out.println("=".repeat(80));
        for (NormalizationReport report : reports) {
            out.println(report.getSummary());
        }
        long failed = reports.stream().filter(r -> r.status() == NormalizationStatus.FAILED).count();
        out.printf("Files: %d, failed: %d%n", reports.size(), failed);
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(List<NormalizationReport> reports) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, projectName());
        Path outputDir = outputDirectory();

        if ("csv".equals(exportFormat) || "both".equals(exportFormat)) {
            Path csvPath = outputDir.resolve("cppnorm-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            out.println("✓ Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(exportFormat) || "both".equals(exportFormat)) {
            Path jsonPath = outputDir.resolve("cppnorm-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            out.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }

    private Path outputDirectory() throws IOException {
        Path dir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        Files.createDirectories(dir);
        return dir;
    }

    private String projectName() {
        Path cwd = Paths.get("").toAbsolutePath().getFileName();
        return cwd == null ? "project" : cwd.toString();
    }

    /**
     * Custom converter for OutputFormat enum to handle CLI string values.
     */
    public static class OutputFormatConverter implements ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) throws Exception {
            return OutputFormat.fromString(value);
        }
    }
}
