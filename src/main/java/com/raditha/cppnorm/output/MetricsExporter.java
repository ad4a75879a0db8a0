package com.raditha.cppnorm.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.cppnorm.analyzer.NormalizationReport;
import com.raditha.cppnorm.analyzer.NormalizationStatus;
import com.raditha.cppnorm.diagnostics.Severity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exports normalization metrics to CSV and JSON formats for dashboard integration
 * and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Project-level metrics aggregated from all normalized files.
     */
    public record ProjectMetrics(
            String projectName,
            LocalDateTime timestamp,
            int totalFiles,
            int failedFiles,
            int abortedFiles,
            int totalTokens,
            int totalAliasesInlined,
            int totalVariables,
            List<FileMetrics> files) {
    }

    /**
     * Per-file metrics.
     */
    public record FileMetrics(
            String fileName,
            String status,
            int tokens,
            int bracketPairs,
            int templatePairs,
            int typedefsInlined,
            int usingsInlined,
            int aliasesSkipped,
            int aliasUseSites,
            int variables,
            long errors,
            long elapsedMillis) {
    }

    public ProjectMetrics buildMetrics(List<NormalizationReport> reports, String projectName) {
        List<FileMetrics> fileMetrics = reports.stream()
                .map(this::buildFileMetrics)
                .toList();

        return new ProjectMetrics(
                projectName,
                LocalDateTime.now(),
                reports.size(),
                countStatus(reports, NormalizationStatus.FAILED),
                countStatus(reports, NormalizationStatus.ABORTED),
                fileMetrics.stream().mapToInt(FileMetrics::tokens).sum(),
                fileMetrics.stream().mapToInt(f -> f.typedefsInlined() + f.usingsInlined()).sum(),
                fileMetrics.stream().mapToInt(FileMetrics::variables).sum(),
                fileMetrics);
    }

    private static int countStatus(List<NormalizationReport> reports, NormalizationStatus status) {
        return (int) reports.stream().filter(r -> r.status() == status).count();
    }

    private FileMetrics buildFileMetrics(NormalizationReport report) {
        String fileName = Path.of(report.fileName()).getFileName().toString();
        return new FileMetrics(
                fileName,
                report.status().toCliString(),
                report.tokenCount(),
                report.stats().bracketPairs(),
                report.stats().templatePairs(),
                report.stats().typedefsRemoved(),
                report.stats().usingsRemoved(),
                report.stats().aliasesSkipped(),
                report.stats().aliasUseSites(),
                report.stats().variableIds(),
                report.count(Severity.ERROR),
                report.elapsed().toMillis());
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ProjectMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Project Summary\n");
        csv.append("timestamp,project,total_files,failed_files,aborted_files,total_tokens,aliases_inlined,variables\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.projectName(),
                metrics.totalFiles(),
                metrics.failedFiles(),
                metrics.abortedFiles(),
                metrics.totalTokens(),
                metrics.totalAliasesInlined(),
                metrics.totalVariables()));

        csv.append("\n");

        csv.append("# Per-File Metrics\n");
        csv.append("file,status,tokens,bracket_pairs,template_pairs,typedefs,usings,aliases_skipped,"
                + "alias_use_sites,variables,errors,elapsed_ms\n");
        for (FileMetrics file : metrics.files()) {
            csv.append(String.format("%s,%s,%d,%d,%d,%d,%d,%d,%d,%d,%d,%d\n",
                    file.fileName(),
                    file.status(),
                    file.tokens(),
                    file.bracketPairs(),
                    file.templatePairs(),
                    file.typedefsInlined(),
                    file.usingsInlined(),
                    file.aliasesSkipped(),
                    file.aliasUseSites(),
                    file.variables(),
                    file.errors(),
                    file.elapsedMillis()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ProjectMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }
}
