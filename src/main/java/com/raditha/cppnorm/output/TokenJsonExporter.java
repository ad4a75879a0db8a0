package com.raditha.cppnorm.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.cppnorm.analyzer.NormalizationReport;
import com.raditha.cppnorm.diagnostics.Diagnostic;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenFlag;
import com.raditha.cppnorm.model.TokenList;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dumps normalized token lists as JSON, for inspecting what the phases did.
 * <p>
 * Tokens refer to each other by index; {@code link} is absent for unlinked tokens,
 * {@code varId} for tokens that are not variables.
 */
public class TokenJsonExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public record FileDTO(
            String file,
            String status,
            List<TokenDTO> tokens,
            List<DiagnosticDTO> diagnostics) {
    }

    public record TokenDTO(
            int index,
            String str,
            String kind,
            int line,
            int column,
            Integer link,
            Integer varId,
            List<String> flags,
            String originalName) {
    }

    public record DiagnosticDTO(String severity, String id, String message, String location) {
    }

    public String toJson(NormalizationReport report) {
        try {
            return mapper.writeValueAsString(toDTO(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String toJson(List<NormalizationReport> reports) {
        try {
            return mapper.writeValueAsString(reports.stream().map(TokenJsonExporter::toDTO).toList());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void export(List<NormalizationReport> reports, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(reports));
    }

    static FileDTO toDTO(NormalizationReport report) {
        List<TokenDTO> tokens = report.tokens() == null ? null : tokens(report.tokens());
        List<DiagnosticDTO> diagnostics = report.diagnostics().stream()
                .map(TokenJsonExporter::diagnostic)
                .toList();
        return new FileDTO(report.fileName(), report.status().toCliString(), tokens, diagnostics);
    }

    static List<TokenDTO> tokens(TokenList list) {
        List<TokenDTO> tokens = new ArrayList<>(list.size());
        for (Token tok : list) {
            List<String> flags = tok.flags().isEmpty() ? null
                    : tok.flags().stream().map(TokenFlag::name).toList();
            tokens.add(new TokenDTO(
                    tok.index(),
                    tok.str(),
                    tok.kind().name(),
                    tok.line(),
                    tok.column(),
                    tok.link() == null ? null : tok.link().index(),
                    tok.varId() == 0 ? null : tok.varId(),
                    flags,
                    tok.originalName()));
        }
        return tokens;
    }

    private static DiagnosticDTO diagnostic(Diagnostic d) {
        return new DiagnosticDTO(d.severity().toCliString(), d.id(), d.message(),
                d.location() == null ? null : d.location().toDisplayString());
    }
}
