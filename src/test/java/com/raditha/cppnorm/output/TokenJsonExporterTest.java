package com.raditha.cppnorm.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.cppnorm.analyzer.FileNormalizer;
import com.raditha.cppnorm.analyzer.NormalizationReport;
import com.raditha.cppnorm.config.SimplifierConfig;
import com.raditha.cppnorm.diagnostics.CollectingErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenJsonExporterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private TokenJsonExporter exporter;
    private FileNormalizer normalizer;

    @BeforeEach
    void setUp() {
        exporter = new TokenJsonExporter();
        normalizer = new FileNormalizer(new CollectingErrorReporter());
    }

    @Test
    void testTokensWithLinksAndIds() throws IOException {
        NormalizationReport report = normalizer.normalize("void f(int a) { a = 1; }", "f.cpp",
                SimplifierConfig.cpp());

        JsonNode root = mapper.readTree(exporter.toJson(report));

        assertEquals("f.cpp", root.get("file").asText());
        assertEquals("ok", root.get("status").asText());
        JsonNode tokens = root.get("tokens");
        assertEquals(12, tokens.size());

        JsonNode open = tokens.get(2);
        assertEquals("(", open.get("str").asText());
        assertEquals(5, open.get("link").asInt());
        assertFalse(open.has("varId"));

        JsonNode param = tokens.get(4);
        assertEquals("a", param.get("str").asText());
        assertEquals(1, param.get("varId").asInt());
        assertEquals(1, param.get("line").asInt());
        assertEquals(12, param.get("column").asInt());
        assertFalse(param.has("link"));
    }

    @Test
    void testFailedFileHasDiagnosticsButNoTokens() throws IOException {
        NormalizationReport report = normalizer.normalize("int x = (1;", "bad.cpp", SimplifierConfig.cpp());

        JsonNode root = mapper.readTree(exporter.toJson(report));

        assertEquals("failed", root.get("status").asText());
        assertFalse(root.has("tokens"));
        JsonNode diagnostic = root.get("diagnostics").get(0);
        assertEquals("error", diagnostic.get("severity").asText());
        assertEquals("syntaxError", diagnostic.get("id").asText());
        assertTrue(diagnostic.get("location").asText().startsWith("bad.cpp:1:"));
    }

    @Test
    void testExportWritesArray() throws IOException {
        NormalizationReport one = normalizer.normalize("int a;", "a.c", SimplifierConfig.c());
        NormalizationReport two = normalizer.normalize("int b;", "b.c", SimplifierConfig.c());
        Path out = tempDir.resolve("tokens.json");

        exporter.export(List.of(one, two), out);

        JsonNode root = mapper.readTree(Files.readString(out));
        assertTrue(root.isArray());
        assertEquals("b.c", root.get(1).get("file").asText());
    }
}
