package com.raditha.cppnorm.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CppNormCLITest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Path config;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        config = tempDir.resolve("test.yml");
        Files.writeString(config, """
                simplifier:
                  standard: c++17
                  alias_time_budget_seconds: 0
                """);
        source = tempDir.resolve("sample.cpp");
        Files.writeString(source, """
                typedef int T;
                T x;
                int y = x;
                """);
    }

    private int run(String... args) {
        CppNormCLI cli = new CppNormCLI();
        cli.setOut(new PrintWriter(out, true));
        CommandLine cmd = CppNormCLI.createCommandLine(cli);
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void testTextListing() {
        int exitCode = run("--config-file", config.toString(), source.toString());

        assertEquals(0, exitCode, err.toString());
        String output = out.toString();
        assertTrue(output.contains("=== " + source + " ==="));
        assertTrue(output.contains("2: int x ;"));
        assertTrue(output.contains("3: int y = x ;"));
        assertTrue(output.contains("SUMMARY"));
        assertTrue(output.contains("Files: 1, failed: 0"));
    }

    @Test
    void testVarIdListing() {
        assertEquals(0, run("--config-file", config.toString(), "--format", "varid", source.toString()));
        assertTrue(out.toString().contains("3: int y@2 = x@1 ;"));
    }

    @Test
    void testJsonToStdout() {
        assertEquals(0, run("--config-file", config.toString(), "--format", "json", source.toString()));
        assertTrue(out.toString().contains("\"varId\" : 2"));
    }

    @Test
    void testDiff() {
        assertEquals(0, run("--config-file", config.toString(), "--diff", source.toString()));
        String output = out.toString();
        assertTrue(output.contains("--- a/sample.cpp"));
        assertTrue(output.contains("-typedef int T ;"));
        assertTrue(output.contains("+int x ;"));
    }

    @Test
    void testFailedFileGivesExitCodeOne() throws IOException {
        Path broken = tempDir.resolve("broken.cpp");
        Files.writeString(broken, "int f() {\n");

        int exitCode = run("--config-file", config.toString(), source.toString(), broken.toString());

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("Files: 2, failed: 1"));
    }

    @Test
    void testExportAndOutputDirectory() {
        Path outputDir = tempDir.resolve("report");

        int exitCode = run("--config-file", config.toString(), "--export", "BOTH",
                "--output", outputDir.toString(), source.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(Files.exists(outputDir.resolve("sample.cpp.norm.txt")));
        assertTrue(Files.exists(outputDir.resolve("cppnorm-metrics.csv")));
        assertTrue(Files.exists(outputDir.resolve("cppnorm-metrics.json")));
        assertFalse(out.toString().contains("=== "));
    }

    @Test
    void testInvalidExportFormat() {
        assertEquals(2, run("--config-file", config.toString(), "--export", "xml", source.toString()));
        assertTrue(err.toString().contains("Configuration error"));
    }

    @Test
    void testLanguageStandardMismatchIsIgnored() {
        assertEquals(0, run("--config-file", config.toString(), "--language", "c++", "--std", "c11",
                "--format", "varid", source.toString()));
        assertTrue(out.toString().contains("int y@2 = x@1 ;"));
    }

    @Test
    void testUnknownFormat() {
        assertEquals(2, run("--format", "xml", source.toString()));
    }

    @Test
    void testMissingFileParameter() {
        assertEquals(2, run("--config-file", config.toString()));
    }

    @Test
    void testMissingConfigFile() {
        assertEquals(2, run("--config-file", tempDir.resolve("none.yml").toString(), source.toString()));
    }

    @Test
    void testUnreadableSource() {
        assertEquals(3, run("--config-file", config.toString(), tempDir.resolve("missing.cpp").toString()));
        assertTrue(err.toString().contains("I/O error"));
    }
}
