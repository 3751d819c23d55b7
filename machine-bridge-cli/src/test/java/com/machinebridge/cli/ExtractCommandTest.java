package com.machinebridge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.machinebridge.core.util.JsonMappers;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExtractCommand}.
 */
class ExtractCommandTest extends CommandTestBase {

    @Test
    void extract_allMachines_printsJsonArray() throws IOException {
        Path file = writeSource("machine.ts", MACHINE);

        int exitCode = run("extract", file.toString(), "-c", configPath().toString());

        assertThat(exitCode).isZero();
        JsonNode reports = JsonMappers.standard().readTree(out.toString());
        assertThat(reports.isArray()).isTrue();
        assertThat(reports.size()).isEqualTo(1);
        JsonNode report = reports.get(0);
        assertThat(report.get("index").asInt()).isZero();
        assertThat(report.get("digraph").get("nodes").size()).isEqualTo(4);
        assertThat(report.get("digraph").get("edges").size()).isEqualTo(3);
        assertThat(report.get("errors").isArray()).isTrue();
    }

    @Test
    void extract_singleIndex_printsOneReport() throws IOException {
        Path file = writeSource("machine.ts", MACHINE + "export const other = createMachine({ id: \"other\" });\n");

        int exitCode = run("extract", file.toString(), "--index", "1", "-c", configPath().toString());

        assertThat(exitCode).isZero();
        JsonNode report = JsonMappers.standard().readTree(out.toString());
        assertThat(report.get("index").asInt()).isEqualTo(1);
        assertThat(report.get("digraph").get("nodes").size()).isEqualTo(1);
    }

    @Test
    void extract_indexOutOfRange_fails() throws IOException {
        Path file = writeSource("machine.ts", MACHINE);

        int exitCode = run("extract", file.toString(), "--index", "3", "-c", configPath().toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Machine not found");
    }

    @Test
    void extract_configWithoutErrors_omitsErrors() throws IOException {
        Path file = writeSource("machine.ts", MACHINE);
        Files.writeString(configPath(), """
            output:
              includeErrors: false
              pretty: true
            """);

        int exitCode = run("extract", file.toString(), "-c", configPath().toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\n  ");
        JsonNode report = JsonMappers.standard().readTree(out.toString()).get(0);
        assertThat(report.has("errors")).isFalse();
    }

    @Test
    void extract_customFactoryName_isRecognised() throws IOException {
        Path file = writeSource("machine.ts", "const m = setup({}).createMachine({ id: \"a\" });\nconst n = makeMachine({ id: \"b\" });\n");
        Files.writeString(configPath(), """
            extraction:
              factoryNames:
                - makeMachine
            """);

        int exitCode = run("extract", file.toString(), "-c", configPath().toString());

        assertThat(exitCode).isZero();
        assertThat(JsonMappers.standard().readTree(out.toString()).size()).isEqualTo(1);
    }
}
