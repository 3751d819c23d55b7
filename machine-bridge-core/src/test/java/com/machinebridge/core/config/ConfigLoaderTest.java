package com.machinebridge.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            extraction:
              factoryNames:
                - createMachine
                - setup

            output:
              pretty: true
              includeErrors: false

            patch:
              writeInPlace: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.extraction().factoryNames()).containsExactly("createMachine", "setup");
        assertThat(config.output().pretty()).isTrue();
        assertThat(config.output().includeErrors()).isFalse();
        assertThat(config.patch().writeInPlace()).isTrue();
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              pretty: true
            unknownSection:
              ignored: 1
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().pretty()).isTrue();
        assertThat(config.output().includeErrors()).isTrue();
        assertThat(config.extraction().factoryNames()).containsExactly("createMachine");
        assertThat(config.patch().writeInPlace()).isFalse();
    }

    @Test
    void load_emptyFactoryNames_fallBackToDefault() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            extraction:
              factoryNames: []
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.extraction().factoryNames()).containsExactly("createMachine");
    }

    @Test
    void load_factoryNamesNotIdentifiers_areDropped() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            extraction:
              factoryNames:
                - " setup "
                - xstate.createMachine
                - "create-machine"
                - setup
                - $machine
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.extraction().factoryNames()).containsExactly("setup", "$machine");
    }

    @Test
    void load_onlyInvalidFactoryNames_fallBackToDefault() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            extraction:
              factoryNames:
                - "1st"
            output:
              pretty: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.extraction().factoryNames()).containsExactly("createMachine");
        assertThat(config.output().pretty()).isTrue();
    }

    @Test
    void load_noKnownSection_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            - just
            - a list
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_wrongSectionShape_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            output:
              pretty: [1, 2]
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("directory"));

        ProjectConfig config = ConfigLoader.load(directory);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void defaults_printEditsCompactlyWithErrors() {
        ProjectConfig config = ProjectConfig.defaults();

        assertThat(config.output().pretty()).isFalse();
        assertThat(config.output().includeErrors()).isTrue();
        assertThat(config.patch().writeInPlace()).isFalse();
    }
}
