package com.machinebridge.cli;

import com.machinebridge.core.ast.InMemorySourceProgram;
import com.machinebridge.core.config.ConfigLoader;
import com.machinebridge.core.config.ProjectConfig;
import com.machinebridge.core.project.MachineProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loading helpers shared by the file-based commands.
 */
final class MachineFiles {

    private static final Logger log = LoggerFactory.getLogger(MachineFiles.class);

    private MachineFiles() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration, falling back to defaults when the file is absent.
     */
    static ProjectConfig loadConfiguration(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No configuration at {}, using defaults", configPath);
            return ProjectConfig.defaults();
        }
        return ConfigLoader.load(configPath);
    }

    /**
     * Builds a project over a single file read from disk.
     *
     * @throws IOException if the file cannot be read
     */
    static MachineProject openProject(Path file, ProjectConfig config) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a file: " + file);
        }
        List<String> factoryNames = config.extraction().factoryNames();
        log.debug("Opening {} with factory names {}", file, factoryNames);
        return new MachineProject(InMemorySourceProgram.fromFiles(List.of(file), factoryNames));
    }
}
