package com.machinebridge.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads {@code machinebridge.yaml} into a {@link ProjectConfig}.
 *
 * <p>The file is read as a YAML tree first, so an empty document or one without any known
 * section yields {@link ProjectConfig#defaults()}. Factory names must be plain JavaScript
 * identifiers, since call sites are matched by their callee identifier; other entries are
 * dropped with a warning, and duplicates are collapsed. A file that is missing, unreadable or
 * not valid YAML also yields the defaults.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_FILE_NAME));
 * List<String> factoryNames = config.extraction().factoryNames();
 * }</pre>
 */
public final class ConfigLoader {

    /**
     * Configuration file looked up in the working directory.
     */
    public static final String DEFAULT_FILE_NAME = "machinebridge.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Set<String> SECTIONS = Set.of("extraction", "output", "patch");

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration from a YAML file, falling back to defaults.
     *
     * @param configPath path to {@code machinebridge.yaml}
     * @return loaded configuration, or {@link ProjectConfig#defaults()} if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.debug("No readable configuration at {}, using defaults", configPath);
            return ProjectConfig.defaults();
        }

        JsonNode tree;
        try {
            tree = YAML_MAPPER.readTree(configPath.toFile());
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
        if (tree == null || !tree.isObject() || SECTIONS.stream().noneMatch(tree::has)) {
            log.warn("Configuration file {} has no extraction, output or patch section. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            ProjectConfig config = validated(YAML_MAPPER.treeToValue(tree, ProjectConfig.class));
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Invalid configuration in {}: {}. Using defaults.", configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }

    /**
     * Keeps the factory names that can match a call site.
     *
     * @param config configuration as read
     * @return configuration with usable factory names only
     */
    static ProjectConfig validated(ProjectConfig config) {
        Set<String> names = new LinkedHashSet<>();
        List<String> rejected = new ArrayList<>();
        for (String name : config.extraction().factoryNames()) {
            String trimmed = name.trim();
            if (IDENTIFIER.matcher(trimmed).matches()) {
                names.add(trimmed);
            } else {
                rejected.add(name);
            }
        }
        if (List.copyOf(names).equals(config.extraction().factoryNames())) {
            return config;
        }
        if (!rejected.isEmpty()) {
            log.warn("Ignoring factory names that are not identifiers: {}", rejected);
        }
        return new ProjectConfig(new ProjectConfig.ExtractionConfig(List.copyOf(names)),
            config.output(), config.patch());
    }
}
