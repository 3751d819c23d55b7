package com.machinebridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.machinebridge.core.ast.SourceParser;

import java.util.List;

/**
 * Root configuration for MachineBridge.
 *
 * <p>Loaded from {@code machinebridge.yaml} in the working directory. Sections or settings left
 * out of the file take their default values.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * extraction:
 *   factoryNames:
 *     - createMachine
 *     - setup
 *
 * output:
 *   pretty: true
 *   includeErrors: true
 *
 * patch:
 *   writeInPlace: false
 * }</pre>
 *
 * @param extraction extraction settings
 * @param output output settings
 * @param patch patch settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("extraction") ExtractionConfig extraction,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("patch") PatchConfig patch
) {
    public ProjectConfig {
        extraction = extraction != null ? extraction : ExtractionConfig.defaults();
        output = output != null ? output : OutputConfig.defaults();
        patch = patch != null ? patch : PatchConfig.defaults();
    }

    /**
     * Creates the default configuration: {@code createMachine} calls, compact output with
     * errors, edits printed rather than written.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(ExtractionConfig.defaults(), OutputConfig.defaults(), PatchConfig.defaults());
    }

    /**
     * Extraction settings.
     *
     * @param factoryNames function names whose calls are machine factories
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractionConfig(
        @JsonProperty("factoryNames") List<String> factoryNames
    ) {
        public ExtractionConfig {
            factoryNames = factoryNames != null && !factoryNames.isEmpty()
                ? List.copyOf(factoryNames)
                : List.of(SourceParser.DEFAULT_FACTORY_NAME);
        }

        public static ExtractionConfig defaults() {
            return new ExtractionConfig(null);
        }
    }

    /**
     * Output settings.
     *
     * @param pretty whether JSON output is indented
     * @param includeErrors whether extraction output carries the soft errors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("pretty") Boolean pretty,
        @JsonProperty("includeErrors") Boolean includeErrors
    ) {
        public OutputConfig {
            pretty = pretty != null ? pretty : Boolean.FALSE;
            includeErrors = includeErrors != null ? includeErrors : Boolean.TRUE;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }

    /**
     * Patch settings.
     *
     * @param writeInPlace whether the patch command rewrites the source file instead of printing edits
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatchConfig(
        @JsonProperty("writeInPlace") Boolean writeInPlace
    ) {
        public PatchConfig {
            writeInPlace = writeInPlace != null ? writeInPlace : Boolean.FALSE;
        }

        public static PatchConfig defaults() {
            return new PatchConfig(null);
        }
    }
}
