package com.machinebridge.core.project;

import com.machinebridge.core.extraction.ExtractionResult;
import com.machinebridge.core.extraction.StructuralLocators;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.ExtractionError;
import com.machinebridge.core.model.MachineExtraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a project remembers about one machine between requests.
 *
 * @param digraph current digraph, patches included
 * @param errors soft errors of the last extraction
 * @param locators locators of the last extraction
 * @param idMap node id to declared {@code id}
 * @param sourceText file text the locators refer to
 */
public record ProjectMachineState(
    Digraph digraph,
    List<ExtractionError> errors,
    StructuralLocators locators,
    Map<String, String> idMap,
    String sourceText
) {
    public ProjectMachineState {
        Objects.requireNonNull(digraph, "digraph must not be null");
        Objects.requireNonNull(locators, "locators must not be null");
        Objects.requireNonNull(sourceText, "sourceText must not be null");
        errors = errors != null ? List.copyOf(errors) : List.of();
        idMap = idMap != null ? Collections.unmodifiableMap(new LinkedHashMap<>(idMap)) : Map.of();
    }

    static ProjectMachineState of(ExtractionResult result, String sourceText) {
        return new ProjectMachineState(result.digraph(), result.errors(), result.locators(), result.idMap(), sourceText);
    }

    ProjectMachineState withDigraph(Digraph patched) {
        return new ProjectMachineState(patched, errors, locators, idMap, sourceText);
    }

    public MachineExtraction toMachineExtraction() {
        return new MachineExtraction(digraph, errors);
    }
}
