package com.machinebridge.core.extraction;

import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.ExtractionError;
import com.machinebridge.core.model.MachineExtraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one extraction produces.
 *
 * @param digraph extracted digraph
 * @param errors soft errors
 * @param locators structural locators of nodes and edges
 * @param idMap node id to its declared {@code id}
 */
public record ExtractionResult(
    Digraph digraph,
    List<ExtractionError> errors,
    StructuralLocators locators,
    Map<String, String> idMap
) {
    public ExtractionResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        locators = locators != null ? locators : new StructuralLocators(Map.of(), Map.of());
        idMap = idMap != null ? Collections.unmodifiableMap(new LinkedHashMap<>(idMap)) : Map.of();
    }

    public MachineExtraction toMachineExtraction() {
        return new MachineExtraction(digraph, errors);
    }
}
