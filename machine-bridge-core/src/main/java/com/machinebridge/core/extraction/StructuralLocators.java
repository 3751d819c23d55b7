package com.machinebridge.core.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locators recorded during one extraction.
 *
 * @param nodes node id to the path of its state literal
 * @param edges edge id to the path of its transition literal
 */
public record StructuralLocators(Map<String, AstPath> nodes, Map<String, AstPath> edges) {

    public StructuralLocators {
        nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
        edges = edges != null ? Collections.unmodifiableMap(new LinkedHashMap<>(edges)) : Map.of();
    }
}
