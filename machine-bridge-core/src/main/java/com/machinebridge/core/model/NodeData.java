package com.machinebridge.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Configuration data of a state node.
 *
 * @param key property name of the state in its parent's {@code states}, {@code (machine)} for the root
 * @param initial initial child key, or null
 * @param type state type
 * @param history history depth, or null
 * @param description description, or null
 * @param metaEntries {@code meta} entries in declaration order
 * @param entry entry action block ids
 * @param exit exit action block ids
 * @param invoke actor block ids
 * @param tags state tags
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeData(
    String key,
    String initial,
    NodeType type,
    HistoryType history,
    String description,
    List<MetaEntry> metaEntries,
    List<String> entry,
    List<String> exit,
    List<String> invoke,
    List<String> tags
) {
    /**
     * Compact constructor with validation.
     */
    public NodeData {
        Objects.requireNonNull(key, "key must not be null");
        type = type != null ? type : NodeType.NORMAL;
        metaEntries = metaEntries != null ? List.copyOf(metaEntries) : List.of();
        entry = entry != null ? List.copyOf(entry) : List.of();
        exit = exit != null ? List.copyOf(exit) : List.of();
        invoke = invoke != null ? List.copyOf(invoke) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /**
     * Data of a state with no configured properties.
     *
     * @param key state key
     * @return empty node data
     */
    public static NodeData empty(String key) {
        return new NodeData(key, null, NodeType.NORMAL, null, null, List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
