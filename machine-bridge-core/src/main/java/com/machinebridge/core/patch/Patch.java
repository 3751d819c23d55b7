package com.machinebridge.core.patch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * A structural change to a {@link com.machinebridge.core.model.Digraph}.
 *
 * <p>The path addresses the serialized digraph, e.g. {@code ["nodes", "<id>"]} or
 * {@code ["nodes", "<id>", "data", "initial"]}. Segments are property names or array indices;
 * {@code "-"} appends to an array.
 *
 * <p><b>JSON form:</b>
 * <pre>{@code
 * {"op": "replace", "path": ["nodes", "4f1c...", "data", "type"], "value": "final"}
 * }</pre>
 *
 * @param op operation
 * @param path path into the serialized digraph
 * @param value new value for add and replace, null when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Patch(PatchOp op, List<Object> path, JsonNode value) {

    /**
     * Compact constructor with validation.
     */
    public Patch {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        path = List.copyOf(path);
    }

    public static Patch add(List<Object> path, JsonNode value) {
        return new Patch(PatchOp.ADD, path, value);
    }

    public static Patch remove(List<Object> path) {
        return new Patch(PatchOp.REMOVE, path, null);
    }

    public static Patch replace(List<Object> path, JsonNode value) {
        return new Patch(PatchOp.REPLACE, path, value);
    }

    /**
     * Returns a path segment as text.
     *
     * @param index segment index
     * @return segment text
     */
    public String segment(int index) {
        return String.valueOf(path.get(index));
    }

    /**
     * Returns true if the value is absent, JSON {@code null} included.
     */
    public boolean hasNoValue() {
        return value == null || value.isNull() || value.isMissingNode();
    }
}
