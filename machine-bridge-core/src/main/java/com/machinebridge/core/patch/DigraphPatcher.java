package com.machinebridge.core.patch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.util.JsonMappers;

import java.util.List;

/**
 * Applies {@link Patch}es to a {@link Digraph} through its JSON tree.
 *
 * <p>Semantics follow JSON Patch: {@code add} sets an object member or inserts into an array
 * ({@code "-"} appends), {@code remove} deletes a member or element, {@code replace} overwrites
 * one. Replacing a missing object member sets it. The patched tree must still describe a valid
 * digraph.
 */
public final class DigraphPatcher {

    private static final String APPEND = "-";

    private DigraphPatcher() {
        // Utility class - no instantiation
    }

    /**
     * Applies patches in order.
     *
     * @param digraph digraph to patch, not modified
     * @param patches patches in order
     * @return patched digraph
     * @throws IllegalArgumentException if a path does not exist or the result is not a valid digraph
     */
    public static Digraph apply(Digraph digraph, List<Patch> patches) {
        ObjectMapper mapper = JsonMappers.standard();
        JsonNode tree = mapper.valueToTree(digraph);
        for (Patch patch : patches) {
            applyTo(tree, patch);
        }
        try {
            return mapper.treeToValue(tree, Digraph.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Patched digraph is invalid: " + e.getOriginalMessage(), e);
        }
    }

    public static Digraph apply(Digraph digraph, Patch patch) {
        return apply(digraph, List.of(patch));
    }

    static void applyTo(JsonNode root, Patch patch) {
        List<Object> path = patch.path();
        JsonNode parent = root;
        for (int i = 0; i < path.size() - 1; i++) {
            parent = child(parent, patch.segment(i));
            if (parent == null) {
                throw new IllegalArgumentException("Patch path not found: " + path);
            }
        }
        String last = patch.segment(path.size() - 1);
        JsonNode value = patch.hasNoValue() ? NullNode.getInstance() : patch.value().deepCopy();

        if (parent instanceof ObjectNode object) {
            applyToObject(object, last, patch, value);
        } else if (parent instanceof ArrayNode array) {
            applyToArray(array, last, patch, value);
        } else {
            throw new IllegalArgumentException("Patch path does not address a container: " + path);
        }
    }

    private static void applyToObject(ObjectNode object, String name, Patch patch, JsonNode value) {
        switch (patch.op()) {
            case ADD, REPLACE -> object.set(name, value);
            case REMOVE -> {
                if (!object.has(name)) {
                    throw new IllegalArgumentException("Patch path not found: " + patch.path());
                }
                object.remove(name);
            }
        }
    }

    private static void applyToArray(ArrayNode array, String segment, Patch patch, JsonNode value) {
        if (patch.op() == PatchOp.ADD && APPEND.equals(segment)) {
            array.add(value);
            return;
        }
        int index = index(segment, patch);
        int limit = patch.op() == PatchOp.ADD ? array.size() : array.size() - 1;
        if (index > limit) {
            throw new IllegalArgumentException("Array index out of bounds in patch path: " + patch.path());
        }
        switch (patch.op()) {
            case ADD -> array.insert(index, value);
            case REPLACE -> array.set(index, value);
            case REMOVE -> array.remove(index);
        }
    }

    private static JsonNode child(JsonNode parent, String segment) {
        if (parent instanceof ObjectNode object) {
            return object.get(segment);
        }
        if (parent instanceof ArrayNode array) {
            try {
                return array.get(Integer.parseInt(segment));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static int index(String segment, Patch patch) {
        try {
            int index = Integer.parseInt(segment);
            if (index < 0) {
                throw new IllegalArgumentException("Negative array index in patch path: " + patch.path());
            }
            return index;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid array index '" + segment + "' in patch path: " + patch.path(), e);
        }
    }
}
