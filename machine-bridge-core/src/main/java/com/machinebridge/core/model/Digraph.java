package com.machinebridge.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Normalized graph snapshot of one machine.
 *
 * <p>A pure value: it holds no reference into the source it was extracted from. Maps keep
 * insertion order.
 *
 * @param root root node id
 * @param nodes nodes by id
 * @param edges edges by id
 * @param blocks blocks by id
 * @param implementations implementation registry
 * @param data machine-level data
 */
public record Digraph(
    String root,
    Map<String, Node> nodes,
    Map<String, Edge> edges,
    Map<String, Block> blocks,
    Implementations implementations,
    DigraphData data
) {
    /**
     * Compact constructor with validation.
     */
    public Digraph {
        Objects.requireNonNull(root, "root must not be null");
        nodes = Implementations.ordered(nodes);
        edges = Implementations.ordered(edges);
        blocks = Implementations.ordered(blocks);
        implementations = implementations != null ? implementations : Implementations.empty();
        data = data != null ? data : new DigraphData(null);
        if (!nodes.containsKey(root)) {
            throw new IllegalArgumentException("root must reference a node: " + root);
        }
    }

    public Node rootNode() {
        return nodes.get(root);
    }
}
