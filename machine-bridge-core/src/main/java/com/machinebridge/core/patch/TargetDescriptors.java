package com.machinebridge.core.patch;

import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes the shortest transition target that resolves back to a given node.
 *
 * <p><b>Rules, in order:</b>
 * <ol>
 *   <li>the root: {@code #<declared id>}, or {@code #(machine)} without one</li>
 *   <li>the source itself: its own key</li>
 *   <li>a descendant of the source: {@code .child.grandchild}</li>
 *   <li>a descendant of the source's parent, other than the parent itself: {@code sibling.child}</li>
 *   <li>otherwise: {@code #id.child} from the closest ancestor-or-self of the target that
 *       declares an id, the root counting as {@code #(machine)}</li>
 * </ol>
 */
public final class TargetDescriptors {

    /**
     * Id the root is referenced by when it declares none.
     */
    public static final String DEFAULT_ROOT_ID = "(machine)";

    private static final String ID_PREFIX = "#";
    private static final String SEPARATOR = ".";

    private TargetDescriptors() {
        // Utility class - no instantiation
    }

    /**
     * Synthesizes the target descriptor for a transition from {@code sourceId} to {@code targetId}.
     *
     * @param digraph digraph containing both nodes
     * @param idMap node id to declared {@code id}
     * @param sourceId transition source node id
     * @param targetId transition target node id
     * @return target descriptor
     * @throws IllegalStateException if a node or one of its ancestors is missing from the digraph
     */
    public static String bestTargetDescriptor(Digraph digraph, Map<String, String> idMap,
                                              String sourceId, String targetId) {
        Node target = node(digraph, targetId);
        if (target.isRoot()) {
            return ID_PREFIX + idMap.getOrDefault(target.id(), DEFAULT_ROOT_ID);
        }
        Node source = node(digraph, sourceId);
        if (source.id().equals(target.id())) {
            return target.data().key();
        }

        List<Node> sourcePath = pathToRoot(digraph, source);
        List<Node> targetPath = pathToRoot(digraph, target);
        Set<String> sourceAncestry = sourcePath.stream().map(Node::id).collect(Collectors.toSet());
        Node common = targetPath.stream()
            .filter(node -> sourceAncestry.contains(node.id()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Nodes do not share a root: " + sourceId + ", " + targetId));

        if (common.id().equals(source.id())) {
            return SEPARATOR + keys(targetPath, targetPath.size() - sourcePath.size());
        }
        if (common.id().equals(source.parentId()) && !common.id().equals(target.id())) {
            return keys(targetPath, targetPath.size() - sourcePath.size() + 1);
        }

        for (int i = 0; i < targetPath.size(); i++) {
            Node current = targetPath.get(i);
            String declared = idMap.get(current.id());
            if (declared == null && current.isRoot()) {
                declared = DEFAULT_ROOT_ID;
            }
            if (declared != null) {
                String descent = keys(targetPath, i);
                return ID_PREFIX + declared + (descent.isEmpty() ? "" : SEPARATOR + descent);
            }
        }
        throw new IllegalStateException("No addressable ancestor for target " + targetId);
    }

    /**
     * Returns the node followed by its ancestors up to the root.
     */
    private static List<Node> pathToRoot(Digraph digraph, Node node) {
        List<Node> path = new ArrayList<>();
        Node current = node;
        while (current != null) {
            path.add(current);
            if (path.size() > digraph.nodes().size()) {
                throw new IllegalStateException("Cycle in parent chain of " + node.id());
            }
            current = current.parentId() != null ? node(digraph, current.parentId()) : null;
        }
        return path;
    }

    /**
     * Joins the keys of the first {@code count} nodes of a leaf-to-root path, root side first.
     */
    private static String keys(List<Node> path, int count) {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            keys.add(path.get(i).data().key());
        }
        Collections.reverse(keys);
        return String.join(SEPARATOR, keys);
    }

    private static Node node(Digraph digraph, String id) {
        Node node = digraph.nodes().get(id);
        if (node == null) {
            throw new IllegalStateException("Unknown node: " + id);
        }
        return node;
    }
}
