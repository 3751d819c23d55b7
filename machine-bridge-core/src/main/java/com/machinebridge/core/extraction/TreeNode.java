package com.machinebridge.core.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Extraction-time mirror of a node that indexes children by key, for dotted target lookups.
 */
public final class TreeNode {

    private final String id;
    private final String parentId;
    private final Map<String, TreeNode> children = new LinkedHashMap<>();

    public TreeNode(String id, String parentId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.parentId = parentId;
    }

    public String id() {
        return id;
    }

    public String parentId() {
        return parentId;
    }

    public Map<String, TreeNode> children() {
        return Collections.unmodifiableMap(children);
    }

    public TreeNode child(String key) {
        return children.get(key);
    }

    /**
     * Registers a child unless the key is taken.
     *
     * @return true if the child was added
     */
    boolean addChild(String key, TreeNode child) {
        return children.putIfAbsent(key, child) == null;
    }

    boolean hasChild(String key) {
        return children.containsKey(key);
    }
}
