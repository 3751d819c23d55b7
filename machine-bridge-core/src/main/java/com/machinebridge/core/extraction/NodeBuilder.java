package com.machinebridge.core.extraction;

import com.machinebridge.core.model.HistoryType;
import com.machinebridge.core.model.MetaEntry;
import com.machinebridge.core.model.Node;
import com.machinebridge.core.model.NodeData;
import com.machinebridge.core.model.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable node under construction.
 */
final class NodeBuilder {

    final String id;
    final String parentId;
    final String key;
    String initial;
    NodeType type = NodeType.NORMAL;
    HistoryType history;
    String description;
    final List<MetaEntry> metaEntries = new ArrayList<>();
    final List<String> entry = new ArrayList<>();
    final List<String> exit = new ArrayList<>();
    final List<String> invoke = new ArrayList<>();
    final List<String> tags = new ArrayList<>();

    NodeBuilder(String id, String parentId, String key) {
        this.id = id;
        this.parentId = parentId;
        this.key = key;
    }

    Node build() {
        return new Node(id, parentId,
            new NodeData(key, initial, type, history, description, metaEntries, entry, exit, invoke, tags));
    }
}
