package com.machinebridge.core.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.machinebridge.core.MachineTestBase;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.codechange.TextEdits;
import com.machinebridge.core.extraction.ExtractionResult;
import com.machinebridge.core.extraction.MachineExtractor;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.Edge;
import com.machinebridge.core.model.EdgeData;
import com.machinebridge.core.model.EventTypeData;
import com.machinebridge.core.model.Node;
import com.machinebridge.core.model.NodeData;
import com.machinebridge.core.util.JsonMappers;

import java.util.List;
import java.util.function.Function;

/**
 * Patch builders and a one-shot patch runner shared by the patch tests.
 */
abstract class PatchTestSupport extends MachineTestBase {

    /**
     * Extracts the first machine of {@code text}, applies the patches built from its digraph and
     * returns the edited text.
     */
    static String patched(String text, Function<Digraph, List<Patch>> patches) {
        return TextEdits.apply(text, apply(text, patches).edits());
    }

    static PatchResult apply(String text, Function<Digraph, List<Patch>> patches) {
        SourceFile file = parse(text);
        ExtractionResult result = new MachineExtractor().extract(file, 0);
        PatchApplier applier = new PatchApplier(file, file.factoryCalls().get(0).config().orElseThrow(),
            result.locators(), result.idMap());
        return applier.apply(result.digraph(), patches.apply(result.digraph()));
    }

    static Patch addNode(String id, String parentId, String key) {
        return Patch.add(List.of("nodes", id), tree(new Node(id, parentId, NodeData.empty(key))));
    }

    static Patch addEdge(String id, String sourceId, EventTypeData event, List<String> targetIds) {
        return addEdge(id, sourceId, event, targetIds, true, null);
    }

    static Patch addEdge(String id, String sourceId, EventTypeData event, List<String> targetIds,
                         boolean internal, String description) {
        Edge edge = new Edge(id, sourceId, targetIds, new EdgeData(event, List.of(), null, description, internal));
        return Patch.add(List.of("edges", id), tree(edge));
    }

    static Patch replaceData(Node node, String field, String value) {
        return Patch.replace(List.of("nodes", node.id(), "data", field), TextNode.valueOf(value));
    }

    static EventTypeData named(String eventType) {
        return new EventTypeData.Named(eventType);
    }

    static JsonNode tree(Object value) {
        return JsonMappers.standard().valueToTree(value);
    }
}
