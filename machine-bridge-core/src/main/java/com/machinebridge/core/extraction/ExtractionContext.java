package com.machinebridge.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.model.ActionBlock;
import com.machinebridge.core.model.ActorBlock;
import com.machinebridge.core.model.Block;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.DigraphData;
import com.machinebridge.core.model.Edge;
import com.machinebridge.core.model.ExtractionError;
import com.machinebridge.core.model.ExtractionErrorType;
import com.machinebridge.core.model.Implementation;
import com.machinebridge.core.model.Implementations;
import com.machinebridge.core.model.Node;
import com.machinebridge.core.util.IdGenerator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * State of one extraction pass, passed explicitly through every extractor.
 *
 * <p>Accumulates the digraph under construction, soft errors, declared ids, unresolved target
 * strings and the structural locators of every node and edge. Created fresh per extraction and
 * discarded afterwards; only the built {@link ExtractionResult} survives.
 */
final class ExtractionContext {

    private final SourceFile sourceFile;
    private final String fileName;
    private final int machineIndex;

    final Map<String, NodeBuilder> nodes = new LinkedHashMap<>();
    final Map<String, EdgeBuilder> edges = new LinkedHashMap<>();
    final Map<String, Block> blocks = new LinkedHashMap<>();
    final Map<String, Implementation> actions = new LinkedHashMap<>();
    final Map<String, Implementation> actors = new LinkedHashMap<>();
    final Map<String, Implementation> guards = new LinkedHashMap<>();
    final Map<String, String> inlineSources = new LinkedHashMap<>();
    final Map<String, TreeNode> treeNodes = new LinkedHashMap<>();
    final Map<String, String> declaredIds = new LinkedHashMap<>();
    final Map<String, List<String>> pendingTargets = new LinkedHashMap<>();
    final Map<String, AstPath> nodeLocators = new LinkedHashMap<>();
    final Map<String, AstPath> edgeLocators = new LinkedHashMap<>();
    final List<ExtractionError> errors = new ArrayList<>();
    JsonNode context;

    private AstPath currentPath = AstPath.root();

    ExtractionContext(SourceFile sourceFile, int machineIndex) {
        this.sourceFile = sourceFile;
        this.fileName = sourceFile.fileName();
        this.machineIndex = machineIndex;
    }

    void error(ExtractionErrorType type) {
        errors.add(ExtractionError.of(type));
    }

    void error(ExtractionErrorType type, String detail) {
        errors.add(new ExtractionError(type, detail));
    }

    AstPath currentPath() {
        return currentPath;
    }

    /**
     * Runs {@code body} with {@code step} appended to the current path.
     */
    <T> T withStep(AstPathStep step, Supplier<T> body) {
        AstPath saved = currentPath;
        currentPath = currentPath.append(step);
        try {
            return body.get();
        } finally {
            currentPath = saved;
        }
    }

    void inStep(AstPathStep step, Runnable body) {
        withStep(step, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Derives a deterministic id for an entity of the given kind at the current path.
     */
    String newId(String kind) {
        return IdGenerator.generate(fileName, Integer.toString(machineIndex), kind, currentPath.toString());
    }

    String newInlineSourceId(String kind) {
        return Block.INLINE_PREFIX + newId("inline-" + kind);
    }

    /**
     * Creates an inline source id and keeps the text of the expression that implements it.
     */
    String newInlineSourceId(String kind, JsAst.Expression implementation) {
        String sourceId = newInlineSourceId(kind);
        inlineSources.put(sourceId, sourceFile.textOf(implementation.range()));
        return sourceId;
    }

    NodeBuilder addNode(String parentId, String key) {
        NodeBuilder node = new NodeBuilder(newId("node"), parentId, key);
        nodes.put(node.id, node);
        nodeLocators.put(node.id, currentPath);
        TreeNode treeNode = new TreeNode(node.id, parentId);
        treeNodes.put(node.id, treeNode);
        return node;
    }

    void addEdge(EdgeBuilder edge, AstPath locator, List<String> targets) {
        edges.put(edge.id, edge);
        edgeLocators.put(edge.id, locator);
        if (targets != null) {
            pendingTargets.put(edge.id, List.copyOf(targets));
        }
    }

    void registerAction(ActionBlock block, List<String> owner) {
        owner.add(block.id());
        blocks.put(block.id(), block);
        actions.putIfAbsent(block.sourceId(),
            new Implementation(Implementation.ACTION, block.sourceId(), block.sourceId(),
                inlineSources.get(block.sourceId())));
    }

    void registerActor(ActorBlock block, List<String> owner) {
        owner.add(block.id());
        blocks.put(block.id(), block);
        actors.putIfAbsent(block.sourceId(),
            new Implementation(Implementation.ACTOR, block.sourceId(), block.sourceId(),
                inlineSources.get(block.sourceId())));
    }

    Digraph buildDigraph(String rootId) {
        Map<String, Node> builtNodes = new LinkedHashMap<>();
        nodes.forEach((id, node) -> builtNodes.put(id, node.build()));
        Map<String, Edge> builtEdges = new LinkedHashMap<>();
        edges.forEach((id, edge) -> builtEdges.put(id, edge.build()));
        return new Digraph(rootId, builtNodes, builtEdges, blocks,
            new Implementations(actions, actors, guards), new DigraphData(context));
    }

    StructuralLocators locators() {
        return new StructuralLocators(nodeLocators, edgeLocators);
    }
}
