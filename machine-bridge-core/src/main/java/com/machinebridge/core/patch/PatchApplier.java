package com.machinebridge.core.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.codechange.CodeChanges;
import com.machinebridge.core.codechange.CodeElement;
import com.machinebridge.core.codechange.CodeElements;
import com.machinebridge.core.codechange.InsertionPriority;
import com.machinebridge.core.codechange.ObjectElement;
import com.machinebridge.core.codechange.ObjectTarget;
import com.machinebridge.core.codechange.PropertyElement;
import com.machinebridge.core.extraction.AstPath;
import com.machinebridge.core.extraction.AstPathStep;
import com.machinebridge.core.extraction.AstPaths;
import com.machinebridge.core.extraction.PropertyKeys;
import com.machinebridge.core.extraction.StructuralLocators;
import com.machinebridge.core.model.Block;
import com.machinebridge.core.model.Digraph;
import com.machinebridge.core.model.Edge;
import com.machinebridge.core.model.EventTypeData;
import com.machinebridge.core.model.HistoryType;
import com.machinebridge.core.model.Node;
import com.machinebridge.core.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns {@link Patch}es against a machine's digraph into text edits of its source file.
 *
 * <p>Patches are applied one at a time to the digraph; each one is mirrored as a code change
 * located through the structural locators of the last extraction, so every edit refers to the
 * unmodified source text. The edits of the whole batch are returned together.
 *
 * <p><b>Source changes per patch:</b>
 * <ul>
 *   <li>add {@code nodes/<id>} - an empty state literal in the parent's {@code states}</li>
 *   <li>add {@code edges/<id>} - a transition under {@code on.<event>}, {@code always},
 *       {@code onDone} or {@code invoke[i].onDone/onError}</li>
 *   <li>replace {@code nodes/<id>/data/key} - renames the state property</li>
 *   <li>replace {@code nodes/<id>/data/initial|type|history|description} - writes, rewrites or
 *       removes the state property; defaults are never written</li>
 *   <li>remove {@code nodes/<id>} or {@code edges/<id>} - deletes the state property or the
 *       transition; remove of a data field above counts as replacing it with nothing</li>
 * </ul>
 * Any other patch changes the digraph only.
 *
 * <p>An instance serves one batch.
 */
public final class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private static final String NODES = "nodes";
    private static final String EDGES = "edges";
    private static final String DATA = "data";
    private static final String STATES = "states";

    private final JsAst.Expression config;
    private final StructuralLocators locators;
    private final Map<String, String> idMap;
    private final CodeChanges changes;
    private final Map<String, PropertyElement> addedNodes = new HashMap<>();
    private final Set<String> addedEdges = new HashSet<>();

    /**
     * Creates an applier for one machine.
     *
     * @param sourceFile file the machine was extracted from
     * @param config configuration literal of the machine
     * @param locators locators recorded by the extraction
     * @param idMap node id to declared {@code id}, from the extraction
     */
    public PatchApplier(SourceFile sourceFile, JsAst.Expression config,
                        StructuralLocators locators, Map<String, String> idMap) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.locators = Objects.requireNonNull(locators, "locators must not be null");
        this.idMap = Objects.requireNonNull(idMap, "idMap must not be null");
        this.changes = new CodeChanges(Objects.requireNonNull(sourceFile, "sourceFile must not be null"));
    }

    /**
     * Applies a batch of patches.
     *
     * @param digraph digraph of the last extraction
     * @param patches patches in order
     * @return patched digraph and text edits
     * @throws IllegalArgumentException if a patch does not fit the digraph
     * @throws IllegalStateException if the source no longer has the recorded shape
     * @throws UnsupportedOperationException for transitions that cannot be written
     */
    public PatchResult apply(Digraph digraph, List<Patch> patches) {
        Digraph current = digraph;
        for (Patch patch : patches) {
            current = DigraphPatcher.apply(current, patch);
            translate(patch, current);
        }
        PatchResult result = new PatchResult(current, changes.getTextEdits());
        log.debug("Applied {} patch(es) as {} edit(s)", patches.size(), result.edits().size());
        return result;
    }

    private void translate(Patch patch, Digraph digraph) {
        int length = patch.path().size();
        String collection = patch.segment(0);
        boolean entity = length == 2;
        boolean nodeDataField = length == 4 && NODES.equals(collection) && DATA.equals(patch.segment(2));

        switch (patch.op()) {
            case ADD -> {
                if (entity && NODES.equals(collection)) {
                    addNode(entityAt(digraph.nodes(), patch), digraph);
                    return;
                }
                if (entity && EDGES.equals(collection)) {
                    addEdge(entityAt(digraph.edges(), patch), digraph);
                    return;
                }
            }
            case REPLACE -> {
                if (nodeDataField) {
                    replaceNodeData(patch.segment(1), patch.segment(3), patch.hasNoValue() ? null : patch.value());
                    return;
                }
            }
            case REMOVE -> {
                if (entity && NODES.equals(collection)) {
                    removeNode(patch.segment(1));
                    return;
                }
                if (entity && EDGES.equals(collection)) {
                    removeEdge(patch.segment(1));
                    return;
                }
                if (nodeDataField && !"key".equals(patch.segment(3))) {
                    replaceNodeData(patch.segment(1), patch.segment(3), null);
                    return;
                }
            }
        }
        log.debug("No source change for {} {}", patch.op().code(), patch.path());
    }

    private static <T> T entityAt(Map<String, T> entities, Patch patch) {
        T entity = entities.get(patch.segment(1));
        if (entity == null) {
            throw new IllegalArgumentException("Patch value is not a valid entity: " + patch.path());
        }
        return entity;
    }

    private void addNode(Node node, Digraph digraph) {
        if (node.parentId() == null) {
            throw new IllegalArgumentException("A second root state cannot be added: " + node.id());
        }
        String key = node.data().key();
        boolean duplicate = digraph.nodes().values().stream()
            .anyMatch(other -> !other.id().equals(node.id())
                && node.parentId().equals(other.parentId())
                && key.equals(other.data().key()));
        if (duplicate) {
            throw new IllegalArgumentException("State " + node.parentId() + " already has a child '" + key + "'");
        }

        PropertyElement property = changes.insertAtOptionalObjectPath(
                stateTarget(node.parentId()), List.of(STATES, key), CodeElements.object(), InsertionPriority.STATES)
            .orElseThrow(() -> new IllegalStateException("State key '" + key + "' already present in source"));
        addedNodes.put(node.id(), property);
        log.debug("Added state '{}' under {}", key, node.parentId());
    }

    private void addEdge(Edge edge, Digraph digraph) {
        List<Object> path = transitionPath(edge, digraph);
        changes.insertAtOptionalObjectPath(stateTarget(edge.source()), path, transitionElement(edge, digraph), null);
        addedEdges.add(edge.id());
        log.debug("Added transition {} at {}", edge.id(), path);
    }

    private static List<Object> transitionPath(Edge edge, Digraph digraph) {
        EventTypeData event = edge.data().eventTypeData();
        if (event instanceof EventTypeData.Named named) {
            return List.of("on", named.eventType());
        }
        if (event instanceof EventTypeData.Always) {
            return List.of("always");
        }
        if (event instanceof EventTypeData.StateDone) {
            return List.of("onDone");
        }
        if (event instanceof EventTypeData.InvocationDone done) {
            return List.of("invoke", invokeIndex(edge, digraph, done.invocationId()), "onDone");
        }
        if (event instanceof EventTypeData.InvocationError error) {
            return List.of("invoke", invokeIndex(edge, digraph, error.invocationId()), "onError");
        }
        throw new UnsupportedOperationException(
            "Writing " + event.getClass().getSimpleName() + " transitions is not supported");
    }

    private static int invokeIndex(Edge edge, Digraph digraph, String invocationId) {
        int index = digraph.nodes().get(edge.source()).data().invoke().indexOf(invocationId);
        if (index < 0) {
            throw new IllegalStateException("Invocation " + invocationId + " is not invoked by " + edge.source());
        }
        return index;
    }

    /**
     * Writes the bare target when the transition has nothing else to say, an object otherwise.
     */
    private CodeElement transitionElement(Edge edge, Digraph digraph) {
        List<CodeElement> targets = new ArrayList<>();
        for (String target : edge.targets()) {
            targets.add(CodeElements.string(
                TargetDescriptors.bestTargetDescriptor(digraph, idMap, edge.source(), target)));
        }
        CodeElement target = switch (targets.size()) {
            case 0 -> CodeElements.undefined();
            case 1 -> targets.get(0);
            default -> CodeElements.array(targets);
        };

        ObjectElement transition = CodeElements.object();
        if (!targets.isEmpty()) {
            transition.insert(CodeElements.property("target", target), null);
        }
        if (edge.data().guard() != null) {
            Block guard = digraph.blocks().get(edge.data().guard());
            if (guard == null) {
                throw new IllegalStateException("Unknown guard block: " + edge.data().guard());
            }
            transition.insert(CodeElements.property("guard", CodeElements.string(guard.sourceId())), null);
        }
        if (!edge.data().internal()) {
            transition.insert(CodeElements.property("reenter", CodeElements.bool(true)), null);
        }
        String description = edge.data().description();
        if (description != null && !description.isEmpty()) {
            transition.insert(CodeElements.property("description", CodeElements.multilineString(description)), null);
        }

        boolean targetOnly = transition.properties().size() == (targets.isEmpty() ? 0 : 1);
        return targetOnly ? target : transition;
    }

    private void replaceNodeData(String nodeId, String field, JsonNode value) {
        switch (field) {
            case "key" -> rename(nodeId, value);
            case "initial" -> setStateProperty(nodeId, "initial",
                value == null ? null : CodeElements.string(value.asText()), InsertionPriority.INITIAL, true);
            case "type" -> setStateProperty(nodeId, "type",
                value == null || NodeType.NORMAL.code().equals(value.asText()) ? null : CodeElements.string(value.asText()),
                InsertionPriority.STATE_TYPE, false);
            case "history" -> setStateProperty(nodeId, "history",
                value == null || HistoryType.SHALLOW.code().equals(value.asText()) ? null : CodeElements.string(value.asText()),
                InsertionPriority.HISTORY, false);
            case "description" -> setStateProperty(nodeId, "description",
                value == null || value.asText().isEmpty() ? null : CodeElements.multilineString(value.asText()),
                null, false);
            default -> log.debug("No source change for data field '{}' of node {}", field, nodeId);
        }
    }

    private void rename(String nodeId, JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("State key must be a string: " + nodeId);
        }
        PropertyElement added = addedNodes.get(nodeId);
        if (added != null) {
            added.rename(value.asText());
            return;
        }
        AstPath path = nodeLocator(nodeId);
        if (path.isRoot()) {
            throw new IllegalArgumentException("The root state has no key to rename");
        }
        JsAst.PropertyAssignment property = AstPaths.resolveProperty(config, path)
            .orElseThrow(() -> new IllegalStateException("No state property at " + path + " for node " + nodeId));
        changes.replacePropertyName(property, value.asText());
    }

    /**
     * Writes, rewrites or removes (null value) a property of a state literal.
     */
    private void setStateProperty(String nodeId, String key, CodeElement value,
                                  InsertionPriority priority, boolean beforeStates) {
        PropertyElement added = addedNodes.get(nodeId);
        if (added != null) {
            ObjectElement state = (ObjectElement) added.value();
            if (value == null) {
                state.remove(key);
            } else {
                state.find(key).ifPresentOrElse(
                    property -> property.setValue(value),
                    () -> state.insert(CodeElements.property(key, value), priority));
            }
            return;
        }

        JsAst.ObjectLiteral state = sourceState(nodeId);
        Optional<JsAst.PropertyAssignment> existing = PropertyKeys.findFirst(state, key);
        Optional<PropertyElement> pending = changes.pendingProperty(state, key);
        if (value == null) {
            existing.ifPresent(property -> changes.removeProperty(state, property));
            pending.ifPresent(changes::discard);
            return;
        }
        if (existing.isPresent()) {
            // a removal earlier in the batch is overridden by the new value
            changes.restoreProperty(state, existing.get());
            changes.replaceRange(existing.get().value().range(), value);
            return;
        }
        if (pending.isPresent()) {
            pending.get().setValue(value);
            return;
        }
        Optional<JsAst.PropertyAssignment> states = beforeStates ? PropertyKeys.findFirst(state, STATES) : Optional.empty();
        if (states.isPresent()) {
            changes.insertPropertyBeforeProperty(state, states.get(), key, value);
        } else {
            changes.insertPropertyIntoObject(ObjectTarget.source(state), key, value, priority);
        }
    }

    private void removeNode(String nodeId) {
        PropertyElement added = addedNodes.remove(nodeId);
        if (added != null) {
            changes.discard(added);
            return;
        }
        AstPath path = nodeLocator(nodeId);
        if (path.isRoot()) {
            throw new IllegalArgumentException("The root state cannot be removed");
        }
        removeAt(path, "node " + nodeId);
    }

    private void removeEdge(String edgeId) {
        if (addedEdges.contains(edgeId)) {
            throw new UnsupportedOperationException("A transition added in the same batch cannot be removed: " + edgeId);
        }
        AstPath path = locators.edges().get(edgeId);
        if (path == null) {
            throw new IllegalStateException("No source location for edge " + edgeId);
        }
        removeAt(path, "edge " + edgeId);
    }

    /**
     * Removes the object member or array element a locator ends in.
     */
    private void removeAt(AstPath path, String what) {
        AstPathStep last = path.last();
        JsAst.Expression container = AstPaths.resolve(config, path.parent())
            .orElseThrow(() -> new IllegalStateException("Source no longer contains " + what + " at " + path));
        if (last.kind() == AstPathStep.Kind.ELEMENT && container instanceof JsAst.ArrayLiteral array) {
            changes.removeElement(array, last.index());
            return;
        }
        JsAst.PropertyAssignment property = AstPaths.resolveProperty(config, path)
            .orElseThrow(() -> new IllegalStateException("Source no longer contains " + what + " at " + path));
        changes.removeProperty((JsAst.ObjectLiteral) container, property);
    }

    private ObjectTarget stateTarget(String nodeId) {
        PropertyElement added = addedNodes.get(nodeId);
        if (added != null) {
            return ObjectTarget.pending((ObjectElement) added.value());
        }
        return ObjectTarget.source(sourceState(nodeId));
    }

    private JsAst.ObjectLiteral sourceState(String nodeId) {
        AstPath path = nodeLocator(nodeId);
        return AstPaths.resolve(config, path)
            .filter(JsAst.ObjectLiteral.class::isInstance)
            .map(JsAst.ObjectLiteral.class::cast)
            .orElseThrow(() -> new IllegalStateException("No state literal at " + path + " for node " + nodeId));
    }

    private AstPath nodeLocator(String nodeId) {
        AstPath path = locators.nodes().get(nodeId);
        if (path == null) {
            throw new IllegalStateException("No source location for node " + nodeId);
        }
        return path;
    }
}
