package com.machinebridge.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.model.ActionBlock;
import com.machinebridge.core.model.ActorBlock;
import com.machinebridge.core.model.EventTypeData;
import com.machinebridge.core.model.ExtractionErrorType;
import com.machinebridge.core.model.HistoryType;
import com.machinebridge.core.model.MetaEntry;
import com.machinebridge.core.model.NodeType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts state literals into nodes, recursing through {@code states}.
 *
 * <p>Properties are visited in reverse declaration order. When a key is repeated only its
 * first declaration is read; later duplicates are ignored without an error. A property that
 * cannot be read reports a soft error and is skipped; the rest of the state is still
 * extracted.
 */
final class StateExtractor {

    static final String ROOT_KEY = "(machine)";
    static final String WILDCARD_EVENT = "*";

    private final BlockExtractor blockExtractor = new BlockExtractor();
    private final TransitionExtractor transitionExtractor = new TransitionExtractor(blockExtractor);

    /**
     * Extracts a state and its descendants.
     *
     * @param ctx extraction context, positioned at the state literal
     * @param state state literal, or null for a call without configuration
     * @param parentId parent node id, null for the root
     * @param key state key
     * @return tree node of the extracted state
     */
    TreeNode extractState(ExtractionContext ctx, JsAst.Expression state, String parentId, String key) {
        NodeBuilder node = ctx.addNode(parentId, key);
        TreeNode treeNode = ctx.treeNodes.get(node.id);

        if (state == null) {
            return treeNode;
        }
        if (!(state instanceof JsAst.ObjectLiteral object)) {
            ctx.error(ExtractionErrorType.STATE_UNHANDLED);
            return treeNode;
        }

        List<JsAst.Member> members = object.members();
        Map<String, Integer> firstIndex = firstDeclarations(members);
        for (int i = members.size() - 1; i >= 0; i--) {
            JsAst.Member member = members.get(i);
            if (!(member instanceof JsAst.PropertyAssignment property)) {
                ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
                continue;
            }
            Optional<String> propertyKey = PropertyKeys.key(ctx, property.name());
            if (propertyKey.isEmpty()) {
                ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
                continue;
            }
            if (firstIndex.get(propertyKey.get()) != i) {
                continue;
            }
            ctx.inStep(AstPathStep.property(i), () -> extractProperty(ctx, node, treeNode, propertyKey.get(), property.value()));
        }
        return treeNode;
    }

    private static Map<String, Integer> firstDeclarations(List<JsAst.Member> members) {
        Map<String, Integer> firstIndex = new HashMap<>();
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i) instanceof JsAst.PropertyAssignment property) {
                int index = i;
                PropertyKeys.staticKey(property.name()).ifPresent(key -> firstIndex.putIfAbsent(key, index));
            }
        }
        return firstIndex;
    }

    private void extractProperty(ExtractionContext ctx, NodeBuilder node, TreeNode treeNode,
                                 String key, JsAst.Expression value) {
        switch (key) {
            case "id" -> {
                if (value instanceof JsAst.StringLike string) {
                    ctx.declaredIds.put(string.value(), node.id);
                }
            }
            case "context" -> extractContext(ctx, node, value);
            case "always" -> transitionExtractor.extractGroup(ctx, value, node.id, new EventTypeData.Always());
            case "onDone" -> transitionExtractor.extractGroup(ctx, value, node.id, new EventTypeData.StateDone());
            case "on" -> extractOn(ctx, node, value);
            case "states" -> extractChildren(ctx, node, treeNode, value);
            case "initial" -> {
                if (value instanceof JsAst.StringLike string) {
                    node.initial = string.value();
                } else if (!Literals.isUndefined(value)) {
                    ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
                }
            }
            case "type" -> extractType(ctx, node, value);
            case "history" -> extractHistory(ctx, node, value);
            case "description" -> {
                if (value instanceof JsAst.StringLike string) {
                    node.description = string.value();
                } else if (!Literals.isUndefined(value)) {
                    ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
                }
            }
            case "meta" -> extractMeta(ctx, node, value);
            case "tags" -> extractTags(ctx, node, value);
            case "entry" -> extractActions(ctx, node, value, node.entry);
            case "exit" -> extractActions(ctx, node, value, node.exit);
            case "invoke" -> extractInvoke(ctx, node, value);
            default -> {
                // other state properties carry no structure
            }
        }
    }

    private void extractContext(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value) {
        if (node.parentId != null) {
            ctx.error(ExtractionErrorType.STATE_PROPERTY_INVALID);
            return;
        }
        if (value instanceof JsAst.ObjectLiteral object) {
            Optional<? extends JsonNode> json = JsonValues.toJsonObject(ctx, object);
            if (json.isPresent()) {
                ctx.context = json.get();
            } else {
                ctx.error(ExtractionErrorType.PROPERTY_UNHANDLED);
            }
            return;
        }
        if (value instanceof JsAst.FunctionExpression function) {
            ctx.context = JsonNodeFactory.instance.textNode("{{" + function.text() + "}}");
            return;
        }
        ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
    }

    private void extractOn(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value) {
        if (!(value instanceof JsAst.ObjectLiteral object)) {
            ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
            return;
        }
        List<JsAst.Member> members = object.members();
        for (int i = 0; i < members.size(); i++) {
            if (!(members.get(i) instanceof JsAst.PropertyAssignment transition)) {
                ctx.error(ExtractionErrorType.TRANSITION_PROPERTY_UNHANDLED);
                continue;
            }
            Optional<String> event = PropertyKeys.key(ctx, transition.name());
            if (event.isEmpty()) {
                ctx.error(ExtractionErrorType.TRANSITION_PROPERTY_UNHANDLED);
                continue;
            }
            EventTypeData eventTypeData = WILDCARD_EVENT.equals(event.get())
                ? new EventTypeData.Wildcard()
                : new EventTypeData.Named(event.get());
            ctx.inStep(AstPathStep.property(i),
                () -> transitionExtractor.extractGroup(ctx, transition.value(), node.id, eventTypeData));
        }
    }

    private void extractChildren(ExtractionContext ctx, NodeBuilder node, TreeNode treeNode, JsAst.Expression value) {
        if (!(value instanceof JsAst.ObjectLiteral object)) {
            ctx.error(ExtractionErrorType.STATE_UNHANDLED);
            return;
        }
        List<JsAst.Member> members = object.members();
        for (int i = 0; i < members.size(); i++) {
            if (!(members.get(i) instanceof JsAst.PropertyAssignment child)) {
                ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
                continue;
            }
            Optional<String> childKey = PropertyKeys.key(ctx, child.name());
            if (childKey.isEmpty() || treeNode.hasChild(childKey.get())) {
                continue;
            }
            TreeNode childNode = ctx.withStep(AstPathStep.property(i),
                () -> extractState(ctx, child.value(), node.id, childKey.get()));
            treeNode.addChild(childKey.get(), childNode);
        }
    }

    private void extractType(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value) {
        if (value instanceof JsAst.StringLike string) {
            switch (string.value()) {
                case "history", "parallel", "final" -> node.type = NodeType.fromCode(string.value());
                case "atomic", "compound" -> node.type = NodeType.NORMAL;
                default -> ctx.error(ExtractionErrorType.STATE_TYPE_INVALID);
            }
            return;
        }
        if (!Literals.isUndefined(value)) {
            ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
        }
    }

    private void extractHistory(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value) {
        if (value instanceof JsAst.StringLike string) {
            switch (string.value()) {
                case "shallow" -> node.history = HistoryType.SHALLOW;
                case "deep" -> node.history = HistoryType.DEEP;
                default -> ctx.error(ExtractionErrorType.STATE_HISTORY_INVALID);
            }
            return;
        }
        if (value instanceof JsAst.BooleanLiteral bool) {
            // legacy boolean form
            node.history = bool.value() ? HistoryType.DEEP : HistoryType.SHALLOW;
            return;
        }
        if (!Literals.isUndefined(value)) {
            ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
        }
    }

    private void extractMeta(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value) {
        if (value instanceof JsAst.ObjectLiteral object) {
            for (JsAst.Member member : object.members()) {
                if (!(member instanceof JsAst.PropertyAssignment property)) {
                    ctx.error(ExtractionErrorType.PROPERTY_UNHANDLED);
                    continue;
                }
                Optional<String> metaKey = PropertyKeys.key(ctx, property.name());
                if (metaKey.isEmpty()) {
                    continue;
                }
                Optional<JsonNode> json = JsonValues.toJson(ctx, property.value());
                if (json.isEmpty()) {
                    ctx.error(ExtractionErrorType.PROPERTY_UNHANDLED);
                    continue;
                }
                node.metaEntries.add(new MetaEntry(metaKey.get(), json.get()));
            }
            return;
        }
        if (!Literals.isUndefined(value)) {
            ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
        }
    }

    private void extractTags(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value) {
        if (Literals.isUndefined(value)) {
            return;
        }
        List<String> tags = new ArrayList<>();
        List<JsAst.Expression> elements = value instanceof JsAst.ArrayLiteral array ? array.elements() : List.of(value);
        for (JsAst.Expression element : elements) {
            if (!(element instanceof JsAst.StringLike string)) {
                ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
                return;
            }
            tags.add(string.value());
        }
        node.tags.addAll(tags);
    }

    private void extractActions(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value, List<String> owner) {
        Optional<List<ActionBlock>> blocks = blockExtractor.extractActions(ctx, value, node.id);
        if (blocks.isEmpty()) {
            ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
            return;
        }
        blocks.get().forEach(block -> ctx.registerAction(block, owner));
    }

    private void extractInvoke(ExtractionContext ctx, NodeBuilder node, JsAst.Expression value) {
        List<ActorBlock> actors = Literals.mapMaybeArray(ctx, value,
            (element, index) -> blockExtractor.extractActor(ctx, element, node.id));
        if (!Literals.allPresent(actors)) {
            ctx.error(ExtractionErrorType.STATE_PROPERTY_UNHANDLED);
            return;
        }
        for (ActorBlock actor : actors) {
            ctx.registerActor(actor, node.invoke);
        }
        // done/error transitions are keyed by the registered actor block ids
        Literals.mapMaybeArray(ctx, value, (element, index) -> {
            if (element instanceof JsAst.ObjectLiteral invoke) {
                transitionExtractor.extractInvokeTransitions(ctx, invoke, node.id, actors.get(index).id());
            }
            return index;
        });
    }
}
