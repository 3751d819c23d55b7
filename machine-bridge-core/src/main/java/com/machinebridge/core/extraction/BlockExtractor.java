package com.machinebridge.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.model.ActionBlock;
import com.machinebridge.core.model.ActionProperties;
import com.machinebridge.core.model.ActorBlock;
import com.machinebridge.core.model.ActorProperties;
import com.machinebridge.core.model.ExtractionErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Extracts action blocks ({@code entry}, {@code exit}, transition {@code actions}) and actor
 * blocks ({@code invoke}).
 *
 * <p>A string, or an object whose {@code type}/{@code src} is a string, references a named
 * implementation. Anything else is an inline implementation and gets a synthetic
 * {@code inline:<id>} source id, and its source text is kept for the implementation registry.
 * An {@code undefined} element makes the whole group invalid.
 */
final class BlockExtractor {

    private static final Logger log = LoggerFactory.getLogger(BlockExtractor.class);

    private static final String TYPE = "type";
    private static final String PARAMS = "params";
    private static final String SRC = "src";
    private static final String ID = "id";

    /**
     * Extracts the action blocks of an action group without registering them.
     *
     * @param ctx extraction context
     * @param expression single action or array of actions
     * @param parentId owning node or edge id
     * @return the blocks, or empty when an element is invalid
     */
    Optional<List<ActionBlock>> extractActions(ExtractionContext ctx, JsAst.Expression expression, String parentId) {
        List<ActionBlock> blocks = Literals.mapMaybeArray(ctx, expression,
            (element, index) -> extractAction(ctx, element, parentId));
        return Literals.allPresent(blocks) ? Optional.of(blocks) : Optional.empty();
    }

    private ActionBlock extractAction(ExtractionContext ctx, JsAst.Expression element, String parentId) {
        if (Literals.isUndefined(element)) {
            return null;
        }
        String blockId = ctx.newId("action");
        if (element instanceof JsAst.StringLike string) {
            return new ActionBlock(blockId, parentId, string.value(), new ActionProperties(string.value(), null));
        }
        if (element instanceof JsAst.ObjectLiteral object) {
            Optional<JsAst.PropertyAssignment> type = PropertyKeys.findLast(object, TYPE);
            if (type.isPresent() && type.get().value() instanceof JsAst.StringLike string) {
                JsonNode params = PropertyKeys.findLast(object, PARAMS)
                    .flatMap(property -> JsonValues.toJson(ctx, property.value()))
                    .orElse(null);
                return new ActionBlock(blockId, parentId, string.value(), new ActionProperties(string.value(), params));
            }
            if (type.isPresent()) {
                ctx.error(ExtractionErrorType.ACTION_UNHANDLED);
            }
        }
        String sourceId = ctx.newInlineSourceId("action", element);
        log.debug("Inline action {} at {}", sourceId, ctx.currentPath());
        return new ActionBlock(blockId, parentId, sourceId, new ActionProperties(sourceId, null));
    }

    /**
     * Extracts one actor block of an {@code invoke} group.
     *
     * @param ctx extraction context
     * @param element invoke element
     * @param nodeId owning node id
     * @return the block, or null when the element is invalid
     */
    ActorBlock extractActor(ExtractionContext ctx, JsAst.Expression element, String nodeId) {
        if (Literals.isUndefined(element)) {
            return null;
        }
        String blockId = ctx.newId("actor");
        String sourceId = null;
        String actorId = null;
        JsAst.Expression implementation = element;
        if (element instanceof JsAst.ObjectLiteral object) {
            sourceId = stringProperty(object, SRC);
            actorId = stringProperty(object, ID);
            implementation = PropertyKeys.findLast(object, SRC).map(JsAst.PropertyAssignment::value).orElse(null);
        }
        if (sourceId == null) {
            sourceId = implementation != null
                ? ctx.newInlineSourceId("actor", implementation)
                : ctx.newInlineSourceId("actor");
        }
        if (actorId == null) {
            actorId = ctx.newInlineSourceId("actor-id");
        }
        return new ActorBlock(blockId, nodeId, sourceId, new ActorProperties(sourceId, actorId));
    }

    private static String stringProperty(JsAst.ObjectLiteral object, String key) {
        return PropertyKeys.findLast(object, key)
            .map(JsAst.PropertyAssignment::value)
            .filter(JsAst.StringLike.class::isInstance)
            .map(value -> ((JsAst.StringLike) value).value())
            .orElse(null);
    }
}
