package com.machinebridge.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.machinebridge.core.ast.JsAst;

import java.util.Optional;

/**
 * Converts literal expressions to Jackson JSON trees.
 */
final class JsonValues {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;
    private static final double MAX_SAFE_INTEGER = 9007199254740991d;

    private JsonValues() {
        // Utility class - no instantiation
    }

    /**
     * Converts a literal expression to JSON.
     *
     * @return JSON value, or empty when the expression (or any nested value) is not a literal
     */
    static Optional<JsonNode> toJson(ExtractionContext ctx, JsAst.Expression expression) {
        if (expression instanceof JsAst.StringLike string) {
            return Optional.of(FACTORY.textNode(string.value()));
        }
        if (expression instanceof JsAst.NumericLiteral number) {
            Double value = JsNumbers.parse(number.raw());
            return Optional.ofNullable(value).map(JsonValues::numberNode);
        }
        if (expression instanceof JsAst.BooleanLiteral bool) {
            return Optional.of(FACTORY.booleanNode(bool.value()));
        }
        if (expression instanceof JsAst.NullLiteral) {
            return Optional.of(FACTORY.nullNode());
        }
        if (expression instanceof JsAst.ArrayLiteral array) {
            ArrayNode node = FACTORY.arrayNode();
            for (JsAst.Expression element : array.elements()) {
                Optional<JsonNode> value = toJson(ctx, element);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                node.add(value.get());
            }
            return Optional.of(node);
        }
        if (expression instanceof JsAst.ObjectLiteral object) {
            return toJsonObject(ctx, object).map(JsonNode.class::cast);
        }
        return Optional.empty();
    }

    /**
     * Converts an object literal; members other than plain property assignments are skipped.
     */
    static Optional<ObjectNode> toJsonObject(ExtractionContext ctx, JsAst.ObjectLiteral object) {
        ObjectNode node = FACTORY.objectNode();
        for (JsAst.Member member : object.members()) {
            if (!(member instanceof JsAst.PropertyAssignment property)) {
                continue;
            }
            Optional<String> key = PropertyKeys.key(ctx, property.name());
            if (key.isEmpty()) {
                continue;
            }
            Optional<JsonNode> value = toJson(ctx, property.value());
            if (value.isEmpty()) {
                return Optional.empty();
            }
            node.set(key.get(), value.get());
        }
        return Optional.of(node);
    }

    private static JsonNode numberNode(double value) {
        if (value == Math.rint(value) && Math.abs(value) <= MAX_SAFE_INTEGER) {
            return FACTORY.numberNode((long) value);
        }
        return FACTORY.numberNode(value);
    }
}
