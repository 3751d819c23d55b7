package com.machinebridge.core.extraction;

import com.machinebridge.core.ast.JsAst;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Small predicates and traversal helpers shared by the extractors.
 */
final class Literals {

    private Literals() {
        // Utility class - no instantiation
    }

    static boolean isUndefined(JsAst.Expression expression) {
        return expression instanceof JsAst.Identifier identifier && identifier.isUndefined();
    }

    /**
     * {@code undefined} or {@code null}, both meaning "no target".
     */
    static boolean isNoTarget(JsAst.Expression expression) {
        return isUndefined(expression) || expression instanceof JsAst.NullLiteral;
    }

    /**
     * Maps an expression that is either a single value or an array of values. Array elements
     * are visited with their element step on the context path.
     */
    static <T> List<T> mapMaybeArray(ExtractionContext ctx, JsAst.Expression expression,
                                     BiFunction<JsAst.Expression, Integer, T> mapper) {
        List<T> mapped = new ArrayList<>();
        if (expression instanceof JsAst.ArrayLiteral array) {
            for (int i = 0; i < array.elements().size(); i++) {
                JsAst.Expression element = array.elements().get(i);
                int index = i;
                mapped.add(ctx.withStep(AstPathStep.element(i), () -> mapper.apply(element, index)));
            }
        } else {
            mapped.add(mapper.apply(expression, 0));
        }
        return mapped;
    }

    static boolean allPresent(List<?> values) {
        return values.stream().allMatch(value -> value != null);
    }
}
