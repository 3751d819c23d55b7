package com.machinebridge.core.extraction;

import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.model.ExtractionErrorType;

import java.util.List;
import java.util.Optional;

/**
 * Static property-key evaluation and lookup over object literals.
 */
public final class PropertyKeys {

    static final String COMPUTED = "computed";
    static final String PRIVATE = "private";

    private PropertyKeys() {
        // Utility class - no instantiation
    }

    /**
     * Returns the static key of a property name without reporting errors.
     *
     * @param name property name
     * @return key, or empty for computed non-literal and private names
     */
    public static Optional<String> staticKey(JsAst.PropertyName name) {
        return Optional.ofNullable(evaluate(null, name));
    }

    /**
     * Returns the static key of a property name, reporting unsupported names to the context.
     */
    static Optional<String> key(ExtractionContext ctx, JsAst.PropertyName name) {
        return Optional.ofNullable(evaluate(ctx, name));
    }

    /**
     * Finds a property by key. When the key is repeated the last occurrence wins, as at runtime.
     *
     * @param object object literal
     * @param key property key
     * @return the property, if present
     */
    public static Optional<JsAst.PropertyAssignment> findLast(JsAst.ObjectLiteral object, String key) {
        List<JsAst.Member> members = object.members();
        for (int i = members.size() - 1; i >= 0; i--) {
            if (members.get(i) instanceof JsAst.PropertyAssignment property
                && staticKey(property.name()).filter(key::equals).isPresent()) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first property with the given key, the occurrence extraction reads for state
     * literals.
     *
     * @param object object literal
     * @param key property key
     * @return the property, if present
     */
    public static Optional<JsAst.PropertyAssignment> findFirst(JsAst.ObjectLiteral object, String key) {
        for (JsAst.Member member : object.members()) {
            if (member instanceof JsAst.PropertyAssignment property
                && staticKey(property.name()).filter(key::equals).isPresent()) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    private static String evaluate(ExtractionContext ctx, JsAst.PropertyName name) {
        if (name instanceof JsAst.Identifier identifier) {
            return identifier.name();
        }
        if (name instanceof JsAst.StringLiteral string) {
            return string.value();
        }
        if (name instanceof JsAst.NumericLiteral number) {
            return numericKey(ctx, number);
        }
        if (name instanceof JsAst.ComputedPropertyName computed) {
            JsAst.Expression expression = computed.expression();
            if (expression instanceof JsAst.StringLike string) {
                return string.value();
            }
            if (expression instanceof JsAst.NumericLiteral number) {
                return numericKey(ctx, number);
            }
            report(ctx, COMPUTED);
            return null;
        }
        if (name instanceof JsAst.PrivateName) {
            report(ctx, PRIVATE);
            return null;
        }
        return null;
    }

    /**
     * Numeric keys keep their source text; a text that differs from the runtime key (e.g.
     * {@code 0x10} for {@code "16"}) is reported.
     */
    private static String numericKey(ExtractionContext ctx, JsAst.NumericLiteral number) {
        Double value = JsNumbers.parse(number.raw());
        if (ctx != null && (value == null || !JsNumbers.toJsString(value).equals(number.raw()))) {
            ctx.error(ExtractionErrorType.PROPERTY_KEY_NO_ROUNDTRIP);
        }
        return number.raw();
    }

    private static void report(ExtractionContext ctx, String kind) {
        if (ctx != null) {
            ctx.error(ExtractionErrorType.PROPERTY_KEY_UNHANDLED, kind);
        }
    }
}
