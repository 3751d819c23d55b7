package com.machinebridge.core.extraction;

import com.machinebridge.core.ast.JsAst;

import java.util.Optional;

/**
 * Relocates literals in a configuration tree from recorded {@link AstPath}s.
 */
public final class AstPaths {

    private AstPaths() {
        // Utility class - no instantiation
    }

    /**
     * Follows a path from the configuration literal.
     *
     * @param root configuration literal
     * @param path recorded path
     * @return the addressed expression, or empty if the tree no longer has that shape
     */
    public static Optional<JsAst.Expression> resolve(JsAst.Expression root, AstPath path) {
        JsAst.Expression current = root;
        for (AstPathStep step : path.steps()) {
            current = next(current, step);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    /**
     * Returns the property assignment addressed by a path ending in a property step.
     *
     * @param root configuration literal
     * @param path recorded path
     * @return the property, or empty if the path does not address one
     */
    public static Optional<JsAst.PropertyAssignment> resolveProperty(JsAst.Expression root, AstPath path) {
        if (path.isRoot() || path.last().kind() != AstPathStep.Kind.PROPERTY) {
            return Optional.empty();
        }
        return resolve(root, path.parent())
            .filter(JsAst.ObjectLiteral.class::isInstance)
            .map(JsAst.ObjectLiteral.class::cast)
            .flatMap(object -> {
                int index = path.last().index();
                if (index >= object.members().size()
                    || !(object.members().get(index) instanceof JsAst.PropertyAssignment property)) {
                    return Optional.empty();
                }
                return Optional.of(property);
            });
    }

    private static JsAst.Expression next(JsAst.Expression current, AstPathStep step) {
        if (step.kind() == AstPathStep.Kind.PROPERTY) {
            if (current instanceof JsAst.ObjectLiteral object
                && step.index() < object.members().size()
                && object.members().get(step.index()) instanceof JsAst.PropertyAssignment property) {
                return property.value();
            }
            return null;
        }
        if (current instanceof JsAst.ArrayLiteral array && step.index() < array.elements().size()) {
            return array.elements().get(step.index());
        }
        return null;
    }
}
