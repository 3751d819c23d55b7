package com.machinebridge.core.codechange;

import java.util.stream.Collectors;

/**
 * Renders {@link CodeElement}s as single-line JavaScript.
 */
final class CodeRenderer {

    private final char quote;

    CodeRenderer(char quote) {
        this.quote = quote;
    }

    String render(CodeElement element) {
        if (element instanceof CodeElement.StringElement string) {
            return StringLiterals.literal(string.value(), quote, string.allowMultiline());
        }
        if (element instanceof CodeElement.BooleanElement bool) {
            return Boolean.toString(bool.value());
        }
        if (element instanceof CodeElement.UndefinedElement) {
            return "undefined";
        }
        if (element instanceof CodeElement.RawElement raw) {
            return raw.text();
        }
        if (element instanceof ArrayElement array) {
            return array.elements().stream().map(this::render).collect(Collectors.joining(", ", "[", "]"));
        }
        if (element instanceof ObjectElement object) {
            if (object.properties().isEmpty()) {
                return "{}";
            }
            return object.properties().stream().map(this::render).collect(Collectors.joining(", ", "{ ", " }"));
        }
        if (element instanceof PropertyElement property) {
            return StringLiterals.propertyName(property.key(), quote) + ": " + render(property.value());
        }
        throw new IllegalArgumentException("Unsupported code element: " + element);
    }
}
