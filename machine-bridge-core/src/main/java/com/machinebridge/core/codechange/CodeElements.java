package com.machinebridge.core.codechange;

import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for {@link CodeElement}s.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeElement transition = CodeElements.object(
 *     CodeElements.property("target", CodeElements.string("b")),
 *     CodeElements.property("reenter", CodeElements.bool(true)));
 * }</pre>
 */
public final class CodeElements {

    private CodeElements() {
        // Utility class - no instantiation
    }

    public static CodeElement string(String value) {
        return new CodeElement.StringElement(value, false);
    }

    /**
     * String that is written as a template literal when it spans several lines.
     */
    public static CodeElement multilineString(String value) {
        return new CodeElement.StringElement(value, true);
    }

    public static CodeElement bool(boolean value) {
        return new CodeElement.BooleanElement(value);
    }

    public static CodeElement undefined() {
        return new CodeElement.UndefinedElement();
    }

    public static CodeElement raw(String text) {
        return new CodeElement.RawElement(text);
    }

    public static ArrayElement array(CodeElement... elements) {
        return new ArrayElement(Arrays.asList(elements));
    }

    public static ArrayElement array(List<? extends CodeElement> elements) {
        return new ArrayElement(elements);
    }

    public static ObjectElement object(PropertyElement... properties) {
        return new ObjectElement(Arrays.asList(properties));
    }

    public static PropertyElement property(String key, CodeElement value) {
        return new PropertyElement(key, value);
    }

    static boolean discardFrom(CodeElement container, PropertyElement property) {
        if (container instanceof ObjectElement object) {
            return object.discard(property);
        }
        if (container instanceof ArrayElement array) {
            for (CodeElement element : array.elements()) {
                if (discardFrom(element, property)) {
                    return true;
                }
            }
        }
        return false;
    }
}
