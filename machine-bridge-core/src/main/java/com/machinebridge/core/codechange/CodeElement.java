package com.machinebridge.core.codechange;

import java.util.Objects;

/**
 * A piece of JavaScript literal code to be written into a source file.
 *
 * <p>Scalars are immutable records. {@link ObjectElement}, {@link ArrayElement} and
 * {@link PropertyElement} stay mutable until the edits of a batch are rendered, so that later
 * patches of the same batch can extend code that earlier patches created.
 *
 * @see CodeElements
 */
public interface CodeElement {

    /**
     * String literal.
     *
     * @param value string value
     * @param allowMultiline whether a value containing line breaks may be written as a template literal
     */
    record StringElement(String value, boolean allowMultiline) implements CodeElement {
        public StringElement {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * {@code true} or {@code false}.
     */
    record BooleanElement(boolean value) implements CodeElement {
    }

    /**
     * {@code undefined}.
     */
    record UndefinedElement() implements CodeElement {
    }

    /**
     * Code copied verbatim, typically an existing expression that gets wrapped.
     *
     * @param text source text
     */
    record RawElement(String text) implements CodeElement {
        public RawElement {
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}
