package com.machinebridge.core.codechange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Array literal to be written, rendered as {@code [a, b]}.
 */
public final class ArrayElement implements CodeElement {

    private final List<CodeElement> elements = new ArrayList<>();

    public ArrayElement(List<? extends CodeElement> initialElements) {
        initialElements.forEach(this::add);
    }

    public List<CodeElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    public void add(CodeElement element) {
        elements.add(Objects.requireNonNull(element, "element must not be null"));
    }

    @Override
    public String toString() {
        return "ArrayElement" + elements;
    }
}
