package com.machinebridge.core.codechange;

import java.util.Objects;

/**
 * A {@code key: value} member of an {@link ObjectElement}.
 */
public final class PropertyElement implements CodeElement {

    private String key;
    private CodeElement value;

    public PropertyElement(String key, CodeElement value) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String key() {
        return key;
    }

    public CodeElement value() {
        return value;
    }

    /**
     * Renames the property before it is written.
     *
     * @param key new key
     */
    public void rename(String key) {
        this.key = Objects.requireNonNull(key, "key must not be null");
    }

    public void setValue(CodeElement value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String toString() {
        return "PropertyElement{key='" + key + "', value=" + value + '}';
    }
}
