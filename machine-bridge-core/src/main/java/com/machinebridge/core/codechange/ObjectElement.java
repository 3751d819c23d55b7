package com.machinebridge.core.codechange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Object literal to be written, rendered on one line as {@code { a: 1, b: 2 }}.
 */
public final class ObjectElement implements CodeElement {

    private final List<PropertyElement> properties = new ArrayList<>();

    public ObjectElement(List<PropertyElement> initialProperties) {
        initialProperties.forEach(property -> insert(property, null));
    }

    public List<PropertyElement> properties() {
        return Collections.unmodifiableList(properties);
    }

    public Optional<PropertyElement> find(String key) {
        return properties.stream().filter(property -> property.key().equals(key)).findFirst();
    }

    /**
     * Inserts a property at the position its priority calls for.
     *
     * @param property property to insert
     * @param priority insertion priority, or null to append
     */
    public void insert(PropertyElement property, InsertionPriority priority) {
        Objects.requireNonNull(property, "property must not be null");
        List<String> keys = properties.stream().map(PropertyElement::key).toList();
        Anchor anchor = InsertionPriority.anchorFor(keys, priority);
        properties.add(anchor.insertionIndex(properties.size()), property);
    }

    /**
     * Removes the property with the given key.
     *
     * @param key property key
     * @return true if a property was removed
     */
    public boolean remove(String key) {
        return properties.removeIf(property -> property.key().equals(key));
    }

    /**
     * Removes a property from this object or any object nested in it.
     */
    boolean discard(PropertyElement property) {
        if (properties.removeIf(candidate -> candidate == property)) {
            return true;
        }
        for (PropertyElement candidate : properties) {
            if (CodeElements.discardFrom(candidate.value(), property)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ObjectElement" + properties;
    }
}
