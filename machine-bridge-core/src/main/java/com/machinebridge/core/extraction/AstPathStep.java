package com.machinebridge.core.extraction;

/**
 * One step of an {@link AstPath}: the index of an object member or of an array element.
 *
 * @param kind step kind
 * @param index zero-based index
 */
public record AstPathStep(Kind kind, int index) {

    public enum Kind {
        PROPERTY,
        ELEMENT
    }

    public AstPathStep {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    public static AstPathStep property(int index) {
        return new AstPathStep(Kind.PROPERTY, index);
    }

    public static AstPathStep element(int index) {
        return new AstPathStep(Kind.ELEMENT, index);
    }

    @Override
    public String toString() {
        return (kind == Kind.PROPERTY ? "p" : "e") + index;
    }
}
