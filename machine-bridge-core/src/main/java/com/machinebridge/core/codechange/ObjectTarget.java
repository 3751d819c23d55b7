package com.machinebridge.core.codechange;

import com.machinebridge.core.ast.JsAst;

import java.util.Objects;

/**
 * An object literal that properties can be inserted into: either one that exists in the source,
 * or one that an earlier change of the same batch is about to write.
 */
public interface ObjectTarget {

    static ObjectTarget source(JsAst.ObjectLiteral literal) {
        return new SourceObject(literal, false);
    }

    /**
     * An object literal that is an array entry, such as an {@code invoke} entry, whose repeated
     * keys resolve to their last occurrence.
     */
    static ObjectTarget sourceEntry(JsAst.ObjectLiteral literal) {
        return new SourceObject(literal, true);
    }

    static ObjectTarget pending(ObjectElement element) {
        return new PendingObject(element);
    }

    /**
     * Object literal present in the source text.
     *
     * @param literal the literal
     * @param lastKeyWins whether a repeated key means its last occurrence rather than its first
     */
    record SourceObject(JsAst.ObjectLiteral literal, boolean lastKeyWins) implements ObjectTarget {
        public SourceObject {
            Objects.requireNonNull(literal, "literal must not be null");
        }
    }

    /**
     * Object literal created by this batch and not written yet.
     */
    record PendingObject(ObjectElement element) implements ObjectTarget {
        public PendingObject {
            Objects.requireNonNull(element, "element must not be null");
        }
    }
}
