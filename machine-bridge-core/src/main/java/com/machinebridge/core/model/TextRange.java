package com.machinebridge.core.model;

/**
 * Half-open character range {@code [start, end)} in UTF-16 offsets of a source text.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record TextRange(int start, int end) {

    /**
     * Compact constructor with validation.
     */
    public TextRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0");
        }
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start");
        }
    }

    /**
     * Creates an empty range at the given offset.
     *
     * @param offset insertion point
     * @return zero-length range
     */
    public static TextRange at(int offset) {
        return new TextRange(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
