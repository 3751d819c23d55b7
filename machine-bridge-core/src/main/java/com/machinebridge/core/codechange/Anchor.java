package com.machinebridge.core.codechange;

/**
 * Where a new member goes relative to the existing members of an object or array literal.
 *
 * @param placement placement kind
 * @param index index of the reference member, ignored for {@link Placement#END}
 */
record Anchor(Placement placement, int index) {

    enum Placement {
        BEFORE,
        AFTER,
        END
    }

    static final Anchor END = new Anchor(Placement.END, -1);

    static Anchor before(int index) {
        return new Anchor(Placement.BEFORE, index);
    }

    static Anchor after(int index) {
        return new Anchor(Placement.AFTER, index);
    }

    /**
     * Returns the list index a member inserted at this anchor ends up at.
     */
    int insertionIndex(int size) {
        return switch (placement) {
            case BEFORE -> index;
            case AFTER -> index + 1;
            case END -> size;
        };
    }

    /**
     * Rewrites an end anchor as "after the last member", for lists that have members.
     */
    Anchor normalize(int size) {
        if (placement == Placement.END && size > 0) {
            return after(size - 1);
        }
        return this;
    }
}
