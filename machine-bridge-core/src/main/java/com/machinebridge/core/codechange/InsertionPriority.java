package com.machinebridge.core.codechange;

import java.util.List;

/**
 * Canonical order of state properties when a property is newly inserted.
 *
 * <p>Higher ranks come first: {@code type}, {@code history}, {@code initial}, every other key,
 * then {@code states}. A new property goes right after the last existing property that outranks
 * it, or else before the first property it outranks, or else at the end.
 */
public enum InsertionPriority {
    STATE_TYPE("type", 4),
    HISTORY("history", 3),
    INITIAL("initial", 2),
    STATES("states", 0);

    private static final int OTHER_RANK = 1;

    private final String key;
    private final int rank;

    InsertionPriority(String key, int rank) {
        this.key = key;
        this.rank = rank;
    }

    public String key() {
        return key;
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns the rank of an existing property key; unknown and non-static keys rank between
     * {@link #INITIAL} and {@link #STATES}.
     *
     * @param key property key, or null for members without a static key
     * @return rank
     */
    public static int rankOf(String key) {
        if (key != null) {
            for (InsertionPriority priority : values()) {
                if (priority.key.equals(key)) {
                    return priority.rank;
                }
            }
        }
        return OTHER_RANK;
    }

    static Anchor anchorFor(List<String> existingKeys, InsertionPriority priority) {
        if (priority == null) {
            return Anchor.END;
        }
        int lastHigher = -1;
        for (int i = 0; i < existingKeys.size(); i++) {
            if (rankOf(existingKeys.get(i)) > priority.rank) {
                lastHigher = i;
            }
        }
        if (lastHigher >= 0) {
            return lastHigher == existingKeys.size() - 1 ? Anchor.END : Anchor.after(lastHigher);
        }
        for (int i = 0; i < existingKeys.size(); i++) {
            if (rankOf(existingKeys.get(i)) < priority.rank) {
                return Anchor.before(i);
            }
        }
        return Anchor.END;
    }
}
