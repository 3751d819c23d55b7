package com.machinebridge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementation registry keyed by source id, one map per kind.
 *
 * @param actions action implementations
 * @param actors actor implementations
 * @param guards guard implementations
 */
public record Implementations(
    Map<String, Implementation> actions,
    Map<String, Implementation> actors,
    Map<String, Implementation> guards
) {
    /**
     * Compact constructor, keeps insertion order.
     */
    public Implementations {
        actions = ordered(actions);
        actors = ordered(actors);
        guards = ordered(guards);
    }

    public static Implementations empty() {
        return new Implementations(Map.of(), Map.of(), Map.of());
    }

    static <V> Map<String, V> ordered(Map<String, V> map) {
        return map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Map.of();
    }
}
