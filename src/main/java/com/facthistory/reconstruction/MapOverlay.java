package com.facthistory.reconstruction;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map overlay primitives used to fold deltas into snapshots.
 * None of the methods mutate their arguments.
 */
public final class MapOverlay {

    private MapOverlay() {
    }

    /**
     * Returns a new map holding every entry of {@code base}, with the entries of
     * {@code overlay} replacing or adding to them. Iteration order follows
     * {@code base}, then keys new in {@code overlay}.
     */
    public static <K, V> Map<K, V> mergeInto(Map<K, V> base, Map<K, V> overlay) {
        Map<K, V> merged = new LinkedHashMap<>(base);
        merged.putAll(overlay);
        return merged;
    }

    /** Returns a copy of {@code map} without the given keys. */
    public static <K, V> Map<K, V> withoutKeys(Map<K, V> map, Collection<K> keys) {
        Map<K, V> result = new LinkedHashMap<>(map);
        result.keySet().removeAll(keys);
        return result;
    }
}
