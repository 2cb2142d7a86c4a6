package com.ivamare.lifecycle.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for metadata maps carried through transitions.
 *
 * <p>Metadata values may be null, so {@link Map#copyOf} is not usable here.
 */
public final class Metadata {

    private Metadata() {
    }

    /**
     * Unmodifiable shallow copy preserving insertion order. Null becomes an empty map.
     */
    public static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Merge {@code extra} over {@code base}. Keys from {@code extra} win;
     * every other entry of {@code base} is retained.
     */
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return copyOf(base);
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        merged.putAll(extra);
        return Collections.unmodifiableMap(merged);
    }
}
