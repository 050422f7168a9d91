/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layered merge over JSON-like policy trees.
 *
 * <p>Maps merge recursively; any other value from the overlay (scalar or list) replaces
 * the base value outright. Lists never append. Inputs are never modified.
 */
public final class DeepMerge {

    private DeepMerge() {
    }

    public static Map<String, Object> merge(Map<String, Object> base, Map<String, ?> overlay) {
        return merge(base, overlay, Set.of());
    }

    /**
     * Merges {@code overlay} over {@code base}, ignoring the top-level overlay keys in
     * {@code skipKeys} (e.g. nested {@code counties} or {@code fields} maps that are
     * resolved separately).
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, ?> overlay, Set<String> skipKeys) {
        Map<String, Object> result = copy(base);
        if (overlay == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : overlay.entrySet()) {
            if (skipKeys.contains(entry.getKey())) {
                continue;
            }
            Object existing = result.get(entry.getKey());
            Object incoming = entry.getValue();
            if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
                result.put(entry.getKey(), merge((Map<String, Object>) existingMap, (Map<String, Object>) incomingMap, Set.of()));
            } else {
                result.put(entry.getKey(), copyValue(incoming));
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> copy(Map<String, ?> tree) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (tree != null) {
            for (Map.Entry<String, ?> entry : tree.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copy((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            for (Object item : items) {
                list.add(copyValue(item));
            }
            return list;
        }
        return value;
    }
}
