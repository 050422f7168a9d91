/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import java.util.Collection;
import java.util.Map;

/**
 * Depth-first walk over a JSON-like policy tree (maps, lists and scalars).
 */
public final class ConfigTreeWalker {

    /**
     * Receives every map key and every scalar value. Returning {@code true} stops the walk.
     */
    public interface Visitor {
        boolean visitKey(String key);

        boolean visitScalar(Object value);
    }

    private ConfigTreeWalker() {
    }

    /**
     * @return true if the visitor stopped the walk early
     */
    public static boolean walk(Object node, Visitor visitor) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (visitor.visitKey(String.valueOf(entry.getKey())) || walk(entry.getValue(), visitor)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof Collection<?> items) {
            for (Object item : items) {
                if (walk(item, visitor)) {
                    return true;
                }
            }
            return false;
        }
        return node != null && visitor.visitScalar(node);
    }

    /**
     * True when a field name appears anywhere in the tree, as a key or inside a string value.
     */
    public static boolean mentions(Object tree, String fieldName) {
        String needle = FieldNames.normalize(fieldName);
        if (needle.isEmpty()) {
            return false;
        }
        return walk(tree, new Visitor() {
            @Override
            public boolean visitKey(String key) {
                return FieldNames.normalize(key).contains(needle);
            }

            @Override
            public boolean visitScalar(Object value) {
                return value instanceof String text && FieldNames.normalize(text).contains(needle);
            }
        });
    }
}
