/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import java.util.Locale;

/**
 * Fuzzy field-name matching.
 *
 * <p>Names are compared after lower-casing, dropping parentheticals, unifying dash
 * variants and collapsing whitespace. Two names match when either contains the other,
 * or when their letter/digit skeletons are equal ("Spraberry (Trend Area)" matches
 * "spraberry-trend area").
 */
public final class FieldNames {

    private FieldNames() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT)
            .replaceAll("\\([^)]*\\)", " ")
            .replaceAll("[\\u2010\\u2011\\u2012\\u2013\\u2014\\u2015\\u2212]", "-")
            .replaceAll("\\s*-\\s*", "-")
            .replaceAll("\\s+", " ")
            .trim();
    }

    /**
     * Letters and digits only.
     */
    public static String skeleton(String name) {
        return normalize(name).replaceAll("[^a-z0-9]", "");
    }

    public static boolean sameName(String a, String b) {
        String na = normalize(a);
        return !na.isEmpty() && na.equals(normalize(b));
    }

    public static boolean matches(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) {
            return false;
        }
        if (na.contains(nb) || nb.contains(na)) {
            return true;
        }
        String sa = skeleton(a);
        return !sa.isEmpty() && sa.equals(skeleton(b));
    }
}
