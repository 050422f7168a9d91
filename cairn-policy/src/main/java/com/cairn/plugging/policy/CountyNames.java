/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * County name normalization and alias lookup.
 */
public final class CountyNames {

    private static final String SUFFIX = " county";

    private CountyNames() {
    }

    /**
     * Lower-cased, whitespace-collapsed name without a trailing " county".
     */
    public static String normalize(String county) {
        if (county == null) {
            return null;
        }
        String name = county.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replaceAll("\\s+", " ");
        if (name.endsWith(SUFFIX)) {
            name = name.substring(0, name.length() - SUFFIX.length()).trim();
        }
        return name.isEmpty() ? null : name;
    }

    /**
     * File-name form used in {@code {district}__{county}.yml}: spaces become underscores.
     */
    public static String fileKey(String county) {
        String name = normalize(county);
        return name == null ? null : name.replace(' ', '_');
    }

    /**
     * Spellings under which a county may be keyed in an overlay: as given, with and
     * without the " County" suffix.
     */
    public static List<String> aliases(String county) {
        List<String> aliases = new ArrayList<>();
        String trimmed = county.trim();
        aliases.add(trimmed);
        String bare = trimmed.replaceAll("(?i)\\s+county$", "");
        if (!aliases.contains(bare)) {
            aliases.add(bare);
        }
        String suffixed = bare + " County";
        if (!aliases.contains(suffixed)) {
            aliases.add(suffixed);
        }
        return aliases;
    }

    /**
     * Finds a county entry by alias, then by case-insensitive normalized name.
     */
    public static <V> V lookup(Map<String, V> byCounty, String county) {
        if (byCounty == null || county == null) {
            return null;
        }
        for (String alias : aliases(county)) {
            V value = byCounty.get(alias);
            if (value != null) {
                return value;
            }
        }
        String target = normalize(county);
        for (Map.Entry<String, V> entry : byCounty.entrySet()) {
            if (target != null && target.equals(normalize(entry.getKey()))) {
                return entry.getValue();
            }
        }
        return null;
    }
}
