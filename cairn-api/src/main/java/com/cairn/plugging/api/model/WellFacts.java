/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only typed view over a caller-supplied facts map.
 *
 * <p>Keys are looked up verbatim first. Dotted keys such as {@code kop.kop_md_ft}
 * fall back to walking into the map value of the first segment. Accessors return
 * {@code null} (or an empty collection) when a fact is absent or cannot be coerced;
 * they never throw for bad per-well data.
 */
public final class WellFacts {

    private final Map<String, Fact> facts;

    private WellFacts(Map<String, Fact> facts) {
        this.facts = facts;
    }

    public static WellFacts of(Map<String, Fact> facts) {
        if (facts == null) {
            return new WellFacts(Map.of());
        }
        return new WellFacts(Collections.unmodifiableMap(new LinkedHashMap<>(facts)));
    }

    public Map<String, Fact> asMap() {
        return facts;
    }

    public boolean has(String key) {
        return raw(key) != null;
    }

    /**
     * Returns the raw JSON-like value of a fact, resolving dotted paths.
     */
    public Object raw(String key) {
        Fact fact = facts.get(key);
        if (fact != null) {
            return fact.value();
        }
        int dot = key.indexOf('.');
        if (dot < 0) {
            return null;
        }
        Fact head = facts.get(key.substring(0, dot));
        if (head == null) {
            return null;
        }
        Object current = head.value();
        for (String segment : key.substring(dot + 1).split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    public Double number(String key) {
        return toDouble(raw(key));
    }

    /**
     * Returns the first key among {@code keys} that yields a number.
     */
    public Double firstNumber(String... keys) {
        for (String key : keys) {
            Double value = number(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public String text(String key) {
        Object value = raw(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public boolean flag(String key) {
        return toBoolean(raw(key));
    }

    public List<Object> list(String key) {
        Object value = raw(key);
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        if (value == null) {
            return List.of();
        }
        return List.of(value);
    }

    /**
     * Returns the string entries of a list fact, upper-cased, so that barrier codes
     * like {@code "cibp"} and {@code "CIBP"} compare equal.
     */
    public List<String> codes(String key) {
        List<String> codes = new ArrayList<>();
        for (Object item : list(key)) {
            if (item != null) {
                codes.add(String.valueOf(item).trim().toUpperCase(Locale.ROOT));
            }
        }
        return codes;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        Object value = raw(key);
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap((Map<String, Object>) map);
        }
        return Map.of();
    }

    /**
     * Parses a list of depth intervals. Each entry may be a two-element list
     * {@code [top, bottom]} or a map with {@code top_ft}/{@code bottom_ft}.
     * A bare two-number list is read as a single interval.
     */
    public List<DepthInterval> intervals(String key) {
        Object value = raw(key);
        List<DepthInterval> intervals = new ArrayList<>();
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return intervals;
        }
        if (list.size() == 2 && toDouble(list.get(0)) != null && toDouble(list.get(1)) != null) {
            intervals.add(new DepthInterval(toDouble(list.get(0)), toDouble(list.get(1))));
            return intervals;
        }
        for (Object entry : list) {
            DepthInterval interval = toInterval(entry);
            if (interval != null) {
                intervals.add(interval);
            }
        }
        return intervals;
    }

    public static DepthInterval toInterval(Object entry) {
        if (entry instanceof List<?> pair && pair.size() >= 2) {
            Double top = toDouble(pair.get(0));
            Double bottom = toDouble(pair.get(1));
            return top != null && bottom != null ? new DepthInterval(top, bottom) : null;
        }
        if (entry instanceof Map<?, ?> map) {
            Double top = toDouble(map.get("top_ft"));
            Double bottom = toDouble(map.get("bottom_ft"));
            if (top == null) {
                top = toDouble(map.get("top"));
            }
            if (bottom == null) {
                bottom = toDouble(map.get("bottom"));
            }
            return top != null && bottom != null ? new DepthInterval(top, bottom) : null;
        }
        return null;
    }

    public static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            String trimmed = text.trim().replace(",", "");
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("true") || normalized.equals("yes") || normalized.equals("y") || normalized.equals("1");
        }
        return false;
    }
}
