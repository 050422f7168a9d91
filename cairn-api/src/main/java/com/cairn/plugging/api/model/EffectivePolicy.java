/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of resolving a policy pack for one jurisdiction. Built per request.
 *
 * @param base the unmerged base policy
 * @param effective base merged with district, county and field overlays
 * @param complete true iff every required knob is present after merge
 * @param incompleteReasons dotted paths of missing knobs, e.g. {@code effective.requirements.tag_wait_hours [district:08a]}
 * @param knobs typed view of {@code effective}
 */
public record EffectivePolicy(
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("version") String version,
    @JsonProperty("jurisdiction") String jurisdiction,
    @JsonProperty("base") Map<String, Object> base,
    @JsonProperty("effective") Map<String, Object> effective,
    @JsonProperty("district") String district,
    @JsonProperty("county") String county,
    @JsonProperty("field") String field,
    @JsonProperty("field_resolution") FieldResolution fieldResolution,
    @JsonProperty("complete") boolean complete,
    @JsonProperty("incomplete_reasons") List<String> incompleteReasons,
    @JsonProperty("knobs") PolicyKnobs knobs
) {

    public EffectivePolicy {
        base = base == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(base));
        effective = effective == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(effective));
        incompleteReasons = incompleteReasons == null ? List.of() : List.copyOf(incompleteReasons);
        if (fieldResolution == null) fieldResolution = FieldResolution.none(field);
    }

    /**
     * Walks a dotted path through the effective policy tree.
     */
    public Object lookup(String dottedPath) {
        Object current = effective;
        for (String segment : dottedPath.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> section(String dottedPath) {
        Object value = lookup(dottedPath);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    public List<?> list(String dottedPath) {
        Object value = lookup(dottedPath);
        return value instanceof List<?> items ? items : List.of();
    }
}
