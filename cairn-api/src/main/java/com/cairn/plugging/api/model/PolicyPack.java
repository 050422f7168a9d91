/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A versioned base policy document with its inline overlay stubs.
 *
 * <p>Overlay maps are keyed by normalized district code ({@code "08a"}),
 * {@code "{district}__{county}"} and normalized field name respectively. The policy
 * trees stay in their JSON-like form until an effective policy is materialized.
 */
public record PolicyPack(
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("version") String version,
    @JsonProperty("jurisdiction") String jurisdiction,
    @JsonProperty("form") String form,
    @JsonProperty("base") Map<String, Object> base,
    @JsonProperty("district_overlays") Map<String, Map<String, Object>> districtOverlays,
    @JsonProperty("county_overlays") Map<String, Map<String, Object>> countyOverlays,
    @JsonProperty("field_overlays") Map<String, Map<String, Object>> fieldOverlays
) implements Serializable {

    public PolicyPack {
        if (policyId == null || policyId.isBlank()) {
            throw new IllegalArgumentException("policy_id is required");
        }
        if (version == null) version = "0";
        base = freeze(base);
        districtOverlays = freeze(districtOverlays);
        countyOverlays = freeze(countyOverlays);
        fieldOverlays = freeze(fieldOverlays);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
