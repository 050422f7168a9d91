/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of a sack computation. {@code sacks} is {@code null} when geometry was missing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MaterialsResult(
    @JsonProperty("sacks") Integer sacks,
    @JsonProperty("annular_capacity_bbl_per_ft") Double capacityBblPerFt,
    @JsonProperty("squeeze_bbl") Double squeezeBbl,
    @JsonProperty("cap_bbl") Double capBbl,
    @JsonProperty("total_bbl") Double totalBbl,
    @JsonProperty("ft3") Double ft3,
    @JsonProperty("water_bbl") Double waterBbl,
    @JsonProperty("explain") Map<String, Object> explain
) implements Serializable {

    public MaterialsResult {
        explain = explain == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(explain));
    }

    public static MaterialsResult missingGeometry(String reason) {
        Map<String, Object> explain = new LinkedHashMap<>();
        explain.put("missing", reason);
        return new MaterialsResult(null, null, null, null, null, null, null, explain);
    }

    @JsonIgnore
    public boolean isComputed() {
        return sacks != null;
    }
}
