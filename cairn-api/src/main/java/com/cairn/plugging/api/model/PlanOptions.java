/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Per-call overrides. {@code null} components defer to the policy's preferences.
 */
public record PlanOptions(
    @JsonProperty("merge_adjacent") Boolean mergeAdjacent,
    @JsonProperty("merge_threshold_ft") Double mergeThresholdFt,
    @JsonProperty("merge_types") List<String> mergeTypes
) implements Serializable {

    public static PlanOptions defaults() {
        return new PlanOptions(null, null, null);
    }

    public static PlanOptions mergeWithin(double thresholdFt) {
        return new PlanOptions(true, thresholdFt, null);
    }
}
