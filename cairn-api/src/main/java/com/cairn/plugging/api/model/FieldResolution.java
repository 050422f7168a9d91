/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Audit record of how the field overlay was chosen.
 */
public record FieldResolution(
    @JsonProperty("requested_field") String requestedField,
    @JsonProperty("method") FieldResolutionMethod method,
    @JsonProperty("matched_field") String matchedField,
    @JsonProperty("matched_in_county") String matchedInCounty,
    @JsonProperty("nearest_distance_km") Double nearestDistanceKm
) implements Serializable {

    public FieldResolution {
        if (method == null) method = FieldResolutionMethod.NONE;
    }

    public static FieldResolution none(String requestedField) {
        return new FieldResolution(requestedField, FieldResolutionMethod.NONE, null, null, null);
    }

    @JsonIgnore
    public boolean isResolved() {
        return method != FieldResolutionMethod.NONE;
    }
}
