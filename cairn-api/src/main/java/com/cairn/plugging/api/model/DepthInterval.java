/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Closed measured-depth interval in feet, normalized so that {@code topFt <= bottomFt}.
 */
public record DepthInterval(
    @JsonProperty("top_ft") double topFt,
    @JsonProperty("bottom_ft") double bottomFt
) implements Serializable {

    public DepthInterval {
        if (topFt > bottomFt) {
            double swap = topFt;
            topFt = bottomFt;
            bottomFt = swap;
        }
    }

    public double lengthFt() {
        return bottomFt - topFt;
    }

    public double midpointFt() {
        return (topFt + bottomFt) / 2.0;
    }

    public boolean contains(double depthFt) {
        return depthFt >= topFt && depthFt <= bottomFt;
    }

    public boolean contains(DepthInterval other) {
        return other.topFt >= topFt && other.bottomFt <= bottomFt;
    }
}
