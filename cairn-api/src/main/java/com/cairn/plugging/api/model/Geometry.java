/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Diameters bounding the annulus a step fills, in inches.
 *
 * <p>For cased plugs the outer diameter is the casing ID and the inner one the work-string
 * (stinger) OD. For open-hole squeezes the outer diameter is the drilled hole and the inner
 * one the casing OD. Either may be {@code null}, in which case no volume is computed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Geometry(
    @JsonProperty("outer_diameter_in") Double outerDiameterIn,
    @JsonProperty("inner_diameter_in") Double innerDiameterIn,
    @JsonProperty("context") String context,
    @JsonProperty("squeeze_factor") Double squeezeFactor
) implements Serializable {

    public static final String CASED = "cased";
    public static final String OPEN_HOLE = "open_hole";
    public static final String OPEN_HOLE_ESTIMATED = "open_hole_estimated";

    public static Geometry cased(Double casingIdIn, Double stingerOdIn) {
        return new Geometry(casingIdIn, stingerOdIn, CASED, null);
    }

    @JsonIgnore
    public boolean isComplete() {
        return outerDiameterIn != null && innerDiameterIn != null && outerDiameterIn > innerDiameterIn;
    }

    @JsonIgnore
    public boolean isOpenHole() {
        return OPEN_HOLE.equals(context) || OPEN_HOLE_ESTIMATED.equals(context);
    }

    public Geometry withSqueezeFactor(double factor) {
        return new Geometry(outerDiameterIn, innerDiameterIn, context, factor);
    }
}
