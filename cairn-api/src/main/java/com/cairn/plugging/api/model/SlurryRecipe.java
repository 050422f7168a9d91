/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Cement slurry recipe used to turn a volume into a sack count.
 *
 * @param id recipe identifier, e.g. {@code class_h_neat_15_8}
 * @param cementClass API cement class ("C", "H", ...)
 * @param densityPpg slurry density in pounds per gallon
 * @param yieldFt3PerSack slurry yield per 94 lb sack
 * @param waterGalPerSack mix water per sack
 */
public record SlurryRecipe(
    @JsonProperty("id") String id,
    @JsonProperty("class") String cementClass,
    @JsonProperty("density_ppg") Double densityPpg,
    @JsonProperty("yield_ft3_per_sack") double yieldFt3PerSack,
    @JsonProperty("water_gal_per_sack") Double waterGalPerSack
) implements Serializable {

    public SlurryRecipe {
        if (!(yieldFt3PerSack > 0)) {
            throw new IllegalArgumentException("Recipe " + id + " must have a positive yield");
        }
        if (waterGalPerSack == null) waterGalPerSack = 0.0;
    }
}
