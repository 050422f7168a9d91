/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly typed view of an effective policy, materialized after merge and validation.
 *
 * <p>Required knobs ({@code casingShoeCoverageFt}, {@code duqwCoverageFt},
 * {@code tagWaitHours}, cement-class cutoff and classes) are {@code null} when the merged
 * policy lacks them; every optional knob carries its default.
 */
public record PolicyKnobs(
    @JsonProperty("casing_shoe_coverage_ft") Double casingShoeCoverageFt,
    @JsonProperty("duqw_coverage_ft") Double duqwCoverageFt,
    @JsonProperty("tag_wait_hours") Double tagWaitHours,
    @JsonProperty("cement_cutoff_ft") Double cementCutoffFt,
    @JsonProperty("shallow_class") String shallowClass,
    @JsonProperty("deep_class") String deepClass,
    @JsonProperty("surface_casing_shoe_plug_min_ft") double surfaceShoePlugLengthFt,
    @JsonProperty("intermediate_casing_shoe_plug_min_ft") double intermediateShoePlugLengthFt,
    @JsonProperty("uqw_below_base_ft") double uqwBelowBaseFt,
    @JsonProperty("uqw_above_base_ft") double uqwAboveBaseFt,
    @JsonProperty("productive_horizon_isolation_min_ft") double productiveHorizonIsolationFt,
    @JsonProperty("top_plug_length_ft") double topPlugLengthFt,
    @JsonProperty("casing_cut_below_surface_ft") double casingCutBelowSurfaceFt,
    @JsonProperty("cement_above_cibp_min_ft") double cementAboveCibpMinFt,
    @JsonProperty("max_squeeze_interval_ft") double maxSqueezeIntervalFt,
    @JsonProperty("squeeze_cap_length_ft") double squeezeCapLengthFt,
    @JsonProperty("duqw_isolation_required") boolean duqwIsolationRequired,
    @JsonProperty("tag_required_step_types") List<String> tagRequiredStepTypes,
    @JsonProperty("annular_excess") double annularExcess,
    @JsonProperty("recipes") Map<String, SlurryRecipe> recipes,
    @JsonProperty("default_recipe") String defaultRecipe,
    @JsonProperty("long_plug_merge") LongPlugMerge longPlugMerge,
    @JsonProperty("knob_citations") Map<String, List<String>> knobCitations
) implements Serializable {

    public PolicyKnobs {
        tagRequiredStepTypes = tagRequiredStepTypes == null ? List.of() : List.copyOf(tagRequiredStepTypes);
        recipes = recipes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(recipes));
        knobCitations = knobCitations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(knobCitations));
        if (longPlugMerge == null) longPlugMerge = LongPlugMerge.disabled();
    }

    /**
     * Citations attached to a requirement knob in the merged policy, or an empty list.
     */
    public List<String> citationsFor(String knob) {
        return knobCitations.getOrDefault(knob, List.of());
    }

    /**
     * Picks the recipe for a cement class, falling back to the default recipe.
     */
    public SlurryRecipe recipeFor(String cementClass) {
        if (cementClass != null && recipes.containsKey(cementClass)) {
            return recipes.get(cementClass);
        }
        if (defaultRecipe != null && recipes.containsKey(defaultRecipe)) {
            return recipes.get(defaultRecipe);
        }
        for (SlurryRecipe recipe : recipes.values()) {
            if (recipe.id() != null && recipe.id().equals(defaultRecipe)) {
                return recipe;
            }
        }
        return null;
    }

    /**
     * Long-plug merge preferences.
     */
    public record LongPlugMerge(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("threshold_ft") double thresholdFt,
        @JsonProperty("types") List<String> types
    ) implements Serializable {

        public LongPlugMerge {
            types = types == null || types.isEmpty() ? List.of(StepType.FORMATION_TOP_PLUG.value()) : List.copyOf(types);
        }

        public static LongPlugMerge disabled() {
            return new LongPlugMerge(false, 0.0, null);
        }
    }
}
