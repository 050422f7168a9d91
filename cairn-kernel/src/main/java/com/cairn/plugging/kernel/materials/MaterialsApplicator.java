/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.materials;

import com.cairn.plugging.api.IMaterialsEngine;
import com.cairn.plugging.api.model.Geometry;
import com.cairn.plugging.api.model.MaterialsResult;
import com.cairn.plugging.api.model.SlurryRecipe;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.ViolationCodes;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.materials.MaterialsEngine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleFunction;

/**
 * Runs the materials engine over generated steps and records the result on each step.
 *
 * <p>A step whose geometry is incomplete keeps {@code sacks = null} and the plan gets a
 * {@code MATERIALS_GEOMETRY_MISSING} warning. Steps with {@code materials_override} keep
 * their pinned sack count.
 */
public class MaterialsApplicator {

    public static final String MATERIALS_OVERRIDE = "materials_override";
    public static final String GEOMETRY_FOR_SQUEEZE = "geometry_for_squeeze";

    private final DoubleFunction<IMaterialsEngine> engineFactory;

    public MaterialsApplicator() {
        this(MaterialsEngine::new);
    }

    /**
     * @param engineFactory builds an engine for the policy's annular excess
     */
    public MaterialsApplicator(DoubleFunction<IMaterialsEngine> engineFactory) {
        this.engineFactory = engineFactory;
    }

    /**
     * Computes materials for every step, then applies the minimum-sack floor.
     *
     * @return number of steps whose sacks were computed
     */
    public int apply(PlanningContext context, List<Step> steps) {
        IMaterialsEngine engine = engineFactory.apply(context.knobs().annularExcess());
        GeometryResolver geometry = new GeometryResolver(context.wellbore());
        int computed = 0;
        for (Step step : steps) {
            if (compute(context, engine, geometry, step)) {
                computed++;
            }
        }
        SackFloor.apply(steps);
        return computed;
    }

    /**
     * Recomputes one step from scratch, e.g. after merging.
     */
    public boolean recompute(PlanningContext context, Step step) {
        step.getDetails().remove(SackFloor.APPLIED);
        step.getDetails().remove(SackFloor.ORIGINAL);
        boolean computed = compute(context, engineFactory.apply(context.knobs().annularExcess()),
            new GeometryResolver(context.wellbore()), step);
        SackFloor.apply(step);
        return computed;
    }

    private boolean compute(PlanningContext context, IMaterialsEngine engine, GeometryResolver resolver, Step step) {
        if (!step.getType().isCementBearing() || step.hasDetailFlag(MATERIALS_OVERRIDE)) {
            return false;
        }
        Geometry geometry = resolver.resolve(step);
        if (geometry != null && geometry.squeezeFactor() != null) {
            step.detail(GEOMETRY_FOR_SQUEEZE, geometryDetail(geometry));
        }
        SlurryRecipe recipe = context.knobs().recipeFor(step.getCementClass());
        MaterialsResult result = engine.computeSacks(step, geometry, recipe);

        step.getMaterials().clear();
        if (!result.isComputed()) {
            step.setSacks(null);
            Object missing = result.explain().get("missing");
            step.getMaterials().put("missing", missing);
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("step_type", step.getType().value());
            ctx.put("top_ft", step.getTopFt());
            ctx.put("bottom_ft", step.getBottomFt());
            ctx.put("missing", missing);
            context.report(Violation.warning(ViolationCodes.MATERIALS_GEOMETRY_MISSING,
                String.format("Cannot compute cement for %s: %s unknown", step.getType().displayName(), missing), ctx));
            return false;
        }
        step.setSacks(result.sacks());
        step.getMaterials().put("slurry", slurry(recipe));
        step.getMaterials().put("annular_capacity_bbl_per_ft", result.capacityBblPerFt());
        if (result.squeezeBbl() != null) {
            step.getMaterials().put("squeeze_bbl", result.squeezeBbl());
        }
        if (result.capBbl() != null) {
            step.getMaterials().put("cap_bbl", result.capBbl());
        }
        step.getMaterials().put("total_bbl", result.totalBbl());
        step.getMaterials().put("ft3", result.ft3());
        step.getMaterials().put("water_bbl", result.waterBbl());
        step.getMaterials().put("explain", new LinkedHashMap<>(result.explain()));
        return true;
    }

    private static Map<String, Object> slurry(SlurryRecipe recipe) {
        Map<String, Object> slurry = new LinkedHashMap<>();
        slurry.put("recipe_id", recipe.id());
        slurry.put("class", recipe.cementClass());
        if (recipe.densityPpg() != null) {
            slurry.put("density_ppg", recipe.densityPpg());
        }
        slurry.put("yield_ft3_per_sack", recipe.yieldFt3PerSack());
        slurry.put("water_gal_per_sack", recipe.waterGalPerSack());
        return slurry;
    }

    private static Map<String, Object> geometryDetail(Geometry geometry) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("context", geometry.context());
        detail.put("outer_diameter_in", geometry.outerDiameterIn());
        detail.put("inner_diameter_in", geometry.innerDiameterIn());
        detail.put("squeeze_factor", geometry.squeezeFactor());
        return detail;
    }
}
