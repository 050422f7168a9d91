/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.materials;

import com.cairn.plugging.api.IMaterialsEngine;
import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.Geometry;
import com.cairn.plugging.api.model.MaterialsResult;
import com.cairn.plugging.api.model.SlurryRecipe;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.WellFacts;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cement volume and sack computation.
 *
 * <p>Squeeze-family steps (perforate-and-squeeze, squeeze) are volumed as a squeeze
 * behind pipe plus an optional cement cap inside casing; every other cement step is a
 * standard balanced plug with depth-scaled excess. Sacks always round up.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class MaterialsEngine implements IMaterialsEngine {

    public static final double DEFAULT_ANNULAR_EXCESS = 0.4;
    private static final double ROUNDING_SLACK = 1e-9;

    private final double annularExcess;

    public MaterialsEngine() {
        this(DEFAULT_ANNULAR_EXCESS);
    }

    /**
     * @param annularExcess policy excess fraction for standard plugs, before depth scaling
     */
    public MaterialsEngine(double annularExcess) {
        if (annularExcess < 0) {
            throw new IllegalArgumentException("Annular excess must not be negative: " + annularExcess);
        }
        this.annularExcess = annularExcess;
    }

    public double annularExcess() {
        return annularExcess;
    }

    @Override
    public MaterialsResult computeSacks(Step step, Geometry geometry, SlurryRecipe recipe) {
        if (recipe == null) {
            return MaterialsResult.missingGeometry("recipe");
        }
        if (geometry == null || geometry.outerDiameterIn() == null) {
            return MaterialsResult.missingGeometry(geometry != null && geometry.isOpenHole() ? "hole_size_in" : "casing_id_in");
        }
        if (geometry.innerDiameterIn() == null) {
            return MaterialsResult.missingGeometry(geometry.isOpenHole() ? "casing_od_in" : "stinger_od_in");
        }
        if (!geometry.isComplete()) {
            return MaterialsResult.missingGeometry("outer_diameter_not_greater_than_inner");
        }
        double capacity = Capacities.annularBblPerFt(geometry.outerDiameterIn(), geometry.innerDiameterIn());

        if (step.getType().isSqueezeFamily() && step.getType() != StepType.PERF_CIRCULATE) {
            double squeezeFt = lengthOf(step.getDetails().get("perforation_interval"), step.lengthFt());
            double capFt = lengthOf(step.getDetails().get("cement_cap_inside_casing"), 0.0);
            double factor = geometry.squeezeFactor() != null ? geometry.squeezeFactor() : SqueezeFactors.CASED;
            return compound(squeezeFt, capFt, capacity, factor, recipe);
        }
        double intervalFt = step.lengthFt();
        if (intervalFt <= 0) {
            return MaterialsResult.missingGeometry("interval");
        }
        return plug(intervalFt, step.deepestFt(), capacity, recipe);
    }

    /**
     * Perforate-and-squeeze volume: squeeze behind pipe plus a cap inside casing.
     *
     * @param squeezeFt length of the squeezed interval
     * @param capFt length of the cap above it, zero for none
     * @param capacityBblPerFt annular capacity
     * @param squeezeFactor {@link SqueezeFactors#CASED} or {@link SqueezeFactors#OPEN_HOLE}
     */
    public MaterialsResult compound(double squeezeFt, double capFt, double capacityBblPerFt,
                                    double squeezeFactor, SlurryRecipe recipe) {
        double squeezeBbl = squeezeBbl(squeezeFt, capacityBblPerFt, squeezeFactor);
        double capBbl = capBbl(capFt, capacityBblPerFt);
        double totalBbl = squeezeBbl + capBbl;

        Map<String, Object> explain = new LinkedHashMap<>();
        explain.put("method", "squeeze_with_cap");
        explain.put("squeeze_interval_ft", squeezeFt);
        explain.put("cap_length_ft", capFt);
        explain.put("squeeze_factor", squeezeFactor);
        explain.put("cap_excess", SqueezeFactors.CAP_EXCESS);
        return finish(totalBbl, squeezeBbl, capBbl, capacityBblPerFt, recipe, explain);
    }

    /**
     * Standard balanced plug volume with depth-scaled excess.
     */
    public MaterialsResult plug(double intervalFt, double depthFt, double capacityBblPerFt, SlurryRecipe recipe) {
        double multiplier = DepthExcess.multiplier(annularExcess, depthFt);
        double totalBbl = intervalFt * capacityBblPerFt * multiplier;

        Map<String, Object> explain = new LinkedHashMap<>();
        explain.put("method", "balanced_plug");
        explain.put("interval_ft", intervalFt);
        explain.put("depth_ft", depthFt);
        explain.put("excess", annularExcess);
        explain.put("depth_scaled_excess", Capacities.round(DepthExcess.scaled(annularExcess, depthFt), 4));
        return finish(totalBbl, null, null, capacityBblPerFt, recipe, explain);
    }

    public static double squeezeBbl(double intervalFt, double capacityBblPerFt, double squeezeFactor) {
        return intervalFt * capacityBblPerFt * squeezeFactor;
    }

    public static double capBbl(double capFt, double capacityBblPerFt) {
        return capFt * capacityBblPerFt * (1.0 + SqueezeFactors.CAP_EXCESS);
    }

    /**
     * {@code ceil(totalBbl * 5.615 / yield)}; zero volume needs zero sacks.
     */
    public static int sacksFor(double totalBbl, double yieldFt3PerSack) {
        if (totalBbl <= 0) {
            return 0;
        }
        return (int) Math.ceil(Capacities.bblToFt3(totalBbl) / yieldFt3PerSack - ROUNDING_SLACK);
    }

    private MaterialsResult finish(double totalBbl, Double squeezeBbl, Double capBbl, double capacity,
                                   SlurryRecipe recipe, Map<String, Object> explain) {
        int sacks = sacksFor(totalBbl, recipe.yieldFt3PerSack());
        double waterBbl = Capacities.galToBbl(sacks * recipe.waterGalPerSack());
        explain.put("yield_ft3_per_sack", recipe.yieldFt3PerSack());
        return new MaterialsResult(
            sacks,
            Capacities.round(capacity, 5),
            squeezeBbl == null ? null : Capacities.round(squeezeBbl, 3),
            capBbl == null ? null : Capacities.round(capBbl, 3),
            Capacities.round(totalBbl, 3),
            Capacities.round(Capacities.bblToFt3(totalBbl), 2),
            Capacities.round(waterBbl, 2),
            explain
        );
    }

    private static double lengthOf(Object interval, double fallback) {
        if (interval == null) {
            return fallback;
        }
        DepthInterval parsed = WellFacts.toInterval(interval);
        return parsed == null ? fallback : parsed.lengthFt();
    }
}
