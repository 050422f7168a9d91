/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.PolicyKnobs;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.ViolationCodes;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.Wellbore;
import com.cairn.plugging.kernel.generation.StepRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal plugging scaffold every well gets: casing shoe plugs, usable-quality water
 * isolation, productive horizon isolation for cased completions, and the surface plug.
 *
 * <p>Missing depths degrade the scaffold and raise a violation instead of failing.
 */
public class BaselineScaffoldRule implements StepRule {

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        List<Step> result = new ArrayList<>(steps);
        Wellbore well = context.wellbore();
        PolicyKnobs knobs = context.knobs();

        if (well.surfaceShoeFt() == null) {
            context.report(Violation.error(ViolationCodes.SURFACE_SHOE_DEPTH_UNKNOWN,
                "Surface casing shoe depth is unknown; surface shoe plug omitted",
                Map.of("fact", "surface_shoe_ft")));
        } else {
            result.add(shoePlug(context, StepType.SURFACE_CASING_SHOE_PLUG, well.surfaceShoeFt(),
                knobs.surfaceShoePlugLengthFt(), "surface_casing_shoe_plug_min_ft"));
        }

        if (well.intermediateShoeFt() != null) {
            result.add(shoePlug(context, StepType.INTERMEDIATE_CASING_SHOE_PLUG, well.intermediateShoeFt(),
                knobs.intermediateShoePlugLengthFt(), "intermediate_casing_shoe_plug_min_ft"));
        }

        boolean uqwPlugged = false;
        if (well.hasUqw()) {
            if (well.uqwBaseFt() == null) {
                context.report(Violation.warning(ViolationCodes.UQW_DEPTH_UNKNOWN,
                    "Well reports usable-quality water but uqw_base_ft is unknown",
                    Map.of("fact", "uqw_base_ft")));
            } else {
                result.add(uqwPlug(context, well.uqwBaseFt()));
                uqwPlugged = true;
            }
        }
        if (knobs.duqwIsolationRequired() && well.hasDuqw() && !uqwPlugged) {
            context.report(Violation.warning(ViolationCodes.DUQW_ISOLATION_MISSING,
                "Deepest usable-quality water requires isolation but no UQW plug could be placed",
                Map.of("has_uqw", well.hasUqw())));
        }

        result.addAll(productiveHorizonPlugs(context));
        result.add(topPlug(context));
        return result;
    }

    private Step shoePlug(PlanningContext context, StepType type, double shoeFt, double lengthFt, String lengthKnob) {
        double half = lengthFt / 2.0;
        Step step = Step.interval(type, Math.max(0.0, shoeFt - half), shoeFt + half)
            .detail("shoe_ft", shoeFt)
            .cite(context.citations(lengthKnob, "casing_shoe_coverage_ft"));

        Double coverage = context.knobs().casingShoeCoverageFt();
        double coveredAbove = shoeFt - step.getTopFt();
        double coveredBelow = step.getBottomFt() - shoeFt;
        if (coverage != null && Math.min(coveredAbove, coveredBelow) < coverage) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("step_type", type.value());
            ctx.put("shoe_ft", shoeFt);
            ctx.put("required_ft", coverage);
            ctx.put("covered_above_ft", coveredAbove);
            ctx.put("covered_below_ft", coveredBelow);
            context.report(Violation.warning(ViolationCodes.INSUFFICIENT_SHOE_COVERAGE,
                String.format("%s covers less than %.0f ft on each side of the shoe at %.0f ft",
                    type.displayName(), coverage, shoeFt), ctx));
        }
        return step;
    }

    private Step uqwPlug(PlanningContext context, double baseFt) {
        PolicyKnobs knobs = context.knobs();
        Step step = Step.interval(StepType.UQW_ISOLATION_PLUG,
                Math.max(0.0, baseFt - knobs.uqwAboveBaseFt()), baseFt + knobs.uqwBelowBaseFt())
            .detail("uqw_base_ft", baseFt)
            .cite(context.citations("uqw_below_base_ft", "uqw_above_base_ft"));
        if (context.wellbore().hasDuqw() && knobs.duqwIsolationRequired()) {
            step.cite(context.citations("duqw_coverage_ft", "duqw_isolation_required"));
        }
        return step;
    }

    /**
     * One isolation plug per completion interval lying fully inside the production string.
     */
    private List<Step> productiveHorizonPlugs(PlanningContext context) {
        Wellbore well = context.wellbore();
        List<Step> plugs = new ArrayList<>();
        if (well.producingIntervals().isEmpty()) {
            return plugs;
        }
        if (well.productionShoeFt() == null) {
            context.report(Violation.warning(ViolationCodes.PRODUCTION_SHOE_DEPTH_UNKNOWN,
                "Production shoe depth is unknown; productive horizons cannot be classified as cased or open hole",
                Map.of("fact", "production_shoe_ft")));
            return plugs;
        }
        double half = context.knobs().productiveHorizonIsolationFt() / 2.0;
        for (DepthInterval interval : well.producingIntervals()) {
            if (interval.bottomFt() > well.productionShoeFt()) {
                continue;
            }
            plugs.add(Step.interval(StepType.PRODUCTIVE_HORIZON_ISOLATION_PLUG,
                    Math.max(0.0, interval.topFt() - half), interval.topFt() + half)
                .detail("producing_interval", List.of(interval.topFt(), interval.bottomFt()))
                .cite(context.citations("productive_horizon_isolation_min_ft")));
        }
        return plugs;
    }

    private Step topPlug(PlanningContext context) {
        PolicyKnobs knobs = context.knobs();
        return Step.interval(StepType.TOP_PLUG, 0.0, knobs.topPlugLengthFt())
            .detail("casing_cut_below_surface_ft", knobs.casingCutBelowSurfaceFt())
            .cite(context.citations("top_plug_length_ft", "casing_cut_below_surface_ft"));
    }
}
