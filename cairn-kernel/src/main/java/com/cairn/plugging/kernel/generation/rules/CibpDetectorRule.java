/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.Wellbore;
import com.cairn.plugging.kernel.generation.StepRule;
import com.cairn.plugging.materials.Capacities;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Sets a new CIBP above a completion left open below the production shoe.
 *
 * <p>The plug goes 10 ft above the producing top. When the kick-off point is known the
 * plug also stays 50 ft above it, and the shallower of the two depths wins. A cement cap
 * of {@code cement_above_cibp_min_ft} is spotted from the plug depth.
 */
public class CibpDetectorRule implements StepRule {
    private static final Logger logger = Logger.getLogger(CibpDetectorRule.class.getName());

    public static final double OFFSET_ABOVE_PRODUCING_TOP_FT = 10.0;
    public static final double OFFSET_ABOVE_KOP_FT = 50.0;
    public static final double CLEARANCE_IN = 0.25;

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        Wellbore well = context.wellbore();
        Double shoeFt = well.productionShoeFt();
        if (shoeFt == null) {
            return steps;
        }

        double producingTop;
        double deepestFt;
        String basis;
        DepthInterval completion = well.deepestCompletion();
        if (completion != null) {
            producingTop = completion.topFt();
            deepestFt = completion.bottomFt();
            basis = "completion_interval";
        } else if (well.deepestFormationTop() != null) {
            producingTop = well.deepestFormationTop();
            deepestFt = producingTop;
            basis = "deepest_formation_top";
        } else {
            return steps;
        }

        if (deepestFt < shoeFt) {
            return steps;
        }
        Double existing = well.existingCibpFt();
        if (existing != null && existing <= producingTop) {
            logger.fine(String.format("Existing CIBP at %.0f ft already isolates producing top %.0f ft", existing, producingTop));
            return steps;
        }
        for (Step step : steps) {
            if (step.getType().isSqueezeFamily() && step.spans(producingTop)) {
                return steps;
            }
        }

        double depthFt = producingTop - OFFSET_ABOVE_PRODUCING_TOP_FT;
        String placement = "perforation";
        if (well.kopMdFt() != null && well.kopMdFt() - OFFSET_ABOVE_KOP_FT < depthFt) {
            depthFt = well.kopMdFt() - OFFSET_ABOVE_KOP_FT;
            placement = "kop";
        }

        Step plug = Step.point(StepType.BRIDGE_PLUG, depthFt)
            .detail("placement", placement)
            .detail("producing_top_ft", producingTop)
            .detail("producing_top_basis", basis)
            .cite(context.citations("productive_horizon_isolation_min_ft"))
            .cite(context.citationKey("mechanical_isolation"));
        if (well.kopMdFt() != null) {
            plug.detail("kop_md_ft", well.kopMdFt());
        }
        Double casingId = well.casingIdAt(depthFt);
        if (casingId != null) {
            plug.detail("recommended_cibp_size_in", Capacities.round(casingId - CLEARANCE_IN, 3));
        }

        double capFt = context.knobs().cementAboveCibpMinFt();
        Step cap = Step.interval(StepType.BRIDGE_PLUG_CAP, depthFt, depthFt + capFt)
            .detail("cibp_ft", depthFt)
            .cite(context.citations("cement_above_cibp_min_ft"));

        List<Step> result = new ArrayList<>(steps);
        result.add(plug);
        result.add(cap);
        return result;
    }
}
