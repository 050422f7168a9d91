/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.ViolationCodes;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.StepRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gates the plan on an existing CIBP: nothing is perforated or squeezed below it, and the
 * plug always carries a cement cap.
 */
public class MechanicalBarrierRule implements StepRule {

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        Double cibpFt = context.wellbore().existingCibpFt();
        if (cibpFt == null) {
            return steps;
        }
        List<Step> result = new ArrayList<>();
        for (Step step : steps) {
            if (step.getType().isSqueezeFamily() && step.getTopFt() > cibpFt) {
                Map<String, Object> ctx = new LinkedHashMap<>();
                ctx.put("step_type", step.getType().value());
                ctx.put("top_ft", step.getTopFt());
                ctx.put("existing_cibp_ft", cibpFt);
                context.report(Violation.info(ViolationCodes.STEP_SUPPRESSED_BELOW_CIBP,
                    String.format("%s below the existing CIBP at %.0f ft was dropped", step.getType().displayName(), cibpFt),
                    ctx));
                continue;
            }
            result.add(step);
        }

        boolean capped = result.stream().anyMatch(s -> s.getType() == StepType.BRIDGE_PLUG_CAP
            && Objects.equals(s.getTopFt(), cibpFt));
        if (!capped) {
            double capFt = context.knobs().cementAboveCibpMinFt();
            result.add(Step.interval(StepType.BRIDGE_PLUG_CAP, cibpFt, cibpFt + capFt)
                .detail("existing_cibp", true)
                .detail("cibp_ft", cibpFt)
                .cite(context.citations("cement_above_cibp_min_ft")));
            context.report(Violation.info(ViolationCodes.CIBP_CAP_SYNTHESIZED,
                String.format("Cement cap added on the existing CIBP at %.0f ft", cibpFt),
                Map.of("existing_cibp_ft", cibpFt, "cap_length_ft", capFt)));
        }
        return result;
    }
}
