/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.StepRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Isolates a packer and a DV tool with a cement plug spanning 50 ft either side, unless
 * an existing cement step already covers the device.
 */
public class PackerDvToolRule implements StepRule {

    public static final double HALF_SPAN_FT = 50.0;

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        List<Step> result = new ArrayList<>(steps);
        isolate(context, result, context.wellbore().packerFt(), "packer");
        isolate(context, result, context.wellbore().dvToolFt(), "dv_tool");
        return result;
    }

    private void isolate(PlanningContext context, List<Step> steps, Double deviceFt, String device) {
        if (deviceFt == null) {
            return;
        }
        for (Step step : steps) {
            if (step.getType().isCementBearing() && !step.isPoint() && step.spans(deviceFt)) {
                step.detail("isolates_" + device + "_ft", deviceFt);
                return;
            }
        }
        steps.add(Step.interval(StepType.MECHANICAL_ISOLATION_PLUG,
                Math.max(0.0, deviceFt - HALF_SPAN_FT), deviceFt + HALF_SPAN_FT)
            .detail("device", device)
            .detail("device_ft", deviceFt)
            .cite(context.citationKey("mechanical_isolation")));
    }
}
