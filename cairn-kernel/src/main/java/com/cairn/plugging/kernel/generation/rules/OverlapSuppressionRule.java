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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Drops spot plugs made redundant by a squeeze or CIBP cap that already cements across
 * their whole interval.
 */
public class OverlapSuppressionRule implements StepRule {
    private static final Logger logger = Logger.getLogger(OverlapSuppressionRule.class.getName());

    private static final Set<StepType> SUPPRESSIBLE = EnumSet.of(
        StepType.FORMATION_TOP_PLUG, StepType.CEMENT_PLUG, StepType.MECHANICAL_ISOLATION_PLUG);

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        List<Step> covering = new ArrayList<>();
        for (Step step : steps) {
            if (step.getType().isSqueezeFamily() || step.getType() == StepType.BRIDGE_PLUG_CAP) {
                covering.add(step);
            }
        }
        if (covering.isEmpty()) {
            return steps;
        }
        List<Step> result = new ArrayList<>();
        for (Step step : steps) {
            if (SUPPRESSIBLE.contains(step.getType()) && isCovered(step, covering)) {
                logger.fine(String.format("Suppressed %s inside an existing squeeze or cap interval", step));
                continue;
            }
            result.add(step);
        }
        return result;
    }

    private static boolean isCovered(Step step, List<Step> covering) {
        for (Step cover : covering) {
            if (cover.encloses(step)) {
                return true;
            }
        }
        return false;
    }
}
