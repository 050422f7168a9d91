/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.StepRule;
import com.cairn.plugging.kernel.materials.CementClassSelector;

import java.util.List;

/**
 * Assigns a cement class to every cement-bearing step that has none yet.
 */
public class CementClassRule implements StepRule {

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        CementClassSelector selector = new CementClassSelector(context.knobs());
        for (Step step : steps) {
            if (step.getCementClass() == null) {
                step.setCementClass(selector.select(step));
            }
        }
        return steps;
    }
}
