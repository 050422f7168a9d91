/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.StepRule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds the tag-and-wait verification to every step that must be tagged.
 */
public class TaggingRule implements StepRule {

    public static final double DEFAULT_WAIT_HOURS = 4.0;

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        Double knob = context.knobs().tagWaitHours();
        double waitHours = knob != null ? knob : DEFAULT_WAIT_HOURS;
        List<String> tagTypes = context.knobs().tagRequiredStepTypes();
        for (Step step : steps) {
            if (!step.isTagRequired() && !tagTypes.contains(step.getType().value())) {
                continue;
            }
            Map<String, Object> verification = new LinkedHashMap<>();
            verification.put("action", "TAG");
            verification.put("required_wait_hr", waitHours);
            step.setTagRequired(true)
                .detail("verification", verification)
                .cite(context.citations("tag_wait_hours"));
        }
        return steps;
    }
}
