/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.Geometry;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.StepRule;
import com.cairn.plugging.kernel.materials.MaterialsApplicator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Adds operations a district, county or field policy prescribes explicitly under
 * {@code steps_overrides}: {@code cement_plugs[]}, {@code perf_circulate[]} and
 * {@code squeeze_via_perf}. A {@code sacks_override} pins the sack count and exempts the
 * step from computed materials.
 */
public class StepsOverridesRule implements StepRule {
    private static final Logger logger = Logger.getLogger(StepsOverridesRule.class.getName());

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        List<Step> result = new ArrayList<>(steps);
        Map<String, Object> overrides = context.policy().section("steps_overrides");
        if (overrides.isEmpty()) {
            return result;
        }
        for (Object entry : listOf(overrides.get("cement_plugs"))) {
            Step step = fromEntry(StepType.CEMENT_PLUG, entry);
            if (step != null) {
                result.add(step);
            }
        }
        for (Object entry : listOf(overrides.get("perf_circulate"))) {
            Step step = fromEntry(StepType.PERF_CIRCULATE, entry);
            if (step != null) {
                result.add(step);
            }
        }
        if (overrides.get("squeeze_via_perf") instanceof Map<?, ?> squeeze) {
            DepthInterval interval = WellFacts.toInterval(squeeze.get("interval_ft"));
            if (interval == null) {
                logger.warning("steps_overrides.squeeze_via_perf has no usable interval_ft; skipped");
            } else {
                Step step = Step.interval(StepType.SQUEEZE, interval.topFt(), interval.bottomFt())
                    .detail(AnnularGapSqueezeRule.PERFORATION_INTERVAL, List.of(interval.topFt(), interval.bottomFt()))
                    .detail(AnnularGapSqueezeRule.SQUEEZE_CONTEXT, Geometry.CASED)
                    .detail("source", "steps_overrides");
                applyCommon(step, squeeze);
                result.add(step);
            }
        }
        return result;
    }

    private Step fromEntry(StepType type, Object entry) {
        DepthInterval interval = WellFacts.toInterval(entry);
        if (interval == null) {
            logger.warning(String.format("steps_overrides entry for %s has no usable interval: %s", type.value(), entry));
            return null;
        }
        Step step = Step.interval(type, interval.topFt(), interval.bottomFt()).detail("source", "steps_overrides");
        if (entry instanceof Map<?, ?> spec) {
            if (spec.get("formation") != null) {
                step.setFormation(String.valueOf(spec.get("formation")));
            }
            applyCommon(step, spec);
        }
        return step;
    }

    private static void applyCommon(Step step, Map<?, ?> spec) {
        Double sacks = WellFacts.toDouble(spec.get("sacks_override"));
        if (sacks != null) {
            step.setSacks((int) Math.ceil(sacks));
            step.detail(MaterialsApplicator.MATERIALS_OVERRIDE, true);
        }
        if (WellFacts.toBoolean(spec.get("tag_required"))) {
            step.setTagRequired(true);
        }
        if (spec.get("cement_class") != null) {
            step.setCementClass(String.valueOf(spec.get("cement_class")));
        }
        List<String> cites = new ArrayList<>();
        for (Object cite : listOf(spec.get("citations"))) {
            if (cite != null) {
                cites.add(String.valueOf(cite));
            }
        }
        step.cite(cites);
    }

    private static List<?> listOf(Object value) {
        return value instanceof List<?> list ? list : List.of();
    }
}
