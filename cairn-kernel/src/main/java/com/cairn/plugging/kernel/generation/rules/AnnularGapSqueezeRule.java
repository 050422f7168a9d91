/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.Geometry;
import com.cairn.plugging.api.model.PolicyKnobs;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.Wellbore;
import com.cairn.plugging.kernel.generation.StepRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Perforates and squeezes uncemented annular gaps that need isolation.
 *
 * <p>The squeezed sub-interval is centered in the gap and at most
 * {@code max_squeeze_interval_ft} long; a cement cap of {@code squeeze_cap_length_ft}
 * sits inside casing directly above it. The step spans cap top to squeeze bottom.
 */
public class AnnularGapSqueezeRule implements StepRule {

    public static final String PERFORATION_INTERVAL = "perforation_interval";
    public static final String CAP_INTERVAL = "cement_cap_inside_casing";
    public static final String SQUEEZE_CONTEXT = "squeeze_context";

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        Wellbore well = context.wellbore();
        List<Step> result = new ArrayList<>(steps);
        for (Map<String, Object> gap : well.annularGaps()) {
            if (!WellFacts.toBoolean(gap.get("requires_isolation")) || WellFacts.toBoolean(gap.get("cement_present"))) {
                continue;
            }
            DepthInterval interval = WellFacts.toInterval(gap);
            if (interval == null) {
                continue;
            }
            Double cibpFt = well.existingCibpFt();
            if (cibpFt != null && interval.topFt() > cibpFt) {
                continue;
            }
            result.add(squeeze(context, gap, interval));
        }
        return result;
    }

    private Step squeeze(PlanningContext context, Map<String, Object> gap, DepthInterval interval) {
        PolicyKnobs knobs = context.knobs();
        double lengthFt = Math.min(interval.lengthFt(), knobs.maxSqueezeIntervalFt());
        double perfTop = interval.midpointFt() - lengthFt / 2.0;
        double perfBottom = interval.midpointFt() + lengthFt / 2.0;
        double capTop = Math.max(0.0, perfTop - knobs.squeezeCapLengthFt());

        String squeezeContext = context.wellbore().isOpenHole(perfBottom) ? Geometry.OPEN_HOLE : Geometry.CASED;

        Map<String, Object> gapDetail = new LinkedHashMap<>();
        gapDetail.put("top_ft", interval.topFt());
        gapDetail.put("bottom_ft", interval.bottomFt());
        if (gap.get("annulus") != null) {
            gapDetail.put("annulus", String.valueOf(gap.get("annulus")));
        }

        return Step.interval(StepType.PERFORATE_AND_SQUEEZE_PLUG, capTop, perfBottom)
            .detail(PERFORATION_INTERVAL, List.of(perfTop, perfBottom))
            .detail(CAP_INTERVAL, List.of(capTop, perfTop))
            .detail(SQUEEZE_CONTEXT, squeezeContext)
            .detail("annular_gap", gapDetail)
            .cite(context.citations("max_squeeze_interval_ft", "squeeze_cap_length_ft"));
    }
}
