/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.ViolationCodes;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.StepRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plugs across the formation tops a district, county or field overlay lists under
 * {@code overrides.formation_tops}.
 *
 * <p>The well's own top from {@code formation_tops_map} wins over the overlay's anchor
 * depth. Plugs span 50 ft either side of the top.
 */
public class FormationTopRule implements StepRule {

    public static final double HALF_SPAN_FT = 50.0;

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        List<Step> result = new ArrayList<>(steps);
        for (Object entry : context.policy().list("overrides.formation_tops")) {
            if (!(entry instanceof Map<?, ?> spec) || spec.get("formation") == null) {
                continue;
            }
            if (!WellFacts.toBoolean(spec.get("plug_required"))) {
                continue;
            }
            String formation = String.valueOf(spec.get("formation"));
            Double wellTop = context.wellbore().formationTop(formation);
            Double anchorTop = WellFacts.toDouble(spec.get("top_ft"));
            Double top = wellTop != null ? wellTop : anchorTop;
            if (top == null) {
                Map<String, Object> ctx = new LinkedHashMap<>();
                ctx.put("formation", formation);
                ctx.put("district", context.district());
                context.report(Violation.warning(ViolationCodes.FORMATION_TOP_UNRESOLVED,
                    "No depth known for required formation top " + formation, ctx));
                continue;
            }
            result.add(Step.interval(StepType.FORMATION_TOP_PLUG, Math.max(0.0, top - HALF_SPAN_FT), top + HALF_SPAN_FT)
                .setFormation(formation)
                .setTagRequired(WellFacts.toBoolean(spec.get("tag_required")))
                .detail("formation_top_ft", top)
                .detail("top_source", wellTop != null ? "well" : "district_anchor")
                .cite(citation(context, formation)));
        }
        return result;
    }

    static String citation(PlanningContext context, String formation) {
        String scope = "rrc.district." + context.district();
        String county = context.countyKey();
        if (county != null) {
            scope += "." + county;
        }
        return scope + ":formation_top:" + formation;
    }
}
