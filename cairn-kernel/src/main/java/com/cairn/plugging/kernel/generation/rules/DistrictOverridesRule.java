/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation.rules;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.StepRule;
import com.cairn.plugging.policy.KnobReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * District operating practice: tagging hints on shoe and UQW plugs, and the operational
 * preferences written onto every step as special instructions.
 */
public class DistrictOverridesRule implements StepRule {

    private static final Set<StepType> SHOE_PLUGS = Set.of(
        StepType.SURFACE_CASING_SHOE_PLUG, StepType.INTERMEDIATE_CASING_SHOE_PLUG);

    @Override
    public List<Step> apply(PlanningContext context, List<Step> steps) {
        String shoeReason = shoeTagReason(context);
        boolean hint = WellFacts.toBoolean(KnobReader.value(context.policy().effective(), "requirements.tagging_required_hint"));
        List<String> instructions = List.copyOf(specialInstructions(context.policy().section("preferences.operational")));

        for (Step step : steps) {
            boolean shoe = SHOE_PLUGS.contains(step.getType());
            if (shoe && shoeReason != null) {
                step.setTagRequired(true).detail("tag_reason", shoeReason);
            }
            if (hint && (shoe || step.getType() == StepType.UQW_ISOLATION_PLUG)) {
                step.setTagRequired(true).cite(context.citations("tagging_required_hint"));
                step.getDetails().putIfAbsent("tag_reason", "district_tagging_hint");
            }
            if (!instructions.isEmpty()) {
                step.detail("special_instructions", instructions);
            }
        }
        return steps;
    }

    private static String shoeTagReason(PlanningContext context) {
        if (WellFacts.toBoolean(context.policy().lookup("overrides.tag.surface_shoe_in_oh"))) {
            return "surface_shoe_in_open_hole";
        }
        if (!context.policy().list("overrides.protect_intervals").isEmpty()) {
            return "protect_intervals";
        }
        if (WellFacts.toBoolean(context.policy().lookup("overrides.enhanced_recovery_zone"))) {
            return "enhanced_recovery_zone";
        }
        return null;
    }

    static List<String> specialInstructions(Map<String, Object> operational) {
        List<String> instructions = new ArrayList<>();
        for (Map.Entry<String, Object> entry : operational.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (entry.getKey()) {
                case "pump_through_tubing" -> {
                    if (WellFacts.toBoolean(value)) {
                        instructions.add("Pump cement through tubing or drill pipe");
                    }
                }
                case "notice_hours" -> instructions.add("Notify the district office " + number(value) + " hours before plugging");
                case "mud_weight_ppg" -> instructions.add("Leave " + number(value) + " ppg mud-laden fluid between plugs");
                case "funnel_viscosity_s" -> instructions.add("Mud funnel viscosity at least " + number(value) + " s");
                default -> instructions.add(entry.getKey() + ": " + value);
            }
        }
        return instructions;
    }

    private static String number(Object value) {
        Double parsed = WellFacts.toDouble(value);
        if (parsed == null) {
            return String.valueOf(value);
        }
        return parsed == Math.rint(parsed) ? String.valueOf(parsed.longValue()) : String.valueOf(parsed);
    }
}
