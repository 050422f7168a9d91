/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.assembly;

import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.MaterialsTotals;
import com.cairn.plugging.api.model.Plan;
import com.cairn.plugging.api.model.PlanStep;
import com.cairn.plugging.api.model.RrcExportRow;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.ViolationCodes;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.Wellbore;
import com.cairn.plugging.kernel.generation.rules.AnnularGapSqueezeRule;
import com.cairn.plugging.kernel.materials.SackFloor;
import com.cairn.plugging.kernel.merge.MergePostProcessor;
import com.cairn.plugging.materials.Capacities;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the working step list into a {@link Plan}: deepest-first order, sequential ids,
 * materials totals, export rows for the W-3A form, violations and notes.
 */
public class PlanAssembler {

    /**
     * Deepest first. Intervals sort by bottom, point devices and CIBP caps by their set
     * depth; on ties point devices come first, then step type, then formation.
     */
    public static final Comparator<Step> DEEPEST_FIRST = Comparator
        .comparingDouble((Step s) -> sortDepth(s)).reversed()
        .thenComparing(Step::isPoint, Comparator.reverseOrder())
        .thenComparing(Step::getType)
        .thenComparing(Step::getFormation, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparingDouble(Step::getTopFt);

    private final String kernelVersion;

    public PlanAssembler(String kernelVersion) {
        this.kernelVersion = kernelVersion;
    }

    static double sortDepth(Step step) {
        if (step.isPoint() || step.getType() == StepType.BRIDGE_PLUG_CAP) {
            return step.getTopFt();
        }
        return step.getBottomFt();
    }

    public Plan assemble(PlanningContext context, List<Step> steps) {
        List<Step> ordered = new ArrayList<>(steps);
        ordered.sort(DEEPEST_FIRST);

        List<PlanStep> planSteps = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            planSteps.add(PlanStep.from(i + 1, ordered.get(i)));
        }

        EffectivePolicy policy = context.policy();
        List<Violation> violations = new ArrayList<>();
        if (!policy.complete()) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("policy_id", policy.policyId());
            ctx.put("missing", policy.incompleteReasons());
            violations.add(Violation.error(ViolationCodes.POLICY_INCOMPLETE,
                "Effective policy is missing required knobs: " + String.join(", ", policy.incompleteReasons()), ctx));
        }
        violations.addAll(context.violations());

        WellFacts facts = context.facts();
        return new Plan(
            kernelVersion,
            facts.text("api14"),
            policy.policyId(),
            policy.version(),
            policy.jurisdiction(),
            context.district(),
            context.county(),
            policy.field() != null ? policy.field() : facts.text("field"),
            policy.fieldResolution(),
            policy.complete(),
            planSteps,
            violations,
            totals(planSteps),
            exportRows(context, planSteps),
            formationsTargeted(planSteps),
            new ArrayList<>(context.wellbore().formationTops().keySet()),
            notes(context.wellbore())
        );
    }

    static MaterialsTotals totals(List<PlanStep> steps) {
        int sacks = 0;
        double bbl = 0.0;
        for (PlanStep step : steps) {
            if (step.sacks() != null) {
                sacks += step.sacks();
            }
            Double stepBbl = WellFacts.toDouble(step.materials().get("total_bbl"));
            if (stepBbl != null) {
                bbl += stepBbl;
            }
        }
        return new MaterialsTotals(sacks, Capacities.round(bbl, 2));
    }

    private static List<RrcExportRow> exportRows(PlanningContext context, List<PlanStep> steps) {
        Double knob = context.knobs().tagWaitHours();
        List<RrcExportRow> rows = new ArrayList<>();
        int plugNo = 0;
        for (PlanStep step : steps) {
            plugNo++;
            StepType type = step.type();
            Double toFt = step.bottomFt() != null ? step.bottomFt() : step.topFt();
            rows.add(new RrcExportRow(
                plugNo,
                step.stepId(),
                type.exportLabel(),
                type.mechanicalType(),
                purpose(step),
                step.topFt(),
                toFt,
                step.sacks(),
                step.cementClass(),
                step.tagRequired() ? knob : null,
                step.tagRequired(),
                type.isCementBearing() ? step.topFt() : null,
                additional(step),
                step.regulatoryBasis().isEmpty() ? null : String.join("; ", step.regulatoryBasis())
            ));
        }
        return rows;
    }

    private static String purpose(PlanStep step) {
        String purpose = step.type().displayName();
        if (step.formation() != null) {
            purpose += " (" + step.formation() + ")";
        }
        return purpose;
    }

    private static List<String> additional(PlanStep step) {
        List<String> ops = new ArrayList<>();
        Map<String, Object> details = step.details();
        Object perforation = details.get(AnnularGapSqueezeRule.PERFORATION_INTERVAL);
        if (perforation instanceof List<?> pair && pair.size() == 2) {
            ops.add(String.format("Perforate %s-%s ft", feet(pair.get(0)), feet(pair.get(1))));
        }
        if (details.get("casing_cut_below_surface_ft") != null) {
            ops.add("Cut casing " + feet(details.get("casing_cut_below_surface_ft")) + " ft below surface");
        }
        if (Boolean.TRUE.equals(details.get("existing_cibp"))) {
            ops.add("Tag existing CIBP before spotting cap");
        }
        if (step.tagRequired() && details.get("verification") instanceof Map<?, ?> verification) {
            ops.add("Tag TOC after " + feet(verification.get("required_wait_hr")) + " hr WOC");
        }
        if (Boolean.TRUE.equals(details.get(SackFloor.APPLIED))) {
            ops.add("Raised to the " + SackFloor.MINIMUM_SACKS + " sack minimum");
        }
        if (Boolean.TRUE.equals(details.get(MergePostProcessor.MERGED))) {
            ops.add("Combined plug");
        }
        return ops;
    }

    private static List<String> formationsTargeted(List<PlanStep> steps) {
        List<String> formations = new ArrayList<>();
        for (PlanStep step : steps) {
            if (step.formation() != null && !formations.contains(step.formation())) {
                formations.add(step.formation());
            }
        }
        return formations;
    }

    private static List<String> notes(Wellbore well) {
        List<String> notes = new ArrayList<>();
        if (well.hasExistingCibp()) {
            notes.add(String.format("Existing CIBP at %s ft: tag and cap only; do not drill out.", feet(well.existingCibpFt())));
        }
        if (well.dvToolFt() != null) {
            notes.add(String.format("DV tool at %s ft: cement must isolate the stage collar.", feet(well.dvToolFt())));
        }
        return notes;
    }

    private static String feet(Object value) {
        Double number = WellFacts.toDouble(value);
        if (number == null) {
            return String.valueOf(value);
        }
        return number == Math.rint(number) ? String.valueOf(number.longValue()) : String.valueOf(number);
    }
}
