/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The compiled plugging plan for one well: the root output of a planning call.
 *
 * <p>Plans are values. Steps are ordered deepest first with sequential ids and
 * export rows follow the same order. Changing a plan means compiling a new one.
 */
public record Plan(
    @JsonProperty("kernel_version") String kernelVersion,
    @JsonProperty("api14") String api14,
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("policy_version") String policyVersion,
    @JsonProperty("jurisdiction") String jurisdiction,
    @JsonProperty("district") String district,
    @JsonProperty("county") String county,
    @JsonProperty("field") String field,
    @JsonProperty("field_resolution") FieldResolution fieldResolution,
    @JsonProperty("policy_complete") boolean policyComplete,
    @JsonProperty("steps") List<PlanStep> steps,
    @JsonProperty("violations") List<Violation> violations,
    @JsonProperty("materials_totals") MaterialsTotals materialsTotals,
    @JsonProperty("rrc_export") List<RrcExportRow> rrcExport,
    @JsonProperty("formations_targeted") List<String> formationsTargeted,
    @JsonProperty("formation_tops_detected") List<String> formationTopsDetected,
    @JsonProperty("notes") List<String> notes
) {

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        violations = violations == null ? List.of() : List.copyOf(violations);
        rrcExport = rrcExport == null ? List.of() : List.copyOf(rrcExport);
        formationsTargeted = formationsTargeted == null ? List.of() : List.copyOf(formationsTargeted);
        formationTopsDetected = formationTopsDetected == null ? List.of() : List.copyOf(formationTopsDetected);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public boolean hasViolation(String ruleId) {
        return violations.stream().anyMatch(v -> v.ruleId().equals(ruleId));
    }

    public List<PlanStep> stepsOfType(StepType type) {
        return steps.stream().filter(s -> s.type() == type).toList();
    }
}
