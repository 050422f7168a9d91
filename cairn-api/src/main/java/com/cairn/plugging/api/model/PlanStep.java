/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An assembled, immutable plan step with its sequential identifier.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanStep(
    @JsonProperty("step_id") int stepId,
    @JsonProperty("type") StepType type,
    @JsonProperty("top_ft") Double topFt,
    @JsonProperty("bottom_ft") Double bottomFt,
    @JsonProperty("formation") String formation,
    @JsonProperty("cement_class") String cementClass,
    @JsonProperty("sacks") Integer sacks,
    @JsonProperty("tag_required") boolean tagRequired,
    @JsonProperty("regulatory_basis") List<String> regulatoryBasis,
    @JsonProperty("details") Map<String, Object> details,
    @JsonProperty("materials") Map<String, Object> materials
) {

    public PlanStep {
        regulatoryBasis = regulatoryBasis == null ? List.of() : List.copyOf(regulatoryBasis);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        materials = materials == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(materials));
    }

    public static PlanStep from(int stepId, Step step) {
        return new PlanStep(
            stepId,
            step.getType(),
            step.getTopFt(),
            step.getBottomFt(),
            step.getFormation(),
            step.getCementClass(),
            step.getSacks(),
            step.isTagRequired(),
            step.getRegulatoryBasis(),
            step.getDetails(),
            step.getMaterials()
        );
    }
}
