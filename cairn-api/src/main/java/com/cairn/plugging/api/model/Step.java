/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A plugging operation under construction.
 *
 * <p>Created by the step generator and enriched in place by materials computation and
 * the merge post-processor. Once a plan is assembled each step is frozen into a
 * {@link PlanStep}. Depths are measured depth in feet with {@code topFt <= bottomFt};
 * point devices (bridge plugs, retainers) carry only {@code topFt}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "top_ft", "bottom_ft", "formation", "cement_class", "sacks",
    "tag_required", "regulatory_basis", "details", "materials"})
public class Step {

    private final StepType type;
    private Double topFt;
    private Double bottomFt;
    private String formation;
    private String cementClass;
    private Integer sacks;
    private boolean tagRequired;
    private final List<String> regulatoryBasis = new ArrayList<>();
    private final Map<String, Object> details = new LinkedHashMap<>();
    private final Map<String, Object> materials = new LinkedHashMap<>();

    public Step(StepType type, Double topFt, Double bottomFt) {
        this.type = type;
        setInterval(topFt, bottomFt);
    }

    public static Step interval(StepType type, double topFt, double bottomFt) {
        return new Step(type, topFt, bottomFt);
    }

    public static Step point(StepType type, double depthFt) {
        return new Step(type, depthFt, null);
    }

    @JsonProperty("type")
    public StepType getType() {
        return type;
    }

    @JsonProperty("top_ft")
    public Double getTopFt() {
        return topFt;
    }

    @JsonProperty("bottom_ft")
    public Double getBottomFt() {
        return bottomFt;
    }

    public final void setInterval(Double top, Double bottom) {
        if (top != null && bottom != null && top > bottom) {
            this.topFt = bottom;
            this.bottomFt = top;
        } else {
            this.topFt = top;
            this.bottomFt = bottom;
        }
    }

    @JsonProperty("formation")
    public String getFormation() {
        return formation;
    }

    public Step setFormation(String formation) {
        this.formation = formation;
        return this;
    }

    @JsonProperty("cement_class")
    public String getCementClass() {
        return cementClass;
    }

    public void setCementClass(String cementClass) {
        this.cementClass = cementClass;
    }

    @JsonProperty("sacks")
    public Integer getSacks() {
        return sacks;
    }

    public void setSacks(Integer sacks) {
        this.sacks = sacks;
    }

    @JsonProperty("tag_required")
    public boolean isTagRequired() {
        return tagRequired;
    }

    public Step setTagRequired(boolean tagRequired) {
        this.tagRequired = tagRequired;
        return this;
    }

    @JsonProperty("regulatory_basis")
    public List<String> getRegulatoryBasis() {
        return regulatoryBasis;
    }

    /**
     * Appends citations, skipping blanks and duplicates while keeping first-seen order.
     */
    public Step cite(Collection<String> citations) {
        for (String citation : citations) {
            if (citation != null && !citation.isBlank() && !regulatoryBasis.contains(citation)) {
                regulatoryBasis.add(citation);
            }
        }
        return this;
    }

    public Step cite(String... citations) {
        return cite(List.of(citations));
    }

    @JsonProperty("details")
    public Map<String, Object> getDetails() {
        return details;
    }

    public Step detail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public boolean hasDetailFlag(String key) {
        return Boolean.TRUE.equals(details.get(key));
    }

    @JsonProperty("materials")
    public Map<String, Object> getMaterials() {
        return materials;
    }

    /** Deepest depth this step reaches. */
    public double deepestFt() {
        return bottomFt != null ? bottomFt : topFt;
    }

    @JsonIgnore
    public boolean isPoint() {
        return bottomFt == null;
    }

    /** Interval length, or zero for point devices. */
    public double lengthFt() {
        return bottomFt == null ? 0.0 : bottomFt - topFt;
    }

    public DepthInterval span() {
        return new DepthInterval(topFt, deepestFt());
    }

    /**
     * True when this step's interval fully encloses {@code other}'s interval.
     */
    public boolean encloses(Step other) {
        return span().contains(other.span());
    }

    public boolean spans(double depthFt) {
        return span().contains(depthFt);
    }

    public Step copy() {
        Step copy = new Step(type, topFt, bottomFt);
        copy.formation = formation;
        copy.cementClass = cementClass;
        copy.sacks = sacks;
        copy.tagRequired = tagRequired;
        copy.regulatoryBasis.addAll(regulatoryBasis);
        copy.details.putAll(details);
        copy.materials.putAll(materials);
        return copy;
    }

    @Override
    public String toString() {
        return String.format("Step[%s %s-%s]", type.value(), topFt, bottomFt);
    }
}
