/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * One row of the W-3A plugging record, in filing order.
 *
 * <p>{@code fromFt} is the bottom of the plug and {@code toFt} its top, matching the form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RrcExportRow(
    @JsonProperty("plug_no") int plugNo,
    @JsonProperty("step_id") int stepId,
    @JsonProperty("type") String type,
    @JsonProperty("mechanical_type") String mechanicalType,
    @JsonProperty("regulatory_purpose") String regulatoryPurpose,
    @JsonProperty("from_ft") Double fromFt,
    @JsonProperty("to_ft") Double toFt,
    @JsonProperty("sacks") Integer sacks,
    @JsonProperty("cement_class") String cementClass,
    @JsonProperty("wait_hours") Double waitHours,
    @JsonProperty("tag_required") boolean tagRequired,
    @JsonProperty("toc_ft") Double tocFt,
    @JsonProperty("additional") List<String> additional,
    @JsonProperty("remarks") String remarks
) implements Serializable {

    public RrcExportRow {
        additional = additional == null ? List.of() : List.copyOf(additional);
    }
}
