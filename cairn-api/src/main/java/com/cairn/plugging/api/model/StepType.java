/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of plugging operations a plan may contain.
 */
public enum StepType {
    SURFACE_CASING_SHOE_PLUG("surface_casing_shoe_plug", "Surface casing shoe plug", "Spot"),
    INTERMEDIATE_CASING_SHOE_PLUG("intermediate_casing_shoe_plug", "Intermediate casing shoe plug", "Spot"),
    UQW_ISOLATION_PLUG("uqw_isolation_plug", "Usable-quality water isolation plug", "Spot"),
    PRODUCTIVE_HORIZON_ISOLATION_PLUG("productive_horizon_isolation_plug", "Productive horizon isolation plug", "Spot"),
    FORMATION_TOP_PLUG("formation_top_plug", "Formation top plug", "Spot"),
    CEMENT_PLUG("cement_plug", "Cement plug", "Spot"),
    MECHANICAL_ISOLATION_PLUG("mechanical_isolation_plug", "Mechanical isolation plug", "Spot"),
    TOP_PLUG("top_plug", "Top plug", "Spot"),
    BRIDGE_PLUG("bridge_plug", "Cast-iron bridge plug", "CIBP"),
    BRIDGE_PLUG_CAP("bridge_plug_cap", "Cement cap on bridge plug", "CIBP cap"),
    CEMENT_RETAINER("cement_retainer", "Cement retainer", "Retainer"),
    PERFORATE_AND_SQUEEZE_PLUG("perforate_and_squeeze_plug", "Perforate and squeeze", "Perf & squeeze"),
    SQUEEZE("squeeze", "Squeeze", "Squeeze"),
    PERF_CIRCULATE("perf_circulate", "Perforate and circulate", "Perf & circulate");

    private final String value;
    private final String displayName;
    private final String mechanicalType;

    StepType(String value, String displayName, String mechanicalType) {
        this.value = value;
        this.displayName = displayName;
        this.mechanicalType = mechanicalType;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Operation label used on the regulatory form ("Spot", "CIBP", "Perf &amp; squeeze", ...).
     */
    public String mechanicalType() {
        return mechanicalType;
    }

    /**
     * Label written to the export row. Cement plug variants are filed under their own type name.
     */
    public String exportLabel() {
        return switch (this) {
            case BRIDGE_PLUG, BRIDGE_PLUG_CAP, PERFORATE_AND_SQUEEZE_PLUG, PERF_CIRCULATE -> mechanicalType;
            default -> value;
        };
    }

    /** Mechanical devices set at a single depth. */
    public boolean isPointDevice() {
        return this == BRIDGE_PLUG || this == CEMENT_RETAINER;
    }

    public boolean isCementBearing() {
        return !isPointDevice();
    }

    /** Steps never raised to the minimum sack count. */
    public boolean isSackFloorExempt() {
        return this == BRIDGE_PLUG || this == CEMENT_RETAINER || this == BRIDGE_PLUG_CAP;
    }

    /** Steps whose interval isolates by squeezing cement behind pipe. */
    public boolean isSqueezeFamily() {
        return this == PERFORATE_AND_SQUEEZE_PLUG || this == SQUEEZE || this == PERF_CIRCULATE;
    }

    @JsonCreator
    public static StepType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Step type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("cibp_cap") || normalized.equals("cibp_cap_plug")) {
            return BRIDGE_PLUG_CAP;
        }
        if (normalized.equals("cibp")) {
            return BRIDGE_PLUG;
        }
        for (StepType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + value);
    }
}
