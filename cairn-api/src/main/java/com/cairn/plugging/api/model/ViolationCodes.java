/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

/**
 * Stable rule identifiers carried by {@link Violation#ruleId()}.
 */
public final class ViolationCodes {

    public static final String POLICY_INCOMPLETE = "POLICY_INCOMPLETE";
    public static final String SURFACE_SHOE_DEPTH_UNKNOWN = "SURFACE_SHOE_DEPTH_UNKNOWN";
    public static final String INSUFFICIENT_SHOE_COVERAGE = "INSUFFICIENT_SHOE_COVERAGE";
    public static final String DUQW_ISOLATION_MISSING = "DUQW_ISOLATION_MISSING";
    public static final String UQW_DEPTH_UNKNOWN = "UQW_DEPTH_UNKNOWN";
    public static final String PRODUCTION_SHOE_DEPTH_UNKNOWN = "PRODUCTION_SHOE_DEPTH_UNKNOWN";
    public static final String MATERIALS_GEOMETRY_MISSING = "MATERIALS_GEOMETRY_MISSING";
    public static final String CIBP_CAP_SYNTHESIZED = "CIBP_CAP_SYNTHESIZED";
    public static final String STEP_SUPPRESSED_BELOW_CIBP = "STEP_SUPPRESSED_BELOW_CIBP";
    public static final String FORMATION_TOP_UNRESOLVED = "FORMATION_TOP_UNRESOLVED";

    private ViolationCodes() {
    }
}
