/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.materials;

import com.cairn.plugging.api.model.Step;

import java.util.List;

/**
 * Texas minimum of 25 sacks per cement plug. Bridge plugs, retainers, CIBP caps and steps
 * with manual materials are exempt.
 */
public final class SackFloor {

    public static final int MINIMUM_SACKS = 25;
    public static final String APPLIED = "texas_25_sack_minimum_applied";
    public static final String ORIGINAL = "original_calculated_sacks";

    private SackFloor() {
    }

    public static int apply(List<Step> steps) {
        int raised = 0;
        for (Step step : steps) {
            if (apply(step)) {
                raised++;
            }
        }
        return raised;
    }

    /**
     * @return true when the step was raised to the floor
     */
    public static boolean apply(Step step) {
        if (!step.getType().isCementBearing() || step.getType().isSackFloorExempt()
            || step.hasDetailFlag(MaterialsApplicator.MATERIALS_OVERRIDE)) {
            return false;
        }
        Integer sacks = step.getSacks();
        if (sacks == null || sacks >= MINIMUM_SACKS) {
            return false;
        }
        step.detail(ORIGINAL, sacks).detail(APPLIED, true);
        step.setSacks(MINIMUM_SACKS);
        return true;
    }
}
