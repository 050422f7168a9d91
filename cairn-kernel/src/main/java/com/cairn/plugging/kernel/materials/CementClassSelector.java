/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.materials;

import com.cairn.plugging.api.model.PolicyKnobs;
import com.cairn.plugging.api.model.Step;

/**
 * Picks shallow or deep cement by comparing a step's midpoint with the policy cutoff.
 * Midpoints at or below the cutoff get the deep class.
 */
public class CementClassSelector {

    private final Double cutoffFt;
    private final String shallowClass;
    private final String deepClass;

    public CementClassSelector(PolicyKnobs knobs) {
        this.cutoffFt = knobs.cementCutoffFt();
        this.shallowClass = knobs.shallowClass();
        this.deepClass = knobs.deepClass();
    }

    public String select(Step step) {
        if (!step.getType().isCementBearing()) {
            return null;
        }
        if (cutoffFt == null) {
            return shallowClass != null ? shallowClass : deepClass;
        }
        return step.span().midpointFt() >= cutoffFt ? deepClass : shallowClass;
    }
}
