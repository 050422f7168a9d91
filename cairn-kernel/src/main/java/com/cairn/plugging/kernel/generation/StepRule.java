/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.kernel.PlanningContext;

import java.util.List;

/**
 * One regulatory rule of the step pipeline.
 *
 * <p>A rule receives the steps produced so far and returns the next step list. Rules may
 * add, drop or enrich steps, and report violations on the context; they never throw for
 * missing or inconsistent well data.
 */
@FunctionalInterface
public interface StepRule {

    List<Step> apply(PlanningContext context, List<Step> steps);

    default String name() {
        return getClass().getSimpleName();
    }
}
