/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api;

import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.Plan;
import com.cairn.plugging.api.model.PlanOptions;

import io.opentelemetry.api.trace.Tracer;
import java.util.Map;

/**
 * Contract for compiling well facts and a resolved policy into a plugging plan.
 */
public interface IPlanCompiler {

    /**
     * Compiles a plan. Per-well data problems are reported as violations on the
     * returned plan and never thrown.
     *
     * @param facts well facts keyed by fact name
     * @param policy resolved effective policy
     * @param options per-call overrides
     * @return the assembled plan
     */
    Plan compile(Map<String, Fact> facts, EffectivePolicy policy, PlanOptions options);

    default Plan compile(Map<String, Fact> facts, EffectivePolicy policy) {
        return compile(facts, policy, PlanOptions.defaults());
    }

    /**
     * Sets the tracer for observability.
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener for tracking pipeline progress.
     *
     * @param listener the planning listener (null to disable)
     */
    default void setPlanningListener(PlanningListener listener) {
    }
}
