/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api;

import java.util.Map;

/**
 * Callback interface for plan compilation stage events.
 *
 * <p>The planning pipeline runs these stages in order:
 * <ol>
 *   <li>GENERATION - synthesize steps from facts and policy</li>
 *   <li>MATERIALS - compute volumes, sacks and the minimum-sack floor</li>
 *   <li>MERGE - coalesce adjacent plugs (skipped unless enabled)</li>
 *   <li>ASSEMBLY - order steps, total materials, build export rows</li>
 * </ol>
 */
public interface PlanningListener {

    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails unexpectedly. Per-well data problems are not errors.
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single planning stage.
     *
     * @param stageName name of the stage
     * @param durationNanos duration in nanoseconds
     * @param metrics stage-specific metrics (e.g. "stepCount", "mergedCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
