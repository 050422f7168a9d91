/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api;

import com.cairn.plugging.api.model.Geometry;
import com.cairn.plugging.api.model.MaterialsResult;
import com.cairn.plugging.api.model.SlurryRecipe;
import com.cairn.plugging.api.model.Step;

/**
 * Pure cement volume and sack arithmetic.
 */
public interface IMaterialsEngine {

    /**
     * Computes the cement needed for a step. Returns a result with {@code sacks == null}
     * when the geometry is incomplete; volumes are never guessed.
     */
    MaterialsResult computeSacks(Step step, Geometry geometry, SlurryRecipe recipe);
}
