/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.materials;

import com.cairn.plugging.api.model.DepthInterval;

import java.util.List;

/**
 * Excess multipliers for cement squeezed behind pipe.
 */
public final class SqueezeFactors {

    /** Squeezes into open hole below the production shoe. */
    public static final double OPEN_HOLE = 2.0;
    /** Squeezes behind cased hole or inside a liner. */
    public static final double CASED = 1.5;
    /** Cement caps pumped inside casing, in both contexts. */
    public static final double CAP_EXCESS = 0.4;

    private SqueezeFactors() {
    }

    /**
     * True when a perforation bottom sits below the production shoe and outside every liner.
     * An unknown shoe depth is treated as cased.
     */
    public static boolean isOpenHole(double perforationBottomFt, Double productionShoeFt, List<DepthInterval> liners) {
        if (productionShoeFt == null || perforationBottomFt <= productionShoeFt) {
            return false;
        }
        for (DepthInterval liner : liners) {
            if (liner.contains(perforationBottomFt)) {
                return false;
            }
        }
        return true;
    }

    public static double forPerforation(double perforationBottomFt, Double productionShoeFt, List<DepthInterval> liners) {
        return isOpenHole(perforationBottomFt, productionShoeFt, liners) ? OPEN_HOLE : CASED;
    }
}
