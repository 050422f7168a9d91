/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.materials;

/**
 * Depth scaling of the slurry excess fraction: +10% of the excess per 1000 ft.
 */
public final class DepthExcess {

    public static final double SCALE_PER_1000_FT = 0.10;

    private DepthExcess() {
    }

    /**
     * Scales the excess fraction, not the volume: {@code excess * (1 + 0.10 * depth / 1000)}.
     */
    public static double scaled(double excess, double depthFt) {
        return excess * (1.0 + SCALE_PER_1000_FT * Math.max(0.0, depthFt) / 1000.0);
    }

    /**
     * Volume multiplier for a standard plug at the given depth.
     */
    public static double multiplier(double excess, double depthFt) {
        return 1.0 + scaled(excess, depthFt);
    }
}
