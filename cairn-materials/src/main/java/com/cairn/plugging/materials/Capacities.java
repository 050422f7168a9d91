/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.materials;

/**
 * Oilfield unit conversions and annular capacity.
 */
public final class Capacities {

    public static final double FT3_PER_BBL = 5.615;
    public static final double GAL_PER_BBL = 42.0;
    /** Conversion constant from in&sup2; to bbl/ft. */
    public static final double IN2_TO_BBL_PER_FT = 1029.4;

    private Capacities() {
    }

    /**
     * Annular capacity between two concentric diameters, in bbl/ft:
     * {@code pi/4 * (outer^2 - inner^2) / 1029.4}.
     *
     * @throws IllegalArgumentException if the inner diameter is not smaller than the outer one
     */
    public static double annularBblPerFt(double outerDiameterIn, double innerDiameterIn) {
        if (innerDiameterIn < 0 || outerDiameterIn <= innerDiameterIn) {
            throw new IllegalArgumentException(String.format(
                "Outer diameter %.3f in must exceed inner diameter %.3f in", outerDiameterIn, innerDiameterIn));
        }
        return Math.PI / 4.0 * (outerDiameterIn * outerDiameterIn - innerDiameterIn * innerDiameterIn)
            / IN2_TO_BBL_PER_FT;
    }

    public static double bblToFt3(double bbl) {
        return bbl * FT3_PER_BBL;
    }

    public static double galToBbl(double gallons) {
        return gallons / GAL_PER_BBL;
    }

    public static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
