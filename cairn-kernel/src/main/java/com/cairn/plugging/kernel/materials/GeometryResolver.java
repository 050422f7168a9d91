/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.materials;

import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.Geometry;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.kernel.Wellbore;
import com.cairn.plugging.kernel.generation.rules.AnnularGapSqueezeRule;
import com.cairn.plugging.materials.SqueezeFactors;

/**
 * Works out the annulus a step's cement fills.
 *
 * <p>Cased work fills the space between casing ID and the stinger. Open-hole squeezes fill
 * the space between the drilled hole and the casing OD; with no hole size on record the
 * hole is estimated at casing OD plus 2 in and flagged {@code open_hole_estimated}.
 */
public class GeometryResolver {

    public static final double OPEN_HOLE_ESTIMATE_IN = 2.0;

    private final Wellbore well;

    public GeometryResolver(Wellbore well) {
        this.well = well;
    }

    /**
     * @return the geometry, or {@code null} for point devices that take no cement
     */
    public Geometry resolve(Step step) {
        StepType type = step.getType();
        if (!type.isCementBearing()) {
            return null;
        }
        if (type == StepType.PERFORATE_AND_SQUEEZE_PLUG || type == StepType.SQUEEZE) {
            return squeeze(step);
        }
        double depthFt = step.deepestFt();
        if (well.isOpenHole(depthFt)) {
            return new Geometry(well.holeSizeIn(), well.stingerOdIn(), Geometry.OPEN_HOLE, null);
        }
        return Geometry.cased(well.casingIdAt(depthFt), well.stingerOdIn());
    }

    private Geometry squeeze(Step step) {
        DepthInterval perforation = WellFacts.toInterval(step.getDetails().get(AnnularGapSqueezeRule.PERFORATION_INTERVAL));
        if (perforation == null) {
            perforation = step.span();
        }
        Object declared = step.getDetails().get(AnnularGapSqueezeRule.SQUEEZE_CONTEXT);
        boolean openHole = declared != null
            ? Geometry.OPEN_HOLE.equals(declared)
            : well.isOpenHole(perforation.bottomFt());

        if (!openHole) {
            return new Geometry(well.casingIdAt(perforation.topFt()), well.stingerOdIn(), Geometry.CASED,
                SqueezeFactors.CASED);
        }
        Double casingOd = well.productionCasingOdIn();
        if (well.holeSizeIn() != null) {
            return new Geometry(well.holeSizeIn(), casingOd, Geometry.OPEN_HOLE, SqueezeFactors.OPEN_HOLE);
        }
        Double estimate = casingOd != null ? casingOd + OPEN_HOLE_ESTIMATE_IN : null;
        return new Geometry(estimate, casingOd, Geometry.OPEN_HOLE_ESTIMATED, SqueezeFactors.OPEN_HOLE);
    }
}
