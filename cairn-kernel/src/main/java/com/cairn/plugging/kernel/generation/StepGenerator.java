/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.generation;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.rules.AnnularGapSqueezeRule;
import com.cairn.plugging.kernel.generation.rules.BaselineScaffoldRule;
import com.cairn.plugging.kernel.generation.rules.CementClassRule;
import com.cairn.plugging.kernel.generation.rules.CibpDetectorRule;
import com.cairn.plugging.kernel.generation.rules.DistrictOverridesRule;
import com.cairn.plugging.kernel.generation.rules.FormationTopRule;
import com.cairn.plugging.kernel.generation.rules.MechanicalBarrierRule;
import com.cairn.plugging.kernel.generation.rules.OverlapSuppressionRule;
import com.cairn.plugging.kernel.generation.rules.PackerDvToolRule;
import com.cairn.plugging.kernel.generation.rules.StepsOverridesRule;
import com.cairn.plugging.kernel.generation.rules.TaggingRule;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Synthesizes the unordered step list for a well by running an ordered pipeline of
 * {@link StepRule}s.
 *
 * <p>Order matters: barrier gating runs before the CIBP detector and squeeze rules so
 * they can see an existing plug, and enrichment (overlap, tagging, cement class) runs
 * last over the complete list.
 */
public class StepGenerator {
    private static final Logger logger = Logger.getLogger(StepGenerator.class.getName());

    private final List<StepRule> rules;

    public StepGenerator() {
        this(defaultRules());
    }

    public StepGenerator(List<StepRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<StepRule> defaultRules() {
        return List.of(
            new BaselineScaffoldRule(),
            new StepsOverridesRule(),
            new MechanicalBarrierRule(),
            new CibpDetectorRule(),
            new AnnularGapSqueezeRule(),
            new PackerDvToolRule(),
            new FormationTopRule(),
            new DistrictOverridesRule(),
            new OverlapSuppressionRule(),
            new TaggingRule(),
            new CementClassRule()
        );
    }

    public List<StepRule> rules() {
        return rules;
    }

    public List<Step> generate(PlanningContext context) {
        List<Step> steps = new ArrayList<>();
        for (StepRule rule : rules) {
            int before = steps.size();
            steps = new ArrayList<>(rule.apply(context, steps));
            logger.finer(String.format("%s: %d -> %d steps", rule.name(), before, steps.size()));
        }
        return steps;
    }
}
