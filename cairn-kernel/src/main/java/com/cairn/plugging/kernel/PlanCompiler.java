/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel;

import com.cairn.plugging.api.IPlanCompiler;
import com.cairn.plugging.api.PlanningListener;
import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.Plan;
import com.cairn.plugging.api.model.PlanOptions;
import com.cairn.plugging.api.model.PolicyKnobs;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.kernel.assembly.PlanAssembler;
import com.cairn.plugging.kernel.generation.StepGenerator;
import com.cairn.plugging.kernel.materials.CementClassSelector;
import com.cairn.plugging.kernel.materials.MaterialsApplicator;
import com.cairn.plugging.kernel.merge.MergePostProcessor;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles well facts and an effective policy into a {@link Plan}.
 *
 * <p>The pipeline runs four stages in order, each in its own span:
 * <ol>
 *   <li>GENERATION: the {@link StepGenerator} rule pipeline</li>
 *   <li>MATERIALS: volumes, sacks and the minimum-sack floor</li>
 *   <li>MERGE: long-plug merging, when enabled by policy or options</li>
 *   <li>ASSEMBLY: ordering, ids, totals and export rows</li>
 * </ol>
 *
 * <p>Compilation is a pure function of its inputs; all per-call state lives in a
 * {@link PlanningContext}, so one compiler may serve concurrent calls.
 */
public class PlanCompiler implements IPlanCompiler {
    private static final Logger logger = Logger.getLogger(PlanCompiler.class.getName());

    public static final String KERNEL_VERSION = "cairn-kernel/1.0";

    static final String STAGE_GENERATION = "GENERATION";
    static final String STAGE_MATERIALS = "MATERIALS";
    static final String STAGE_MERGE = "MERGE";
    static final String STAGE_ASSEMBLY = "ASSEMBLY";
    private static final int TOTAL_STAGES = 4;

    private final StepGenerator generator;
    private final MaterialsApplicator materials;
    private final MergePostProcessor merger;
    private final PlanAssembler assembler;
    private volatile Tracer tracer;
    private volatile PlanningListener listener;

    public PlanCompiler(Tracer tracer) {
        this(tracer, new StepGenerator(), new MaterialsApplicator());
    }

    public PlanCompiler(Tracer tracer, StepGenerator generator, MaterialsApplicator materials) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.generator = generator;
        this.materials = materials;
        this.merger = new MergePostProcessor();
        this.assembler = new PlanAssembler(KERNEL_VERSION);
    }

    public PlanCompiler() {
        this(OpenTelemetry.noop().getTracer("cairn-kernel"));
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setPlanningListener(PlanningListener listener) {
        this.listener = listener;
    }

    @Override
    public Plan compile(Map<String, Fact> facts, EffectivePolicy policy, PlanOptions options) {
        PlanOptions opts = options != null ? options : PlanOptions.defaults();
        Span span = tracer.spanBuilder("compile-plan").startSpan();
        try (Scope scope = span.makeCurrent()) {
            PlanningContext context = new PlanningContext(facts, policy);
            span.setAttribute("policyId", String.valueOf(policy.policyId()));
            if (context.district() != null) span.setAttribute("district", context.district());
            String api14 = context.facts().text("api14");
            if (api14 != null) span.setAttribute("api14", api14);

            AtomicReference<List<Step>> steps = new AtomicReference<>();

            runStage(STAGE_GENERATION, 1, "generate-steps", () -> {
                steps.set(generator.generate(context));
                return Map.of("stepCount", steps.get().size());
            });

            runStage(STAGE_MATERIALS, 2, "compute-materials", () -> {
                int computed = materials.apply(context, steps.get());
                return Map.of("computedCount", computed);
            });

            runStage(STAGE_MERGE, 3, "merge-plugs", () -> {
                int before = steps.get().size();
                steps.set(merge(context, steps.get(), opts));
                return Map.of("mergedCount", before - steps.get().size());
            });

            AtomicReference<Plan> plan = new AtomicReference<>();
            runStage(STAGE_ASSEMBLY, 4, "assemble-plan", () -> {
                plan.set(assembler.assemble(context, steps.get()));
                return Map.of("stepCount", plan.get().steps().size(),
                    "violationCount", plan.get().violations().size());
            });

            span.setAttribute("stepCount", plan.get().steps().size());
            span.setAttribute("violationCount", plan.get().violations().size());
            span.setAttribute("totalSacks", plan.get().materialsTotals().totalSacks());
            logger.fine(String.format("Compiled plan for %s: %d steps, %d violations",
                api14, plan.get().steps().size(), plan.get().violations().size()));
            return plan.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<Step> merge(PlanningContext context, List<Step> steps, PlanOptions options) {
        PolicyKnobs.LongPlugMerge prefs = context.knobs().longPlugMerge();
        boolean enabled = options.mergeAdjacent() != null ? options.mergeAdjacent() : prefs.enabled();
        if (!enabled) {
            return steps;
        }
        double threshold = options.mergeThresholdFt() != null ? options.mergeThresholdFt() : prefs.thresholdFt();
        List<String> typeNames = options.mergeTypes() != null && !options.mergeTypes().isEmpty()
            ? options.mergeTypes() : prefs.types();
        List<StepType> types = new ArrayList<>();
        for (String name : typeNames) {
            try {
                types.add(StepType.fromValue(name));
            } catch (IllegalArgumentException e) {
                logger.warning("Ignoring unknown merge type: " + name);
            }
        }

        List<Step> merged = merger.mergeAdjacent(steps, threshold, types);
        CementClassSelector selector = new CementClassSelector(context.knobs());
        for (Step step : merged) {
            if (step.hasDetailFlag(MergePostProcessor.MERGED) && step.getSacks() == null && step.getMaterials().isEmpty()) {
                step.setCementClass(selector.select(step));
                materials.recompute(context, step);
            }
        }
        return merged;
    }

    private void runStage(String stageName, int stageNumber, String spanName, Supplier<Map<String, Object>> body) {
        PlanningListener current = listener;
        if (current != null) {
            current.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        Span span = tracer.spanBuilder(spanName).startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            Map<String, Object> metrics = new LinkedHashMap<>(body.get());
            if (current != null) {
                current.onStageComplete(stageName,
                    new PlanningListener.StageResult(stageName, System.nanoTime() - start, metrics));
            }
        } catch (RuntimeException e) {
            span.recordException(e);
            if (current != null) {
                current.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }
}
