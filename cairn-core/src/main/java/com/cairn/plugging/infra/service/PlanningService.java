/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.service;

import com.cairn.plugging.api.IPlanCompiler;
import com.cairn.plugging.api.IPolicyResolver;
import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.Plan;
import com.cairn.plugging.api.model.PlanOptions;
import com.cairn.plugging.api.model.PolicyBundle;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.infra.management.PolicyBundleManager;
import com.cairn.plugging.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Resolves the policy for a well and compiles its plan against the active bundle.
 *
 * <p>Thread-safe: the bundle is read once per call from the manager and the resolver
 * and compiler keep no per-call state.
 */
public class PlanningService {
    private static final Logger logger = Logger.getLogger(PlanningService.class.getName());

    public static final String METRIC_PLANS_COMPILED = "plans_compiled";
    public static final String METRIC_PLAN_VIOLATIONS = "plan_violations";
    public static final String METRIC_PLAN_COMPILE = "plan_compile";
    public static final String METRIC_POLICY_INCOMPLETE = "policy_incomplete";

    private final PolicyBundleManager bundleManager;
    private final IPolicyResolver resolver;
    private final IPlanCompiler compiler;
    private final MetricsRegistry metrics;
    private final Tracer tracer;

    public PlanningService(PolicyBundleManager bundleManager, IPolicyResolver resolver, IPlanCompiler compiler,
                           MetricsRegistry metrics, Tracer tracer) {
        this.bundleManager = Objects.requireNonNull(bundleManager, "bundleManager");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * Compiles a plan, taking the jurisdiction from the {@code district}, {@code county}
     * and {@code field} facts.
     */
    public Plan plan(Map<String, Fact> facts, PlanOptions options) {
        Span span = tracer.spanBuilder("plan-well").startSpan();
        try (Scope scope = span.makeCurrent()) {
            WellFacts wellFacts = WellFacts.of(facts);
            String api14 = wellFacts.text("api14");
            if (api14 != null) span.setAttribute("api14", api14);

            long start = System.nanoTime();
            EffectivePolicy policy = resolve(wellFacts.text("district"), wellFacts.text("county"), wellFacts.text("field"));
            Plan plan = compiler.compile(wellFacts.asMap(), policy, options);
            long elapsed = System.nanoTime() - start;

            metrics.timer(METRIC_PLAN_COMPILE).record(Duration.ofNanos(elapsed));
            metrics.counter(METRIC_PLANS_COMPILED).increment();
            if (!plan.policyComplete()) {
                metrics.counter(METRIC_POLICY_INCOMPLETE).increment();
            }
            for (Violation violation : plan.violations()) {
                metrics.counter(METRIC_PLAN_VIOLATIONS, "rule_id", violation.ruleId()).increment();
            }

            span.setAttribute("stepCount", plan.steps().size());
            span.setAttribute("violationCount", plan.violations().size());
            logger.fine(() -> String.format("Compiled plan for %s: %d steps, %d violations in %.2f ms",
                api14, plan.steps().size(), plan.violations().size(), elapsed / 1_000_000.0));
            return plan;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public EffectivePolicy resolve(String district, String county, String field) {
        PolicyBundle bundle = bundleManager.current();
        return resolver.resolve(bundle, district, county, field);
    }

    public PolicyBundle activeBundle() {
        return bundleManager.current();
    }

    /**
     * Converts a JSON facts object into {@link Fact}s. An entry may be a full fact
     * object (with a {@code value} member) or a bare value.
     */
    public static Map<String, Fact> toFacts(Map<String, Object> raw) {
        Map<String, Fact> facts = new LinkedHashMap<>();
        if (raw == null) {
            return facts;
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> map && map.containsKey("value")) {
                facts.put(key, new Fact(
                    key,
                    map.get("value"),
                    map.get("units") != null ? String.valueOf(map.get("units")) : null,
                    map.get("source") != null ? String.valueOf(map.get("source")) : null,
                    WellFacts.toDouble(map.get("confidence"))));
            } else {
                facts.put(key, Fact.of(key, value));
            }
        }
        return facts;
    }
}
