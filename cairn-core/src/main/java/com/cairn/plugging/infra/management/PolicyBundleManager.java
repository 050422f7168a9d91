/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.management;

import com.cairn.plugging.api.exceptions.PolicyLoadException;
import com.cairn.plugging.api.model.PolicyBundle;
import com.cairn.plugging.infra.metrics.Gauge;
import com.cairn.plugging.infra.metrics.MetricsRegistry;
import com.cairn.plugging.policy.store.PolicyBundleSource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the active policy bundle and swaps it when the base pack's version changes.
 *
 * <p>Readers call {@link #current()} and always see one consistent, immutable bundle.
 * Loaded bundles are cached per version, so rolling back to a version seen earlier
 * does not re-parse the pack. A reload that fails leaves the previous bundle active.
 * Each activation updates the {@code policy_bundle_activated_at_seconds} and
 * {@code policy_bundle_cached_versions} gauges.
 */
public class PolicyBundleManager {
    private static final Logger logger = Logger.getLogger(PolicyBundleManager.class.getName());

    private static final int MAX_CACHED_VERSIONS = 8;

    private final PolicyBundleSource source;
    private final Tracer tracer;
    private final long checkIntervalSeconds;
    private final AtomicReference<PolicyBundle> activeBundle = new AtomicReference<>();
    private final Cache<String, PolicyBundle> bundlesByVersion;
    private final ScheduledExecutorService monitoringExecutor;
    private final Gauge activatedAt;
    private final Gauge cachedVersions;

    /**
     * Loads the initial bundle.
     *
     * @param checkIntervalSeconds seconds between version checks once started; 0 disables checking
     * @throws PolicyLoadException if the initial bundle cannot be loaded
     */
    public PolicyBundleManager(PolicyBundleSource source, Tracer tracer, long checkIntervalSeconds) {
        this(source, tracer, MetricsRegistry.getInstance(), checkIntervalSeconds);
    }

    public PolicyBundleManager(PolicyBundleSource source, Tracer tracer, MetricsRegistry metrics,
                               long checkIntervalSeconds) {
        Objects.requireNonNull(metrics, "metrics");
        this.source = Objects.requireNonNull(source, "source");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.checkIntervalSeconds = checkIntervalSeconds;
        this.bundlesByVersion = Caffeine.newBuilder()
            .maximumSize(MAX_CACHED_VERSIONS)
            .build();
        this.activatedAt = metrics.gauge("policy_bundle_activated_at_seconds");
        this.cachedVersions = metrics.gauge("policy_bundle_cached_versions");
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Policy-Version-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(); // Initial load, fail fast
    }

    public PolicyBundle current() {
        return activeBundle.get();
    }

    public PolicyBundleSource source() {
        return source;
    }

    public void start() {
        if (checkIntervalSeconds <= 0) {
            logger.info("Policy version checking disabled");
            return;
        }
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates,
            checkIntervalSeconds, checkIntervalSeconds, TimeUnit.SECONDS);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Forces a full reload regardless of version, replacing any cached copy.
     *
     * @throws PolicyLoadException if the bundle cannot be loaded; the old bundle stays active
     */
    public PolicyBundle reload() {
        Span span = tracer.spanBuilder("manual-policy-reload").startSpan();
        try (Scope scope = span.makeCurrent()) {
            PolicyBundle bundle = source.load();
            bundlesByVersion.put(bundle.version(), bundle);
            activate(bundle, span);
            return bundle;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-policy-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("policySource", source.describe());
            String version = source.currentVersion();
            PolicyBundle active = activeBundle.get();
            if (active == null || !Objects.equals(version, active.version())) {
                span.addEvent("Version change detected. Triggering reload.");
                logger.info(String.format("Policy version changed (%s -> %s). Attempting to reload...",
                    active == null ? "none" : active.version(), version));
                loadBundle(version);
            }
        } catch (PolicyLoadException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not read policy version from " + source.describe(), e);
        } catch (Exception e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during policy reload check.", e);
        } finally {
            span.end();
        }
    }

    private void loadBundle(String version) {
        try {
            PolicyBundle cached = version == null ? null : bundlesByVersion.getIfPresent(version);
            if (cached != null) {
                activeBundle.set(cached);
                recordActivation();
                logger.info("Swapped to cached policy version " + version);
                return;
            }
            reloadInternal();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to load new policy bundle. Old bundle remains active.", e);
        }
    }

    private void reloadInternal() {
        Span span = tracer.spanBuilder("load-policy-bundle").startSpan();
        try (Scope scope = span.makeCurrent()) {
            PolicyBundle bundle = source.load();
            bundlesByVersion.put(bundle.version(), bundle);
            activate(bundle, span);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void activate(PolicyBundle bundle, Span span) {
        activeBundle.set(bundle);
        recordActivation();
        span.setAttribute("policyId", bundle.policyId());
        span.setAttribute("policyVersion", String.valueOf(bundle.version()));
        span.setAttribute("districtOverlays", bundle.districtFiles().size());
        span.setAttribute("countyOverlays", bundle.countyFiles().size());
        logger.info(String.format("Activated policy %s version %s from %s",
            bundle.policyId(), bundle.version(), bundle.source()));
    }

    private void recordActivation() {
        activatedAt.set(System.currentTimeMillis() / 1000.0);
        cachedVersions.set(bundlesByVersion.estimatedSize());
    }
}
