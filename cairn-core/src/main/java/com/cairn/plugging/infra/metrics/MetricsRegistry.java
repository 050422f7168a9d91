/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics;

import com.cairn.plugging.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Registry of named metrics. Tags are alternating label names and values,
 * e.g. {@code counter("plan_violations", "rule_id", "POLICY_INCOMPLETE")}.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Process-wide registry chosen through {@link java.util.ServiceLoader}.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
