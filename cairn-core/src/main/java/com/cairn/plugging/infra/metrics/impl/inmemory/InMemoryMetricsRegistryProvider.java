/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics.impl.inmemory;

import com.cairn.plugging.infra.metrics.MetricsRegistry;
import com.cairn.plugging.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory provider, registered from test resources so it outranks Prometheus there.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
