/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics.internal;

import com.cairn.plugging.infra.metrics.MetricsRegistry;
import com.cairn.plugging.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the singleton {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b>
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE;

    static {
        ServiceLoader<MetricsRegistryProvider> loader = ServiceLoader.load(MetricsRegistryProvider.class);

        MetricsRegistryProvider provider = StreamSupport.stream(loader.spliterator(), false)
            .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
            .orElse(null);

        if (provider != null) {
            INSTANCE = provider.create();
            logger.info(String.format("Metrics provider: %s (priority %d)", provider.name(), provider.priority()));
        } else {
            INSTANCE = new NoOpMetricsRegistry();
            logger.info("No metrics provider found, using no-op registry");
        }
    }

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }
}
