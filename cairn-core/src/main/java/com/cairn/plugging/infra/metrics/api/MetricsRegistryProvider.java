/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics.api;

import com.cairn.plugging.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations need a public no-arg constructor and are listed in
 * {@code META-INF/services/com.cairn.plugging.infra.metrics.api.MetricsRegistryProvider}.
 * When several are present the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
