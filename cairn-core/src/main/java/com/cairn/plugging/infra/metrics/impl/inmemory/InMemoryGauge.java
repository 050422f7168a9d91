/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics.impl.inmemory;

import com.cairn.plugging.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicReference;

final class InMemoryGauge implements Gauge {

    private final String name;
    private final AtomicReference<Double> value = new AtomicReference<>(0.0);

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double newValue) {
        value.set(newValue);
    }

    @Override
    public double value() {
        return value.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%.2f}", name, value());
    }
}
