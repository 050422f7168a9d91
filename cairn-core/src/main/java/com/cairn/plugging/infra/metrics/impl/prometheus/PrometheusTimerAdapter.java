/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics.impl.prometheus;

import com.cairn.plugging.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram observed in seconds.
 *
 * <p>Percentiles are computed server-side with {@code histogram_quantile()}, so
 * {@link #percentile(double)} is not supported here.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(
            "Percentiles are computed by the Prometheus server: histogram_quantile(%.2f, ...)", percentile));
    }
}
