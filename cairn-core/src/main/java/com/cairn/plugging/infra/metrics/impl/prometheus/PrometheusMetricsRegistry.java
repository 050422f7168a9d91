/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics.impl.prometheus;

import com.cairn.plugging.infra.metrics.Counter;
import com.cairn.plugging.infra.metrics.Gauge;
import com.cairn.plugging.infra.metrics.MetricsRegistry;
import com.cairn.plugging.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsRegistry} backed by the Prometheus simpleclient. One collector is
 * registered per metric name; each tag set binds its own child.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counterCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gaugeCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Histogram> timerCollectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(seriesKey(name, tags), key -> {
            io.prometheus.client.Counter collector = counterCollectors.computeIfAbsent(name, n ->
                io.prometheus.client.Counter.build()
                    .name(sanitizeName(n))
                    .help("Counter " + n)
                    .labelNames(extractLabelNames(tags))
                    .register(registry));
            return new PrometheusCounterAdapter(collector, extractLabelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(seriesKey(name, tags), key -> {
            io.prometheus.client.Gauge collector = gaugeCollectors.computeIfAbsent(name, n ->
                io.prometheus.client.Gauge.build()
                    .name(sanitizeName(n))
                    .help("Gauge " + n)
                    .labelNames(extractLabelNames(tags))
                    .register(registry));
            return new PrometheusGaugeAdapter(collector, extractLabelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(seriesKey(name, tags), key -> {
            io.prometheus.client.Histogram collector = timerCollectors.computeIfAbsent(name, n ->
                io.prometheus.client.Histogram.build()
                    .name(sanitizeName(n) + "_seconds")
                    .help("Timer " + n)
                    .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
                    .labelNames(extractLabelNames(tags))
                    .register(registry));
            return new PrometheusTimerAdapter(collector, extractLabelValues(tags));
        });
    }

    /**
     * Renders every registered metric in the Prometheus text exposition format.
     */
    public String scrape() throws IOException {
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        return writer.toString();
    }

    public CollectorRegistry collectorRegistry() {
        return registry;
    }

    private static String seriesKey(String name, String[] tags) {
        return name + Arrays.toString(tags);
    }

    private static String sanitizeName(String name) {
        return name.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9_:]", "_")
            .replaceAll("_{2,}", "_");
    }

    private static String[] extractLabelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] extractLabelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
