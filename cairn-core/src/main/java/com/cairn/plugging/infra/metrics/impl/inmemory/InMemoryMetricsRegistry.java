/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics.impl.inmemory;

import com.cairn.plugging.infra.metrics.Counter;
import com.cairn.plugging.infra.metrics.Gauge;
import com.cairn.plugging.infra.metrics.MetricsRegistry;
import com.cairn.plugging.infra.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every metric in memory. Each distinct tag set is its own series, keyed as
 * {@code name{label=value,...}}.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(seriesKey(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(seriesKey(name, tags), InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(seriesKey(name, tags), InMemoryTimer::new);
    }

    static String seriesKey(String name, String... tags) {
        if (tags.length < 2) {
            return name;
        }
        StringBuilder key = new StringBuilder(name).append('{');
        for (int i = 0; i + 1 < tags.length; i += 2) {
            if (i > 0) {
                key.append(',');
            }
            key.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return key.append('}').toString();
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(seriesKey(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(seriesKey(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(seriesKey(name, tags));
        return timer != null ? timer.getRecordings() : Collections.emptyList();
    }

    /**
     * Current values by series key: counts for counters and timers, values for gauges.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new TreeMap<>();
        counters.forEach((key, counter) -> snapshot.put(key, counter.count()));
        gauges.forEach((key, gauge) -> snapshot.put(key, gauge.value()));
        timers.forEach((key, timer) -> snapshot.put(key + ".count", timer.count()));
        return snapshot;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
