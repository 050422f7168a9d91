package com.cairn.plugging.infra.metrics.impl.inmemory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class InMemoryMetricsRegistryTest {

    private InMemoryMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryMetricsRegistry();
    }

    @Test
    void countersWithDifferentTagsAreSeparateSeries() {
        registry.counter("plan_violations", "rule_id", "POLICY_INCOMPLETE").increment();
        registry.counter("plan_violations", "rule_id", "UQW_DEPTH_UNKNOWN").increment(3);
        registry.counter("plan_violations", "rule_id", "POLICY_INCOMPLETE").increment();

        assertThat(registry.getCounterValue("plan_violations", "rule_id", "POLICY_INCOMPLETE")).isEqualTo(2);
        assertThat(registry.getCounterValue("plan_violations", "rule_id", "UQW_DEPTH_UNKNOWN")).isEqualTo(3);
        assertThat(registry.getCounterValue("plan_violations")).isZero();
    }

    @Test
    void sameNameAndTagsReturnSameInstance() {
        assertThat(registry.counter("plans_compiled")).isSameAs(registry.counter("plans_compiled"));
        assertThat(registry.timer("plan_compile")).isSameAs(registry.timer("plan_compile"));
    }

    @Test
    void timerRecordsDurationsAndCallables() throws Exception {
        registry.timer("plan_compile").record(Duration.ofMillis(5));
        String result = registry.timer("plan_compile").record(() -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(registry.getTimerRecordings("plan_compile")).hasSize(2).contains(Duration.ofMillis(5));
    }

    @Test
    void snapshotIsKeyedBySeries() {
        registry.counter("plans_compiled").increment();
        registry.counter("plan_violations", "rule_id", "X").increment();
        registry.gauge("policy_version_age").set(1.5);
        registry.timer("plan_compile").record(Duration.ofMillis(1));

        assertThat(registry.snapshot()).containsOnly(
            entry("plans_compiled", 1L),
            entry("plan_violations{rule_id=X}", 1L),
            entry("policy_version_age", 1.5),
            entry("plan_compile.count", 1));
    }

    @Test
    void resetClearsEverything() {
        registry.counter("plans_compiled").increment();
        registry.reset();

        assertThat(registry.snapshot()).isEmpty();
        assertThat(registry.getCounterValue("plans_compiled")).isZero();
    }
}
