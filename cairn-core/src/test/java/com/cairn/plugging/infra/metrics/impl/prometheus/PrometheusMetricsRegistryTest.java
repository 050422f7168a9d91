package com.cairn.plugging.infra.metrics.impl.prometheus;

import com.cairn.plugging.infra.metrics.Counter;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private PrometheusMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PrometheusMetricsRegistry(new CollectorRegistry());
    }

    @Test
    void labelValuesKeepTheirOwnChildren() {
        Counter incomplete = registry.counter("plan_violations", "rule_id", "POLICY_INCOMPLETE");
        Counter unknown = registry.counter("plan_violations", "rule_id", "UQW_DEPTH_UNKNOWN");

        incomplete.increment(2);
        unknown.increment();

        assertThat(incomplete.count()).isEqualTo(2);
        assertThat(unknown.count()).isEqualTo(1);
        assertThat(registry.counter("plan_violations", "rule_id", "POLICY_INCOMPLETE")).isSameAs(incomplete);
    }

    @Test
    void scrapeRendersTextFormat() throws Exception {
        registry.counter("plans_compiled").increment();
        registry.counter("plan_violations", "rule_id", "POLICY_INCOMPLETE").increment();
        registry.timer("plan_compile").record(Duration.ofMillis(3));

        String text = registry.scrape();

        assertThat(text)
            .contains("plans_compiled_total")
            .contains("rule_id=\"POLICY_INCOMPLETE\"")
            .contains("plan_compile_seconds_count");
    }

    @Test
    void negativeIncrementIsRejected() {
        Counter counter = registry.counter("plans_compiled");

        assertThatThrownBy(() -> counter.increment(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
