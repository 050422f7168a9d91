package com.cairn.plugging.infra.config;

import com.cairn.plugging.policy.store.PolicyBundleSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty(EngineConfig.POLICY_DIR);
        System.clearProperty(EngineConfig.POLICY_ID);
        System.clearProperty(EngineConfig.HTTP_PORT);
        System.clearProperty(EngineConfig.POLICY_CHECK_SECONDS);
    }

    @Test
    void defaultsToBundledPolicy() {
        EngineConfig config = EngineConfig.fromEnvironment();

        assertThat(config.policyDir()).isNull();
        assertThat(config.policyId()).isEqualTo("tx.w3a");
        assertThat(config.httpPort()).isEqualTo(EngineConfig.DEFAULT_HTTP_PORT);
        assertThat(config.policyCheckSeconds()).isEqualTo(EngineConfig.DEFAULT_POLICY_CHECK_SECONDS);
        assertThat(config.policySource().currentVersion()).isEqualTo("2025.10.1");
    }

    @Test
    void readsSystemProperties() {
        System.setProperty(EngineConfig.POLICY_DIR, tempDir.toString());
        System.setProperty(EngineConfig.POLICY_ID, "tx.custom");
        System.setProperty(EngineConfig.HTTP_PORT, "9090");
        System.setProperty(EngineConfig.POLICY_CHECK_SECONDS, "5");

        EngineConfig config = EngineConfig.fromEnvironment();

        assertThat(config.policyDir()).isEqualTo(tempDir);
        assertThat(config.policyId()).isEqualTo("tx.custom");
        assertThat(config.httpPort()).isEqualTo(9090);
        assertThat(config.policyCheckSeconds()).isEqualTo(5);
        PolicyBundleSource source = config.policySource();
        assertThat(source.describe()).contains("tx.custom").contains(tempDir.toString());
    }

    @Test
    void invalidNumbersFallBackToDefaults() {
        System.setProperty(EngineConfig.HTTP_PORT, "eighty");

        assertThat(EngineConfig.fromEnvironment().httpPort()).isEqualTo(EngineConfig.DEFAULT_HTTP_PORT);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new EngineConfig(null, "tx.w3a", 70000, 30))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EngineConfig(null, "tx.w3a", 8080, -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new EngineConfig(null, " ", 0, 0).policyId()).isEqualTo("tx.w3a");
    }
}
