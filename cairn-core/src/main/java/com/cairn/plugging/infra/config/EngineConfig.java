/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.config;

import com.cairn.plugging.policy.store.PolicyBundleSource;
import com.cairn.plugging.policy.store.PolicyStores;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Service settings, read from environment variables with a system-property fallback.
 *
 * @param policyDir directory holding the policy pack, or {@code null} for the bundled pack
 * @param policyId base pack identifier, e.g. {@code tx.w3a}
 * @param httpPort port of the embedded HTTP server
 * @param policyCheckSeconds how often to look for a policy version bump; 0 disables
 */
public record EngineConfig(Path policyDir, String policyId, int httpPort, long policyCheckSeconds) {
    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String POLICY_DIR = "CAIRN_POLICY_DIR";
    public static final String POLICY_ID = "CAIRN_POLICY_ID";
    public static final String HTTP_PORT = "CAIRN_HTTP_PORT";
    public static final String POLICY_CHECK_SECONDS = "CAIRN_POLICY_CHECK_SECONDS";

    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final long DEFAULT_POLICY_CHECK_SECONDS = 30;

    public EngineConfig {
        if (policyId == null || policyId.isBlank()) {
            policyId = PolicyStores.DEFAULT_POLICY_ID;
        }
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("HTTP port out of range: " + httpPort);
        }
        if (policyCheckSeconds < 0) {
            throw new IllegalArgumentException("Policy check interval must not be negative: " + policyCheckSeconds);
        }
    }

    public static EngineConfig fromEnvironment() {
        String dir = envOrProperty(POLICY_DIR, null);
        return new EngineConfig(
            dir != null ? Path.of(dir) : null,
            envOrProperty(POLICY_ID, PolicyStores.DEFAULT_POLICY_ID),
            (int) longSetting(HTTP_PORT, DEFAULT_HTTP_PORT),
            longSetting(POLICY_CHECK_SECONDS, DEFAULT_POLICY_CHECK_SECONDS));
    }

    /**
     * The configured policy directory, or the pack bundled on the classpath.
     */
    public PolicyBundleSource policySource() {
        if (policyDir == null) {
            return PolicyStores.classpath(PolicyStores.BUNDLED_ROOT, policyId);
        }
        return PolicyStores.directory(policyDir, policyId);
    }

    /**
     * Value from the environment, falling back to a system property of the same name.
     */
    public static String envOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }

    private static long longSetting(String key, long defaultValue) {
        String raw = envOrProperty(key, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warning(String.format("Invalid %s=%s, using %d", key, raw, defaultValue));
            return defaultValue;
        }
    }
}
