/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic attached to a plan. Generation never aborts because of one.
 */
public record Violation(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("message") String message,
    @JsonProperty("context") Map<String, Object> context
) implements Serializable {

    public Violation {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static Violation error(String ruleId, String message, Map<String, Object> context) {
        return new Violation(Severity.ERROR, ruleId, message, context);
    }

    public static Violation warning(String ruleId, String message, Map<String, Object> context) {
        return new Violation(Severity.WARNING, ruleId, message, context);
    }

    public static Violation info(String ruleId, String message, Map<String, Object> context) {
        return new Violation(Severity.INFO, ruleId, message, context);
    }
}
