/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single normalized well fact as supplied by the extraction layer.
 *
 * <p>The value is kept in its JSON-like form (number, string, boolean, list or map);
 * {@link WellFacts} provides typed access. The engine never mutates facts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Fact(
    @JsonProperty("key") String key,
    @JsonProperty("value") Object value,
    @JsonProperty("units") String units,
    @JsonProperty("source") String source,
    @JsonProperty("confidence") Double confidence
) implements Serializable {

    public static Fact of(String key, Object value) {
        return new Fact(key, value, null, null, null);
    }

    public static Fact of(String key, Object value, String units) {
        return new Fact(key, value, units, null, null);
    }

    public Fact withKey(String newKey) {
        return new Fact(newKey, value, units, source, confidence);
    }
}
