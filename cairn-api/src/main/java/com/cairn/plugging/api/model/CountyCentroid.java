/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record CountyCentroid(
    @JsonProperty("county") String county,
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude
) implements Serializable {
}
