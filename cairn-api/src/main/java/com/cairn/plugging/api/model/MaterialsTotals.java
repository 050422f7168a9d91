/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Plan-level cement totals. {@code totalBbl} is rounded to two decimals.
 */
public record MaterialsTotals(
    @JsonProperty("total_sacks") int totalSacks,
    @JsonProperty("total_bbl") double totalBbl
) implements Serializable {
}
