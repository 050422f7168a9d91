/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the resolver needs for one policy version: the base pack, the external
 * overlay files parsed at load time, and the county centroid table.
 *
 * <p>Bundles are immutable and shared by reference across concurrent resolutions.
 *
 * @param pack base policy pack
 * @param districtFiles {@code {district}__auto.yml} contents keyed by normalized district code
 * @param countyFiles {@code {district}__{county}.yml} contents keyed by {@code "{district}__{county}"}
 * @param centroids county centroid table
 * @param source where the bundle was loaded from, for logging
 */
public record PolicyBundle(
    PolicyPack pack,
    Map<String, Map<String, Object>> districtFiles,
    Map<String, Map<String, Object>> countyFiles,
    List<CountyCentroid> centroids,
    String source
) {

    public PolicyBundle {
        districtFiles = districtFiles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(districtFiles));
        countyFiles = countyFiles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(countyFiles));
        centroids = centroids == null ? List.of() : List.copyOf(centroids);
    }

    public String version() {
        return pack.version();
    }

    public String policyId() {
        return pack.policyId();
    }
}
