/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy.geo;

import com.cairn.plugging.api.model.CountyCentroid;
import com.cairn.plugging.policy.CountyNames;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable lookup of county centroids.
 *
 * <p>Each centroid is indexed under its normalized name and under the same name with a
 * trailing " county", so either spelling resolves.
 */
public final class CountyCentroids {

    private final Map<String, CountyCentroid> index;

    private CountyCentroids(Map<String, CountyCentroid> index) {
        this.index = index;
    }

    public static CountyCentroids of(List<CountyCentroid> centroids) {
        Map<String, CountyCentroid> index = new HashMap<>();
        for (CountyCentroid centroid : centroids) {
            String name = CountyNames.normalize(centroid.county());
            if (name == null) {
                continue;
            }
            index.putIfAbsent(name, centroid);
            index.putIfAbsent(name + " county", centroid);
        }
        return new CountyCentroids(Collections.unmodifiableMap(index));
    }

    public CountyCentroid find(String county) {
        if (county == null) {
            return null;
        }
        CountyCentroid direct = index.get(county.trim().toLowerCase(Locale.ROOT));
        if (direct != null) {
            return direct;
        }
        String normalized = CountyNames.normalize(county);
        return normalized == null ? null : index.get(normalized);
    }

    /**
     * Distance between two counties' centroids, empty when either is unknown.
     */
    public OptionalDouble distanceKm(String fromCounty, String toCounty) {
        CountyCentroid from = find(fromCounty);
        CountyCentroid to = find(toCounty);
        if (from == null || to == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(GeoDistance.haversineKm(from.latitude(), from.longitude(), to.latitude(), to.longitude()));
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }
}
