/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import com.cairn.plugging.api.model.FieldResolution;
import com.cairn.plugging.api.model.FieldResolutionMethod;
import com.cairn.plugging.policy.geo.CountyCentroids;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * Chooses the field overlay for a well.
 *
 * <p>Strategies run in order and the first hit wins:
 * <ol>
 *   <li>exact, then fuzzy, match in the well's own county {@code fields} map</li>
 *   <li>exact key match in the nearest other county of the district</li>
 *   <li>nearest county whose configuration mentions the field anywhere</li>
 * </ol>
 * Distances come from the county centroid table; counties without a centroid are not ranked.
 */
public class FieldResolver {
    private static final Logger logger = Logger.getLogger(FieldResolver.class.getName());

    static final String FIELDS = "fields";

    private final CountyCentroids centroids;

    public FieldResolver(CountyCentroids centroids) {
        this.centroids = Objects.requireNonNull(centroids, "centroids");
    }

    /**
     * Field overlay selected for a well, with its audit record. {@code overlay} is empty
     * when nothing matched or the match carries no field block.
     */
    public record FieldMatch(FieldResolution resolution, Map<String, Object> overlay) {
    }

    /**
     * @param districtCounties county configurations of the well's district, keyed by county name
     * @param county the well's county
     * @param field the requested field name
     */
    public FieldMatch resolve(Map<String, Map<String, Object>> districtCounties, String county, String field) {
        if (field == null || field.isBlank() || county == null) {
            return new FieldMatch(FieldResolution.none(field), Map.of());
        }

        Map<String, Object> own = CountyNames.lookup(districtCounties, county);
        Map.Entry<String, Map<String, Object>> inCounty = findField(own, field, true);
        if (inCounty == null) {
            inCounty = findField(own, field, false);
        }
        if (inCounty != null) {
            return new FieldMatch(new FieldResolution(field, FieldResolutionMethod.EXACT_IN_COUNTY,
                inCounty.getKey(), county, null), inCounty.getValue());
        }

        List<Candidate> neighbours = rankNeighbours(districtCounties, county);
        for (Candidate candidate : neighbours) {
            Map.Entry<String, Map<String, Object>> exact = findField(candidate.config(), field, true);
            if (exact != null) {
                logger.fine(String.format("Field '%s' resolved in nearest county %s (%.1f km)",
                    field, candidate.county(), candidate.distanceKm()));
                return new FieldMatch(new FieldResolution(field, FieldResolutionMethod.NEAREST_COUNTY,
                    exact.getKey(), candidate.county(), candidate.distanceKm()), exact.getValue());
            }
        }
        for (Candidate candidate : neighbours) {
            if (ConfigTreeWalker.mentions(candidate.config(), field)) {
                Map.Entry<String, Map<String, Object>> fuzzy = findField(candidate.config(), field, false);
                return new FieldMatch(new FieldResolution(field, FieldResolutionMethod.NEAREST_COUNTY_OCCURRENCE,
                    fuzzy != null ? fuzzy.getKey() : field, candidate.county(), candidate.distanceKm()),
                    fuzzy != null ? fuzzy.getValue() : Map.of());
            }
        }
        return new FieldMatch(FieldResolution.none(field), Map.of());
    }

    @SuppressWarnings("unchecked")
    private static Map.Entry<String, Map<String, Object>> findField(Map<String, Object> countyConfig, String field,
                                                                    boolean exactOnly) {
        if (countyConfig == null || !(countyConfig.get(FIELDS) instanceof Map<?, ?> fields)) {
            return null;
        }
        for (Map.Entry<?, ?> entry : fields.entrySet()) {
            String name = String.valueOf(entry.getKey());
            boolean hit = exactOnly ? FieldNames.sameName(name, field) : FieldNames.matches(name, field);
            if (hit) {
                Map<String, Object> overlay = entry.getValue() instanceof Map<?, ?> block
                    ? (Map<String, Object>) block : Map.of();
                return Map.entry(name, overlay);
            }
        }
        return null;
    }

    private List<Candidate> rankNeighbours(Map<String, Map<String, Object>> districtCounties, String county) {
        String own = CountyNames.normalize(county);
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> entry : districtCounties.entrySet()) {
            if (Objects.equals(own, CountyNames.normalize(entry.getKey()))) {
                continue;
            }
            OptionalDouble distance = centroids.distanceKm(county, entry.getKey());
            if (distance.isPresent()) {
                double km = Math.round(distance.getAsDouble() * 100.0) / 100.0;
                candidates.add(new Candidate(entry.getKey(), entry.getValue(), km));
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::distanceKm).thenComparing(Candidate::county));
        return candidates;
    }

    private record Candidate(String county, Map<String, Object> config, double distanceKm) {
    }
}
