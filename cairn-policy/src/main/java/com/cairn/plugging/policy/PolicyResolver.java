/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import com.cairn.plugging.api.IPolicyResolver;
import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.FieldResolution;
import com.cairn.plugging.api.model.PolicyBundle;
import com.cairn.plugging.api.model.PolicyKnobs;
import com.cairn.plugging.api.model.PolicyPack;
import com.cairn.plugging.policy.geo.CountyCentroids;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Resolves the effective policy for a well's jurisdiction.
 *
 * <p>Layers merge in order of increasing specificity (base, district, county, field);
 * each layer applies its inline pack stub before its external overlay file. Nested
 * {@code counties} and {@code fields} maps are never merged into the effective policy;
 * they are only consulted to pick the next layer.
 *
 * <p>Thread-safe: bundles are immutable and no per-call state is kept.
 */
public class PolicyResolver implements IPolicyResolver {
    private static final Logger logger = Logger.getLogger(PolicyResolver.class.getName());

    static final String COUNTIES = "counties";
    private static final Set<String> NESTED_SCOPES = Set.of(COUNTIES, FieldResolver.FIELDS);

    private final Tracer tracer;
    private volatile IndexedCentroids centroidCache;

    public PolicyResolver(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public EffectivePolicy resolve(PolicyBundle bundle, String district, String county, String field) {
        Span span = tracer.spanBuilder("resolve-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            PolicyPack pack = bundle.pack();
            String districtCode = DistrictCodes.normalize(district);
            span.setAttribute("policyId", pack.policyId());
            span.setAttribute("policyVersion", pack.version());
            if (districtCode != null) span.setAttribute("district", districtCode);

            Map<String, Object> base = DeepMerge.copy(pack.base());
            Map<String, Object> merged = DeepMerge.copy(base);

            Map<String, Object> districtFile = Map.of();
            if (districtCode != null) {
                merged = DeepMerge.merge(merged, pack.districtOverlays().get(districtCode), NESTED_SCOPES);
                districtFile = bundle.districtFiles().getOrDefault(districtCode, Map.of());
                merged = DeepMerge.merge(merged, districtFile, NESTED_SCOPES);
            }

            Map<String, Map<String, Object>> districtCounties = districtCounties(bundle, districtCode, districtFile);
            if (districtCode != null && county != null && !county.isBlank()) {
                merged = DeepMerge.merge(merged,
                    pack.countyOverlays().get(districtCode + "__" + CountyNames.fileKey(county)), NESTED_SCOPES);
                merged = DeepMerge.merge(merged, CountyNames.lookup(districtCounties, county), NESTED_SCOPES);
            }

            FieldResolution fieldResolution = FieldResolution.none(field);
            if (field != null && !field.isBlank()) {
                merged = DeepMerge.merge(merged, pack.fieldOverlays().get(FieldNames.normalize(field)), NESTED_SCOPES);
                FieldResolver.FieldMatch match = new FieldResolver(centroids(bundle))
                    .resolve(districtCounties, county, field);
                merged = DeepMerge.merge(merged, match.overlay(), NESTED_SCOPES);
                fieldResolution = match.resolution();
                span.setAttribute("fieldResolution", fieldResolution.method().value());
            }

            List<String> missing = CompletenessValidator.validate(base, merged, districtCode);
            PolicyKnobs knobs = KnobReader.materialize(merged);
            span.setAttribute("complete", missing.isEmpty());
            if (!missing.isEmpty()) {
                logger.fine(String.format("Policy %s incomplete for district=%s county=%s: %s",
                    pack.policyId(), districtCode, county, missing));
            }

            return new EffectivePolicy(
                pack.policyId(),
                pack.version(),
                pack.jurisdiction(),
                base,
                merged,
                districtCode,
                county,
                field,
                fieldResolution,
                missing.isEmpty(),
                missing,
                knobs
            );
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * County configurations of a district: the district overlay's {@code counties} map,
     * with any {@code {district}__{county}.yml} file taking precedence over the inline entry.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Map<String, Object>> districtCounties(PolicyBundle bundle, String districtCode,
                                                             Map<String, Object> districtFile) {
        Map<String, Map<String, Object>> counties = new LinkedHashMap<>();
        if (districtCode == null) {
            return counties;
        }
        if (districtFile.get(COUNTIES) instanceof Map<?, ?> inline) {
            for (Map.Entry<?, ?> entry : inline.entrySet()) {
                if (entry.getValue() instanceof Map<?, ?> config) {
                    counties.put(String.valueOf(entry.getKey()), (Map<String, Object>) config);
                }
            }
        }
        String prefix = districtCode + "__";
        for (Map.Entry<String, Map<String, Object>> file : bundle.countyFiles().entrySet()) {
            if (!file.getKey().startsWith(prefix)) {
                continue;
            }
            String countyName = file.getKey().substring(prefix.length()).replace('_', ' ');
            String existing = counties.keySet().stream()
                .filter(k -> Objects.equals(CountyNames.normalize(k), CountyNames.normalize(countyName)))
                .findFirst()
                .orElse(countyName);
            counties.put(existing, file.getValue());
        }
        return counties;
    }

    private CountyCentroids centroids(PolicyBundle bundle) {
        IndexedCentroids cached = centroidCache;
        if (cached == null || cached.bundle() != bundle) {
            cached = new IndexedCentroids(bundle, CountyCentroids.of(bundle.centroids()));
            centroidCache = cached;
        }
        return cached.index();
    }

    private record IndexedCentroids(PolicyBundle bundle, CountyCentroids index) {
    }
}
