/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel.merge;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.kernel.materials.MaterialsApplicator;
import com.cairn.plugging.kernel.materials.SackFloor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Coalesces neighbouring plugs of the same type into one long plug.
 *
 * <p>Two steps merge when their types match, the type is eligible, and the gap between the
 * bottom of the run built so far and the next step's top is within the threshold. The merged
 * step spans the envelope, unions citations, keeps {@code tag_required} if any source had it
 * and records its sources under {@code details.merged_steps}. Only details every source agrees
 * on carry over, plus the tagging details. Cement class and materials are dropped and must be
 * recomputed by the caller.
 *
 * <p>Steps with {@code materials_override} keep their pinned sacks and never merge.
 */
public class MergePostProcessor {
    private static final Logger logger = Logger.getLogger(MergePostProcessor.class.getName());

    public static final String MERGED = "merged";
    public static final String MERGED_STEPS = "merged_steps";

    // Recomputed with the merged volume.
    private static final Set<String> STALE_DETAILS = Set.of(SackFloor.APPLIED, SackFloor.ORIGINAL, "geometry_for_squeeze");

    // Follow tag_required, which any source may carry.
    private static final Set<String> TAG_DETAILS = Set.of("verification", "tag_reason");

    private static final Comparator<Step> BY_DEPTH = Comparator
        .comparingDouble((Step s) -> s.getTopFt())
        .thenComparingDouble(Step::deepestFt);

    /**
     * @param steps steps to merge; not modified
     * @param thresholdFt maximum gap between neighbours, inclusive
     * @param types eligible step types
     * @return a new list; merged steps carry {@code details.merged = true}
     */
    public List<Step> mergeAdjacent(List<Step> steps, double thresholdFt, Collection<StepType> types) {
        List<Step> result = new ArrayList<>();
        Map<StepType, List<Step>> byType = new LinkedHashMap<>();
        for (Step step : steps) {
            if (types.contains(step.getType()) && !step.isPoint()
                && !step.hasDetailFlag(MaterialsApplicator.MATERIALS_OVERRIDE)) {
                byType.computeIfAbsent(step.getType(), t -> new ArrayList<>()).add(step);
            } else {
                result.add(step);
            }
        }

        int merges = 0;
        for (List<Step> group : byType.values()) {
            group.sort(BY_DEPTH);
            List<Step> run = new ArrayList<>();
            double runBottom = Double.NEGATIVE_INFINITY;
            for (Step step : group) {
                if (!run.isEmpty() && step.getTopFt() - runBottom > thresholdFt) {
                    result.add(collapse(run));
                    merges += run.size() - 1;
                    run = new ArrayList<>();
                    runBottom = Double.NEGATIVE_INFINITY;
                }
                run.add(step);
                runBottom = Math.max(runBottom, step.deepestFt());
            }
            if (!run.isEmpty()) {
                result.add(collapse(run));
                merges += run.size() - 1;
            }
        }
        if (merges > 0) {
            logger.fine(String.format("Merged %d adjacent plugs within %.0f ft", merges, thresholdFt));
        }
        return result;
    }

    private static Step collapse(List<Step> run) {
        if (run.size() == 1) {
            return run.get(0);
        }
        double top = run.stream().mapToDouble(Step::getTopFt).min().orElseThrow();
        double bottom = run.stream().mapToDouble(Step::deepestFt).max().orElseThrow();
        Step merged = Step.interval(run.get(0).getType(), top, bottom);

        List<Map<String, Object>> sources = new ArrayList<>();
        List<String> formations = new ArrayList<>();
        for (Step step : run) {
            merged.cite(step.getRegulatoryBasis());
            if (step.isTagRequired()) {
                merged.setTagRequired(true);
            }
            if (step.getFormation() != null && !formations.contains(step.getFormation())) {
                formations.add(step.getFormation());
            }
            sources.addAll(sourcesOf(step));
            for (String key : TAG_DETAILS) {
                if (step.getDetails().containsKey(key)) {
                    merged.getDetails().putIfAbsent(key, step.getDetails().get(key));
                }
            }
        }
        for (Map.Entry<String, Object> detail : run.get(0).getDetails().entrySet()) {
            String key = detail.getKey();
            if (STALE_DETAILS.contains(key) || TAG_DETAILS.contains(key) || !sharedByAll(run, key, detail.getValue())) {
                continue;
            }
            merged.getDetails().put(key, detail.getValue());
        }
        if (!formations.isEmpty()) {
            merged.setFormation(String.join(" / ", formations));
        }
        merged.getDetails().remove(MERGED_STEPS);
        merged.detail(MERGED, true).detail(MERGED_STEPS, sources);
        return merged;
    }

    private static boolean sharedByAll(List<Step> run, String key, Object value) {
        for (Step step : run) {
            if (!step.getDetails().containsKey(key) || !Objects.equals(step.getDetails().get(key), value)) {
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> sourcesOf(Step step) {
        if (step.hasDetailFlag(MERGED) && step.getDetails().get(MERGED_STEPS) instanceof List<?> nested) {
            return (List<Map<String, Object>>) nested;
        }
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("formation", step.getFormation());
        source.put("top_ft", step.getTopFt());
        source.put("bottom_ft", step.getBottomFt());
        return List.of(source);
    }
}
