/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel;

import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.materials.SqueezeFactors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of the wellbore described by a fact map: casing shoes, diameters, intervals
 * and downhole devices. Unknown values are {@code null}; nothing is estimated here.
 */
public final class Wellbore {

    public static final String CIBP = "CIBP";

    private final Double surfaceShoeFt;
    private final Double intermediateShoeFt;
    private final Double productionShoeFt;
    private final boolean hasUqw;
    private final boolean hasDuqw;
    private final Double uqwBaseFt;
    private final Double surfaceCasingIdIn;
    private final Double intermediateCasingIdIn;
    private final Double productionCasingIdIn;
    private final Double casingIdIn;
    private final Double linerIdIn;
    private final Double productionCasingOdIn;
    private final Double stingerOdIn;
    private final Double holeSizeIn;
    private final List<DepthInterval> producingIntervals;
    private final List<DepthInterval> injectionIntervals;
    private final List<DepthInterval> disposalIntervals;
    private final List<DepthInterval> linerIntervals;
    private final List<String> barriers;
    private final Double existingCibpFt;
    private final Double packerFt;
    private final Double dvToolFt;
    private final Double kopMdFt;
    private final Map<String, Double> formationTops;
    private final List<Map<String, Object>> annularGaps;

    private Wellbore(WellFacts facts) {
        this.surfaceShoeFt = facts.number("surface_shoe_ft");
        this.intermediateShoeFt = facts.number("intermediate_shoe_ft");
        this.productionShoeFt = facts.number("production_shoe_ft");
        this.hasUqw = facts.flag("has_uqw");
        this.hasDuqw = facts.flag("has_duqw");
        this.uqwBaseFt = facts.number("uqw_base_ft");
        this.surfaceCasingIdIn = facts.number("surface_casing_id_in");
        this.intermediateCasingIdIn = facts.number("intermediate_casing_id_in");
        this.productionCasingIdIn = facts.number("production_casing_id_in");
        this.casingIdIn = facts.number("casing_id_in");
        this.linerIdIn = facts.number("liner_id_in");
        this.productionCasingOdIn = facts.firstNumber("production_casing_od_in", "casing_od_in");
        this.stingerOdIn = facts.firstNumber("stinger_od_in", "tubing_od_in");
        this.holeSizeIn = facts.firstNumber("hole_size_in", "production_hole_size_in");

        List<DepthInterval> producing = new ArrayList<>(facts.intervals("producing_intervals"));
        producing.addAll(facts.intervals("perf_interval"));
        this.producingIntervals = Collections.unmodifiableList(producing);
        this.injectionIntervals = List.copyOf(facts.intervals("injection_intervals"));
        this.disposalIntervals = List.copyOf(facts.intervals("disposal_intervals"));
        this.linerIntervals = List.copyOf(facts.intervals("liner_intervals"));

        this.barriers = List.copyOf(facts.codes("existing_mechanical_barriers"));
        this.existingCibpFt = facts.number("existing_cibp_ft");
        this.packerFt = facts.number("packer_ft");
        this.dvToolFt = facts.number("dv_tool_ft");
        this.kopMdFt = facts.firstNumber("kop.kop_md_ft", "kop_md_ft");
        this.formationTops = readTops(facts.map("formation_tops_map"));
        this.annularGaps = readGaps(facts.list("annular_gaps"));
    }

    public static Wellbore of(WellFacts facts) {
        return new Wellbore(facts);
    }

    private static Map<String, Double> readTops(Map<String, Object> raw) {
        Map<String, Double> tops = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                value = nested.get("top_ft");
            }
            Double top = WellFacts.toDouble(value);
            if (top != null) {
                tops.put(entry.getKey(), top);
            }
        }
        return Collections.unmodifiableMap(tops);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> readGaps(List<Object> raw) {
        List<Map<String, Object>> gaps = new ArrayList<>();
        for (Object entry : raw) {
            if (entry instanceof Map<?, ?> gap) {
                gaps.add((Map<String, Object>) gap);
            }
        }
        return Collections.unmodifiableList(gaps);
    }

    public Double surfaceShoeFt() {
        return surfaceShoeFt;
    }

    public Double intermediateShoeFt() {
        return intermediateShoeFt;
    }

    public Double productionShoeFt() {
        return productionShoeFt;
    }

    public boolean hasUqw() {
        return hasUqw;
    }

    public boolean hasDuqw() {
        return hasDuqw;
    }

    public Double uqwBaseFt() {
        return uqwBaseFt;
    }

    public Double productionCasingOdIn() {
        return productionCasingOdIn;
    }

    public Double stingerOdIn() {
        return stingerOdIn;
    }

    public Double holeSizeIn() {
        return holeSizeIn;
    }

    public List<DepthInterval> producingIntervals() {
        return producingIntervals;
    }

    public List<DepthInterval> linerIntervals() {
        return linerIntervals;
    }

    public Double packerFt() {
        return packerFt;
    }

    public Double dvToolFt() {
        return dvToolFt;
    }

    public Double kopMdFt() {
        return kopMdFt;
    }

    public Map<String, Double> formationTops() {
        return formationTops;
    }

    public List<Map<String, Object>> annularGaps() {
        return annularGaps;
    }

    /**
     * Depth of an existing CIBP, or {@code null} unless the barrier list names one and its
     * depth is known.
     */
    public Double existingCibpFt() {
        return barriers.contains(CIBP) ? existingCibpFt : null;
    }

    public boolean hasExistingCibp() {
        return existingCibpFt() != null;
    }

    /**
     * Producing, injection and disposal intervals together; the CIBP detector considers all three.
     */
    public List<DepthInterval> completionIntervals() {
        List<DepthInterval> all = new ArrayList<>(producingIntervals);
        all.addAll(injectionIntervals);
        all.addAll(disposalIntervals);
        return all;
    }

    /**
     * The completion interval reaching deepest, or {@code null} when none is known.
     */
    public DepthInterval deepestCompletion() {
        return completionIntervals().stream()
            .max(Comparator.comparingDouble(DepthInterval::bottomFt).thenComparingDouble(DepthInterval::topFt))
            .orElse(null);
    }

    /**
     * Well-specific top of a formation, matched case-insensitively.
     */
    public Double formationTop(String formation) {
        if (formation == null) {
            return null;
        }
        Double exact = formationTops.get(formation);
        if (exact != null) {
            return exact;
        }
        String wanted = formation.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> entry : formationTops.entrySet()) {
            if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public Double deepestFormationTop() {
        return formationTops.values().stream().max(Double::compare).orElse(null);
    }

    /**
     * Inside diameter of the innermost casing string at a depth. Below the production shoe
     * only a liner counts as casing; elsewhere there this returns {@code null}.
     */
    public Double casingIdAt(double depthFt) {
        if (productionShoeFt != null && depthFt > productionShoeFt) {
            if (linerIntervals.stream().noneMatch(liner -> liner.contains(depthFt))) {
                return null;
            }
            return linerIdIn != null ? linerIdIn : casingIdIn;
        }
        if (productionCasingIdIn != null) {
            return productionCasingIdIn;
        }
        if (intermediateCasingIdIn != null && (intermediateShoeFt == null || depthFt <= intermediateShoeFt)) {
            return intermediateCasingIdIn;
        }
        if (surfaceCasingIdIn != null && (surfaceShoeFt == null || depthFt <= surfaceShoeFt)) {
            return surfaceCasingIdIn;
        }
        return casingIdIn;
    }

    /**
     * True when a depth sits below the production shoe outside every liner.
     */
    public boolean isOpenHole(double depthFt) {
        return SqueezeFactors.isOpenHole(depthFt, productionShoeFt, linerIntervals);
    }
}
