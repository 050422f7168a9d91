/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import com.cairn.plugging.api.model.PolicyKnobs;
import com.cairn.plugging.api.model.SlurryRecipe;
import com.cairn.plugging.api.model.WellFacts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Materializes the typed {@link PolicyKnobs} view of a merged policy tree.
 *
 * <p>A requirement knob is either a bare scalar or {@code {value, citation_keys}}.
 * Citation keys resolve through the policy's {@code citations} section; unknown keys are
 * kept verbatim so nothing silently drops out of a step's regulatory basis.
 */
public final class KnobReader {
    private static final Logger logger = Logger.getLogger(KnobReader.class.getName());

    private static final List<String> CITED_KNOBS = List.of(
        "casing_shoe_coverage_ft", "duqw_coverage_ft", "tag_wait_hours",
        "surface_casing_shoe_plug_min_ft", "intermediate_casing_shoe_plug_min_ft",
        "uqw_below_base_ft", "uqw_above_base_ft", "productive_horizon_isolation_min_ft",
        "top_plug_length_ft", "casing_cut_below_surface_ft", "cement_above_cibp_min_ft",
        "max_squeeze_interval_ft", "squeeze_cap_length_ft", "duqw_isolation_required",
        "tagging_required_hint"
    );

    private KnobReader() {
    }

    /**
     * Value of a knob at a dotted path, unwrapping {@code {value: ...}} maps.
     */
    public static Object value(Map<String, Object> tree, String dottedPath) {
        Object node = at(tree, dottedPath);
        if (node instanceof Map<?, ?> knob && knob.containsKey("value")) {
            return knob.get("value");
        }
        return node;
    }

    public static Object at(Map<String, Object> tree, String dottedPath) {
        Object current = tree;
        for (String segment : dottedPath.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    public static Double number(Map<String, Object> tree, String dottedPath) {
        return WellFacts.toDouble(value(tree, dottedPath));
    }

    public static double number(Map<String, Object> tree, String dottedPath, double fallback) {
        Double value = number(tree, dottedPath);
        return value != null ? value : fallback;
    }

    public static String text(Map<String, Object> tree, String dottedPath) {
        Object value = value(tree, dottedPath);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Resolves citation keys attached to a knob.
     */
    public static List<String> citations(Map<String, Object> tree, String dottedPath) {
        List<String> resolved = new ArrayList<>();
        if (!(at(tree, dottedPath) instanceof Map<?, ?> knob)) {
            return resolved;
        }
        Object keys = knob.get("citation_keys");
        if (keys instanceof List<?> list) {
            for (Object key : list) {
                String citation = citation(tree, String.valueOf(key));
                if (!resolved.contains(citation)) {
                    resolved.add(citation);
                }
            }
        }
        Object literal = knob.get("citations");
        if (literal instanceof List<?> list) {
            for (Object text : list) {
                if (text != null && !resolved.contains(String.valueOf(text))) {
                    resolved.add(String.valueOf(text));
                }
            }
        }
        return resolved;
    }

    /**
     * Looks up one citation key in the {@code citations} section.
     */
    public static String citation(Map<String, Object> tree, String key) {
        Object value = at(tree, "citations." + key);
        if (value instanceof Map<?, ?> entry && entry.get("cite") != null) {
            return String.valueOf(entry.get("cite"));
        }
        return value != null ? String.valueOf(value) : key;
    }

    public static PolicyKnobs materialize(Map<String, Object> effective) {
        Map<String, List<String>> knobCitations = new LinkedHashMap<>();
        for (String knob : CITED_KNOBS) {
            List<String> cites = citations(effective, "requirements." + knob);
            if (!cites.isEmpty()) {
                knobCitations.put(knob, cites);
            }
        }

        Double capOverride = number(effective, "steps_overrides.cibp_cap.cap_length_ft");
        double cibpCap = capOverride != null ? capOverride : number(effective, "requirements.cement_above_cibp_min_ft", 100.0);

        return new PolicyKnobs(
            number(effective, "requirements.casing_shoe_coverage_ft"),
            number(effective, "requirements.duqw_coverage_ft"),
            number(effective, "requirements.tag_wait_hours"),
            number(effective, "cement_class.cutoff_ft"),
            text(effective, "cement_class.shallow_class"),
            text(effective, "cement_class.deep_class"),
            number(effective, "requirements.surface_casing_shoe_plug_min_ft", 100.0),
            number(effective, "requirements.intermediate_casing_shoe_plug_min_ft", 100.0),
            number(effective, "requirements.uqw_below_base_ft", 50.0),
            number(effective, "requirements.uqw_above_base_ft", 50.0),
            number(effective, "requirements.productive_horizon_isolation_min_ft", 100.0),
            number(effective, "requirements.top_plug_length_ft", 10.0),
            number(effective, "requirements.casing_cut_below_surface_ft", 3.0),
            cibpCap,
            number(effective, "requirements.max_squeeze_interval_ft", 100.0),
            number(effective, "requirements.squeeze_cap_length_ft", 50.0),
            WellFacts.toBoolean(value(effective, "requirements.duqw_isolation_required")),
            strings(value(effective, "requirements.tag_required_step_types"), List.of("perforate_and_squeeze_plug")),
            number(effective, "preferences.annular_excess", 0.4),
            recipes(at(effective, "preferences.recipes")),
            text(effective, "preferences.default_recipe"),
            longPlugMerge(at(effective, "preferences.long_plug_merge")),
            knobCitations
        );
    }

    private static List<String> strings(Object value, List<String> fallback) {
        if (!(value instanceof List<?> list)) {
            return fallback;
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }

    private static Map<String, SlurryRecipe> recipes(Object node) {
        Map<String, SlurryRecipe> recipes = new LinkedHashMap<>();
        if (!(node instanceof Map<?, ?> byClass)) {
            return recipes;
        }
        for (Map.Entry<?, ?> entry : byClass.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> spec)) {
                continue;
            }
            Double yield = WellFacts.toDouble(spec.get("yield_ft3_per_sack"));
            if (yield == null || yield <= 0) {
                logger.log(Level.WARNING, "Skipping recipe {0}: missing or non-positive yield", entry.getKey());
                continue;
            }
            String key = String.valueOf(entry.getKey());
            Object cementClass = spec.get("class");
            recipes.put(key, new SlurryRecipe(
                spec.get("id") != null ? String.valueOf(spec.get("id")) : key,
                cementClass != null ? String.valueOf(cementClass) : key,
                WellFacts.toDouble(spec.get("density_ppg")),
                yield,
                WellFacts.toDouble(spec.get("water_gal_per_sack"))
            ));
        }
        return recipes;
    }

    private static PolicyKnobs.LongPlugMerge longPlugMerge(Object node) {
        if (!(node instanceof Map<?, ?> prefs)) {
            return PolicyKnobs.LongPlugMerge.disabled();
        }
        Double threshold = WellFacts.toDouble(prefs.get("threshold_ft"));
        return new PolicyKnobs.LongPlugMerge(
            WellFacts.toBoolean(prefs.get("enabled")),
            threshold != null ? threshold : 0.0,
            strings(prefs.get("types"), null)
        );
    }
}
