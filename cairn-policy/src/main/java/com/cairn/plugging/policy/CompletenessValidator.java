/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that a policy tree carries every knob the step generator cannot default.
 *
 * <p>Missing paths are reported as {@code "{scope}.{dotted.key}"}; the effective scope adds
 * a {@code " [district:{d}]"} suffix so reviewers can tell which overlay chain was checked.
 */
public final class CompletenessValidator {

    public static final List<String> REQUIRED_SECTIONS = List.of("citations", "requirements", "cement_class");

    public static final List<String> REQUIRED_KNOBS = List.of(
        "requirements.casing_shoe_coverage_ft",
        "requirements.duqw_coverage_ft",
        "requirements.tag_wait_hours",
        "cement_class.cutoff_ft",
        "cement_class.shallow_class",
        "cement_class.deep_class"
    );

    private CompletenessValidator() {
    }

    /**
     * Validates {@code base} always, and {@code effective} when a district was resolved.
     *
     * @return missing paths in a stable order; empty when complete
     */
    public static List<String> validate(Map<String, Object> base, Map<String, Object> effective, String district) {
        List<String> missing = new ArrayList<>();
        collect(base, "base", "", missing);
        if (district != null) {
            collect(effective, "effective", " [district:" + district + "]", missing);
        }
        return missing;
    }

    private static void collect(Map<String, Object> tree, String scope, String suffix, List<String> missing) {
        for (String section : REQUIRED_SECTIONS) {
            if (!(tree.get(section) instanceof Map<?, ?>)) {
                missing.add(scope + "." + section + suffix);
            }
        }
        for (String knob : REQUIRED_KNOBS) {
            if (KnobReader.value(tree, knob) == null) {
                missing.add(scope + "." + knob + suffix);
            }
        }
    }
}
