/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.kernel;

import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.PolicyKnobs;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.WellFacts;
import com.cairn.plugging.policy.CountyNames;
import com.cairn.plugging.policy.DistrictCodes;
import com.cairn.plugging.policy.KnobReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call planning state: the facts, the resolved policy and the violations raised so far.
 *
 * <p>Not thread-safe. One instance serves exactly one {@code compile} call.
 */
public final class PlanningContext {

    private final WellFacts facts;
    private final EffectivePolicy policy;
    private final Wellbore wellbore;
    private final List<Violation> violations = new ArrayList<>();

    public PlanningContext(Map<String, Fact> facts, EffectivePolicy policy) {
        this.facts = WellFacts.of(facts);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.wellbore = Wellbore.of(this.facts);
    }

    public WellFacts facts() {
        return facts;
    }

    public EffectivePolicy policy() {
        return policy;
    }

    public PolicyKnobs knobs() {
        return policy.knobs();
    }

    public Wellbore wellbore() {
        return wellbore;
    }

    public void report(Violation violation) {
        violations.add(violation);
    }

    public List<Violation> violations() {
        return Collections.unmodifiableList(violations);
    }

    /**
     * District of the resolved policy, falling back to the {@code district} fact.
     */
    public String district() {
        return policy.district() != null ? policy.district() : DistrictCodes.normalize(facts.text("district"));
    }

    public String county() {
        return policy.county() != null ? policy.county() : facts.text("county");
    }

    /**
     * County in citation form: lower-cased, underscores for spaces, no " county" suffix.
     */
    public String countyKey() {
        return CountyNames.fileKey(county());
    }

    /**
     * Citations attached to one or more requirement knobs, deduplicated in order.
     */
    public List<String> citations(String... knobs) {
        List<String> cites = new ArrayList<>();
        for (String knob : knobs) {
            for (String cite : knobs().citationsFor(knob)) {
                if (!cites.contains(cite)) {
                    cites.add(cite);
                }
            }
        }
        return cites;
    }

    /**
     * Resolves a key of the policy's {@code citations} section; empty when the key is absent.
     */
    public List<String> citationKey(String key) {
        if (policy.lookup("citations." + key) == null) {
            return List.of();
        }
        return List.of(KnobReader.citation(policy.effective(), key));
    }
}
