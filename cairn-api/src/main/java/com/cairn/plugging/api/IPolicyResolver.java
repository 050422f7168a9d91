/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api;

import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.PolicyBundle;

/**
 * Contract for resolving a hierarchical policy for one jurisdiction.
 */
public interface IPolicyResolver {

    /**
     * Merges base, district, county and field layers and validates completeness.
     * Never throws for an incomplete policy; the result carries the missing paths instead.
     *
     * @param bundle loaded policy bundle
     * @param district district code in any accepted spelling ("8", "08A", ...), or null
     * @param county county name with or without the " County" suffix, or null
     * @param field field name as reported on the well record, or null
     * @return the effective policy
     */
    EffectivePolicy resolve(PolicyBundle bundle, String district, String county, String field);
}
