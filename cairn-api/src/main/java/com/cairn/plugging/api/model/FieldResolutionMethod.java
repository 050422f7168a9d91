/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a requested field name was matched to a field overlay.
 */
public enum FieldResolutionMethod {
    /** Exact or fuzzy match in the requested county's field map. */
    EXACT_IN_COUNTY,
    /** Exact key match in the nearest other county of the district. */
    NEAREST_COUNTY,
    /** Field name mentioned somewhere in the nearest county's configuration. */
    NEAREST_COUNTY_OCCURRENCE,
    NONE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
