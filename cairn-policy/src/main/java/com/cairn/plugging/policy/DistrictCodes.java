/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical spelling of Railroad Commission district codes.
 *
 * <p>The numeric part is zero-padded to two digits and a missing letter suffix defaults to
 * {@code a}: {@code "8"}, {@code "08"}, {@code "8A"} and {@code "08A"} all become {@code "08a"}.
 */
public final class DistrictCodes {

    private static final Pattern CODE = Pattern.compile("^(?:district\\s*)?0*(\\d{1,2})\\s*([a-z]?)$");

    private DistrictCodes() {
    }

    /**
     * Normalizes a district code; unrecognized input is returned trimmed and lower-cased,
     * {@code null} or blank input returns {@code null}.
     */
    public static String normalize(String district) {
        if (district == null || district.isBlank()) {
            return null;
        }
        String cleaned = district.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = CODE.matcher(cleaned);
        if (!matcher.matches()) {
            return cleaned;
        }
        int number = Integer.parseInt(matcher.group(1));
        String suffix = matcher.group(2).isEmpty() ? "a" : matcher.group(2);
        return String.format("%02d%s", number, suffix);
    }
}
