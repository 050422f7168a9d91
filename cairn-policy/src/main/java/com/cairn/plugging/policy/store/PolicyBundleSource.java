/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy.store;

import com.cairn.plugging.api.exceptions.PolicyLoadException;
import com.cairn.plugging.api.model.PolicyBundle;

/**
 * Where policy bundles come from.
 */
public interface PolicyBundleSource {

    /**
     * Loads and parses the full bundle.
     *
     * @throws PolicyLoadException if the base pack is missing or any file is malformed
     */
    PolicyBundle load();

    /**
     * Reads only the {@code version} field of the base pack, so callers can detect a
     * version bump without re-parsing every overlay.
     *
     * @throws PolicyLoadException if the base pack cannot be read
     */
    String currentVersion();

    /**
     * Human-readable location, for logs.
     */
    String describe();
}
