/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

public interface Timer {
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * @param percentile between 0.0 and 1.0
     * @throws UnsupportedOperationException for registries that aggregate server-side
     */
    Duration percentile(double percentile);
}
