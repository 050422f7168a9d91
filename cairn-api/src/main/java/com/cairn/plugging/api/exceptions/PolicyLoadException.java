/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.api.exceptions;

/**
 * Raised when a policy pack or one of its overlay files cannot be loaded.
 *
 * <p>This is a deployment error: it aborts loading of the whole pack and is never
 * raised for per-well data problems, which are reported as violations instead.
 */
public class PolicyLoadException extends RuntimeException {

    public PolicyLoadException(String message) {
        super(message);
    }

    public PolicyLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public PolicyLoadException(Throwable cause) {
        super(cause);
    }
}
