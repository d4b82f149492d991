/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.exception;

public class ValidationTimeoutException extends ValidationException {

    private final long elapsedMs;

    public ValidationTimeoutException(String message, long elapsedMs) {
        super(message);
        this.elapsedMs = elapsedMs;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }
}
