/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.exception;

/**
 * Thrown when exported cache data is malformed or carries an unsupported format version.
 */
public class CacheImportException extends ValidationException {

    public CacheImportException(String message) {
        super(message);
    }

    public CacheImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
