/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.api.exception;

/**
 * Thrown when a configuration structure cannot be interpreted (malformed, circular, wrong types).
 */
public class ConfigurationParseException extends ValidationException {

    public ConfigurationParseException(String message) {
        super(message);
    }

    public ConfigurationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
