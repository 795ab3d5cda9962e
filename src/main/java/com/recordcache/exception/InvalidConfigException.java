package com.recordcache.exception;

/**
 * Thrown while constructing a component from an unusable setting.
 * The half-built component must not be used.
 */
public class InvalidConfigException extends IllegalArgumentException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
