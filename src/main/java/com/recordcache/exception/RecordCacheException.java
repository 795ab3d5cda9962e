package com.recordcache.exception;

/**
 * Base checked exception for record cache operations
 */
public class RecordCacheException extends Exception {

    public RecordCacheException(String message) {
        super(message);
    }

    public RecordCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
