package com.recordcache.exception;

/**
 * Raised by a backing store when a read or write could not be persisted or served.
 */
public class StoreException extends RecordCacheException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
