package com.recordcache.exception;

/**
 * Rejected caller input. Recoverable: correct the field and retry.
 */
public class InvalidInputException extends RecordCacheException {
    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
