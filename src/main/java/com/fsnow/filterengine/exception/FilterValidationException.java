package com.fsnow.filterengine.exception;

/**
 * Exception thrown when a raw filter is malformed.
 * Validation is deterministic: the same input always fails the same way.
 */
public class FilterValidationException extends FilterEngineException {
    
    public FilterValidationException(String message) {
        super(message);
    }
    
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
