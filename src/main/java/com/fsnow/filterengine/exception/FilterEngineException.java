package com.fsnow.filterengine.exception;

/**
 * Base exception for all filter engine errors.
 */
public class FilterEngineException extends RuntimeException {
    
    public FilterEngineException(String message) {
        super(message);
    }
    
    public FilterEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
