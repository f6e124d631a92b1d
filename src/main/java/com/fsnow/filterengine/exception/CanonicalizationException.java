package com.fsnow.filterengine.exception;

/**
 * Exception thrown when an already standardized filter cannot be converted
 * to its canonical form. This is a defect, not a user input problem.
 */
public class CanonicalizationException extends FilterEngineException {
    
    public CanonicalizationException(String message) {
        super(message);
    }
    
    public CanonicalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
