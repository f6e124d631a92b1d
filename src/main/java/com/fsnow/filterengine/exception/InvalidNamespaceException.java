package com.fsnow.filterengine.exception;

/**
 * Exception thrown when an index or collection name is missing or blank.
 */
public class InvalidNamespaceException extends FilterValidationException {
    
    public InvalidNamespaceException(String index, String collection) {
        super(String.format("Invalid namespace: index='%s', collection='%s'. Both must be non-empty strings",
                index, collection));
    }
}
