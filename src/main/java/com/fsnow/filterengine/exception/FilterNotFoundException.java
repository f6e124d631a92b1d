package com.fsnow.filterengine.exception;

/**
 * Exception thrown when removing a filter id that is not registered.
 */
public class FilterNotFoundException extends FilterEngineException {
    
    private final String filterId;
    
    public FilterNotFoundException(String filterId) {
        super(String.format("Unable to remove filter \"%s\": filter not found", filterId));
        this.filterId = filterId;
    }
    
    public String getFilterId() {
        return filterId;
    }
}
