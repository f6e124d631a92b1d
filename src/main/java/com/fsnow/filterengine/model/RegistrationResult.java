package com.fsnow.filterengine.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a filter registration.
 */
public final class RegistrationResult {

    private final String id;
    private final FilterDiff diff;

    private RegistrationResult(String id, FilterDiff diff) {
        this.id = Objects.requireNonNull(id, "Id cannot be null");
        this.diff = diff;
    }

    public static RegistrationResult created(FilterDiff diff) {
        return new RegistrationResult(diff.getFilter().getId(), diff);
    }

    public static RegistrationResult existing(String id) {
        return new RegistrationResult(id, null);
    }

    public String getId() {
        return id;
    }

    /**
     * Storage diff, empty if the filter was already registered.
     */
    public Optional<FilterDiff> getDiff() {
        return Optional.ofNullable(diff);
    }

    public boolean isCreated() {
        return diff != null;
    }

    @Override
    public String toString() {
        return String.format("RegistrationResult{id='%s', created=%s}", id, isCreated());
    }
}
