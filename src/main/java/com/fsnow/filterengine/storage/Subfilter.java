package com.fsnow.filterengine.storage;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An AND-clause, shared by every filter containing it.
 * <p>
 * Operand stores keep references to subfilters and report matches using
 * their test table slot, which changes when the table is reindexed.
 */
public final class Subfilter {

    private final String id;
    private final List<String> conditionIds;
    private final Set<String> filterIds = new LinkedHashSet<>();
    private int slot = -1;

    Subfilter(String id, List<String> conditionIds) {
        this.id = id;
        this.conditionIds = List.copyOf(conditionIds);
    }

    public String getId() {
        return id;
    }

    public List<String> getConditionIds() {
        return conditionIds;
    }

    public Set<String> getFilterIds() {
        return Collections.unmodifiableSet(filterIds);
    }

    public int getSlot() {
        return slot;
    }

    void setSlot(int slot) {
        this.slot = slot;
    }

    void addFilter(String filterId) {
        filterIds.add(filterId);
    }

    /**
     * @return true if no filter owns this subfilter anymore
     */
    boolean removeFilter(String filterId) {
        filterIds.remove(filterId);
        return filterIds.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Subfilter{id='%s', slot=%d, conditions=%d, filters=%d}",
                id, slot, conditionIds.size(), filterIds.size());
    }
}
