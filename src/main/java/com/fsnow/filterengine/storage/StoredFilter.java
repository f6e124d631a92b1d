package com.fsnow.filterengine.storage;

import com.fsnow.filterengine.model.NormalizedFilter;

import java.util.List;

/**
 * A registered filter: an OR of subfilters.
 */
public final class StoredFilter {

    private final NormalizedFilter filter;
    private final List<String> subfilterIds;
    private int slot = -1;

    StoredFilter(NormalizedFilter filter, List<String> subfilterIds) {
        this.filter = filter;
        this.subfilterIds = List.copyOf(subfilterIds);
    }

    public String getId() {
        return filter.getId();
    }

    public NormalizedFilter getFilter() {
        return filter;
    }

    public List<String> getSubfilterIds() {
        return subfilterIds;
    }

    public int getSlot() {
        return slot;
    }

    void setSlot(int slot) {
        this.slot = slot;
    }

    @Override
    public String toString() {
        return String.format("StoredFilter{id='%s', slot=%d, subfilters=%s}", getId(), slot, subfilterIds);
    }
}
