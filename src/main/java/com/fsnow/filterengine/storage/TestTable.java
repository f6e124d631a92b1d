package com.fsnow.filterengine.storage;

import com.fsnow.filterengine.matching.MatchContext;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Per-namespace reference table used to aggregate condition matches.
 * <p>
 * Subfilters and filters are given dense integer slots. For each subfilter
 * slot the table holds the number of conditions to satisfy and the slots of
 * the filters owning it. Removal leaves holes, tracked until the table is
 * compacted by {@link #reset()} followed by re-registration of live entries.
 * <p>
 * Scratch buffers used by {@link #newMatchContext()} are owned by the table
 * and reused across calls. Not thread-safe: callers hold the namespace lock.
 */
public final class TestTable {

    private static final int INITIAL_CAPACITY = 16;
    private static final int[] NO_FILTERS = new int[0];

    private int[] conditionCounts;
    private int[][] filterSlots;
    private String[] filterIds;
    private int subfilterCount;
    private int filterCount;
    private int removedSubfilters;
    private int removedFilters;

    private int[] scratchCounts;
    private final BitSet scratchMatches = new BitSet();

    public TestTable() {
        reset();
    }

    /**
     * Empties the table, discarding every slot.
     */
    void reset() {
        conditionCounts = new int[INITIAL_CAPACITY];
        filterSlots = new int[INITIAL_CAPACITY][];
        filterIds = new String[INITIAL_CAPACITY];
        scratchCounts = new int[INITIAL_CAPACITY];
        subfilterCount = 0;
        filterCount = 0;
        removedSubfilters = 0;
        removedFilters = 0;
    }

    /**
     * Allocates a subfilter slot.
     *
     * @param conditionCount Number of conditions of the subfilter
     * @return the new slot
     */
    int addSubfilter(int conditionCount) {
        if (subfilterCount == conditionCounts.length) {
            int capacity = conditionCounts.length * 2;
            conditionCounts = Arrays.copyOf(conditionCounts, capacity);
            filterSlots = Arrays.copyOf(filterSlots, capacity);
            scratchCounts = new int[capacity];
        }
        conditionCounts[subfilterCount] = conditionCount;
        filterSlots[subfilterCount] = NO_FILTERS;
        return subfilterCount++;
    }

    /**
     * Allocates a filter slot.
     *
     * @return the new slot
     */
    int addFilter(String filterId) {
        if (filterCount == filterIds.length) {
            filterIds = Arrays.copyOf(filterIds, filterIds.length * 2);
        }
        filterIds[filterCount] = filterId;
        return filterCount++;
    }

    /**
     * Declares that a filter owns a subfilter.
     */
    void attach(int subfilterSlot, int filterSlot) {
        int[] slots = filterSlots[subfilterSlot];
        int[] updated = Arrays.copyOf(slots, slots.length + 1);
        updated[slots.length] = filterSlot;
        filterSlots[subfilterSlot] = updated;
    }

    void detach(int subfilterSlot, int filterSlot) {
        int[] slots = filterSlots[subfilterSlot];
        filterSlots[subfilterSlot] = Arrays.stream(slots).filter(s -> s != filterSlot).toArray();
    }

    /**
     * Frees a subfilter slot. The slot stays allocated until the next compaction.
     */
    void removeSubfilter(int slot) {
        conditionCounts[slot] = 0;
        filterSlots[slot] = NO_FILTERS;
        removedSubfilters++;
    }

    void removeFilter(int slot) {
        filterIds[slot] = null;
        removedFilters++;
    }

    public int getSubfilterCount() {
        return subfilterCount;
    }

    public int getFilterCount() {
        return filterCount;
    }

    /**
     * Number of freed slots, subfilters and filters included.
     */
    public int getRemovedCount() {
        return removedSubfilters + removedFilters;
    }

    /**
     * Checks if freed slots exceed the given share of allocated slots.
     */
    public boolean needsReindex(double threshold) {
        int removed = getRemovedCount();
        return removed > 0 && removed > threshold * (subfilterCount + filterCount);
    }

    int getConditionCount(int subfilterSlot) {
        return conditionCounts[subfilterSlot];
    }

    int[] getFilterSlots(int subfilterSlot) {
        return filterSlots[subfilterSlot];
    }

    String getFilterId(int filterSlot) {
        return filterIds[filterSlot];
    }

    /**
     * Starts a match call, resetting the scratch buffers from the reference table.
     */
    public MatchContext newMatchContext() {
        System.arraycopy(conditionCounts, 0, scratchCounts, 0, subfilterCount);
        scratchMatches.clear();
        return new MatchContext(scratchCounts, scratchMatches, filterSlots, filterIds);
    }

    @Override
    public String toString() {
        return String.format("TestTable{subfilters=%d, filters=%d, removed=%d}",
                subfilterCount, filterCount, getRemovedCount());
    }
}
