package com.fsnow.filterengine.matching;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * State of a single match call.
 * <p>
 * Holds the remaining-conditions counter of every subfilter slot and the
 * filters already reported. The arrays are scratch buffers owned by the
 * namespace test table, reset at the start of each call, so a context is only
 * valid while the namespace lock is held.
 */
public final class MatchContext {

    private final int[] remaining;
    private final BitSet matchedFilters;
    private final int[][] filterSlots;
    private final String[] filterIds;
    private final List<String> matches = new ArrayList<>();

    public MatchContext(int[] remaining, BitSet matchedFilters, int[][] filterSlots, String[] filterIds) {
        this.remaining = remaining;
        this.matchedFilters = matchedFilters;
        this.filterSlots = filterSlots;
        this.filterIds = filterIds;
    }

    /**
     * Records that one condition of a subfilter is satisfied.
     * Once all of them are, every filter owning the subfilter is reported,
     * each at most once.
     *
     * @param subfilterSlot The subfilter test table slot
     */
    public void addMatch(int subfilterSlot) {
        if (--remaining[subfilterSlot] != 0) {
            return;
        }

        for (int filterSlot : filterSlots[subfilterSlot]) {
            if (!matchedFilters.get(filterSlot)) {
                matchedFilters.set(filterSlot);
                matches.add(filterIds[filterSlot]);
            }
        }
    }

    /**
     * Ids of the filters matched so far, in match order.
     */
    public List<String> getMatches() {
        return matches;
    }
}
