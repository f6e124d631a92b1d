package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.storage.Subfilter;

import java.util.ArrayList;
import java.util.List;

/**
 * A condition operand along with the subfilters using it.
 */
final class OperandEntry<K> {

    private final K operand;
    private final List<Subfilter> subfilters = new ArrayList<>();

    OperandEntry(K operand) {
        this.operand = operand;
    }

    K getOperand() {
        return operand;
    }

    List<Subfilter> getSubfilters() {
        return subfilters;
    }

    void add(Subfilter subfilter) {
        if (!subfilters.contains(subfilter)) {
            subfilters.add(subfilter);
        }
    }

    /**
     * @return true if the entry is now empty
     */
    boolean remove(Subfilter subfilter) {
        subfilters.remove(subfilter);
        return subfilters.isEmpty();
    }
}
