package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;

/**
 * Subfilters that never match. They are kept so that their filter can be
 * registered and removed like any other.
 */
public class NothingOperand implements OperandStore {

    private final OperandEntry<Void> entry = new OperandEntry<>(null);

    @Override
    public Keyword getKeyword() {
        return Keyword.NOTHING;
    }

    @Override
    public void add(StoredCondition condition, Subfilter subfilter) {
        entry.add(subfilter);
    }

    @Override
    public void remove(StoredCondition condition, Subfilter subfilter) {
        entry.remove(subfilter);
    }

    @Override
    public boolean isEmpty() {
        return entry.getSubfilters().isEmpty();
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        // never satisfied
    }
}
