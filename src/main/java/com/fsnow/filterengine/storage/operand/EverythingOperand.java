package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;

/**
 * Subfilters matching any document.
 */
public class EverythingOperand implements OperandStore {

    private final OperandEntry<Void> entry = new OperandEntry<>(null);

    @Override
    public Keyword getKeyword() {
        return Keyword.EVERYTHING;
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
        OperandStore.addMatches(entry.getSubfilters(), context);
    }
}
