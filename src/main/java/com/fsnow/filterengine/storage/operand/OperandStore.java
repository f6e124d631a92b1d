package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;

import java.util.Collection;

/**
 * Index of the conditions of one storage keyword, for one namespace.
 * <p>
 * Resolves the fields and values of a document to the subfilters whose
 * conditions they satisfy. An entry exists only while at least one
 * subfilter references its condition.
 */
public interface OperandStore {

    Keyword getKeyword();

    /**
     * Indexes a condition for a subfilter using it.
     */
    void add(StoredCondition condition, Subfilter subfilter);

    /**
     * Removes a subfilter from a condition entry, dropping the entry
     * and then the field once they become empty.
     */
    void remove(StoredCondition condition, Subfilter subfilter);

    boolean isEmpty();

    /**
     * Reports every subfilter whose condition is satisfied by the document.
     */
    void match(FlattenedDocument document, MatchContext context);

    static void addMatches(Collection<Subfilter> subfilters, MatchContext context) {
        for (Subfilter subfilter : subfilters) {
            context.addMatch(subfilter.getSlot());
        }
    }
}
