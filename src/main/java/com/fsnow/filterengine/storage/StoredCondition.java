package com.fsnow.filterengine.storage;

import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.Term;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A primitive condition, shared by every subfilter using it.
 */
public final class StoredCondition {

    private final String id;
    private final Term term;
    private final Set<String> subfilterIds = new LinkedHashSet<>();

    StoredCondition(String id, Term term) {
        this.id = id;
        this.term = term;
    }

    public String getId() {
        return id;
    }

    public Term getTerm() {
        return term;
    }

    /**
     * Storage keyword, with the negation folded in.
     */
    public Keyword getKeyword() {
        return term.getStorageKeyword();
    }

    public String getField() {
        return term.getField();
    }

    public Set<String> getSubfilterIds() {
        return Collections.unmodifiableSet(subfilterIds);
    }

    void addSubfilter(String subfilterId) {
        subfilterIds.add(subfilterId);
    }

    /**
     * @return true if no subfilter references this condition anymore
     */
    boolean removeSubfilter(String subfilterId) {
        subfilterIds.remove(subfilterId);
        return subfilterIds.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("StoredCondition{id='%s', term=%s, subfilters=%d}", id, term, subfilterIds.size());
    }
}
