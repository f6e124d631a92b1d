package com.fsnow.filterengine.model;

import org.bson.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A filter in canonical form, ready to be stored: an OR of AND-clauses,
 * bound to an index and collection, with its content-derived id.
 */
public final class NormalizedFilter {

    private final String index;
    private final String collection;
    private final String id;
    private final List<List<Term>> clauses;

    public NormalizedFilter(String index, String collection, String id, List<List<Term>> clauses) {
        this.index = Objects.requireNonNull(index, "Index cannot be null");
        this.collection = Objects.requireNonNull(collection, "Collection cannot be null");
        this.id = Objects.requireNonNull(id, "Id cannot be null");
        List<List<Term>> copy = new ArrayList<>();
        for (List<Term> clause : clauses) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(clause)));
        }
        this.clauses = Collections.unmodifiableList(copy);
    }

    public String getIndex() {
        return index;
    }

    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }

    /**
     * AND-clauses of this filter, OR'ed together.
     */
    public List<List<Term>> getClauses() {
        return clauses;
    }

    /**
     * Renders the clauses as nested lists of term documents.
     */
    public List<List<Document>> clausesToDocuments() {
        return toDocuments(clauses);
    }

    public static List<List<Document>> toDocuments(List<List<Term>> clauses) {
        List<List<Document>> result = new ArrayList<>();
        for (List<Term> clause : clauses) {
            List<Document> terms = new ArrayList<>();
            for (Term term : clause) {
                terms.add(term.toDocument());
            }
            result.add(terms);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizedFilter that = (NormalizedFilter) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("NormalizedFilter{id='%s', index='%s', collection='%s', clauses=%s}",
                id, index, collection, clauses);
    }
}
