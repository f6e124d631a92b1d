package com.fsnow.filterengine.model;

import org.bson.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Storage change produced by the registration of a new filter.
 * Peers in a distributed deployment parse it with {@link #fromDocument(Document)}
 * and replay it by storing {@link #getFilter()}.
 */
public final class FilterDiff {

    private final NormalizedFilter filter;
    private final List<String> addedSubfilterIds;
    private final List<String> addedConditionIds;

    public FilterDiff(NormalizedFilter filter, List<String> addedSubfilterIds, List<String> addedConditionIds) {
        this.filter = Objects.requireNonNull(filter, "Filter cannot be null");
        this.addedSubfilterIds = Collections.unmodifiableList(new ArrayList<>(addedSubfilterIds));
        this.addedConditionIds = Collections.unmodifiableList(new ArrayList<>(addedConditionIds));
    }

    public NormalizedFilter getFilter() {
        return filter;
    }

    public List<String> getAddedSubfilterIds() {
        return addedSubfilterIds;
    }

    public List<String> getAddedConditionIds() {
        return addedConditionIds;
    }

    /**
     * Renders this diff for transport.
     */
    public Document toDocument() {
        return new Document("ftAdd", new Document("i", filter.getIndex())
                .append("c", filter.getCollection())
                .append("id", filter.getId())
                .append("f", filter.clausesToDocuments())
                .append("sf", addedSubfilterIds)
                .append("cd", addedConditionIds));
    }

    /**
     * Parses a diff rendered by {@link #toDocument()}.
     *
     * @throws IllegalArgumentException if the document is not a rendered diff
     */
    @SuppressWarnings("unchecked")
    public static FilterDiff fromDocument(Document document) {
        Document content = document.get("ftAdd", Document.class);
        if (content == null) {
            throw new IllegalArgumentException("Not a filter diff: " + document.toJson());
        }

        List<List<Term>> clauses = new ArrayList<>();
        for (Object clause : content.getList("f", Object.class)) {
            List<Term> terms = new ArrayList<>();
            for (Object term : (List<Object>) clause) {
                terms.add(Term.fromDocument((Document) term));
            }
            clauses.add(terms);
        }

        NormalizedFilter filter = new NormalizedFilter(content.getString("i"), content.getString("c"),
                content.getString("id"), clauses);
        return new FilterDiff(filter, content.getList("sf", String.class), content.getList("cd", String.class));
    }

    @Override
    public String toString() {
        return String.format("FilterDiff{id='%s', subfilters=%d, conditions=%d}",
                filter.getId(), addedSubfilterIds.size(), addedConditionIds.size());
    }
}
