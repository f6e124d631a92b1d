package com.fsnow.filterengine.model;

import org.bson.Document;

import java.util.Objects;

/**
 * A primitive filter condition, possibly negated.
 * The value keeps the standardized DSL layout of its keyword:
 * <ul>
 *   <li>equals: {@code {field: scalar}}</li>
 *   <li>exists: {@code {field: "name"}}</li>
 *   <li>range: {@code {field: {gt|gte|lt|lte: number}}}</li>
 *   <li>regexp: {@code {field: {value: "pattern", flags: "i"}}}</li>
 *   <li>geospatial: {@code {geoBoundingBox|geoDistance|geoDistanceRange|geoPolygon: {field: shape}}}</li>
 *   <li>everything / nothing: empty</li>
 * </ul>
 */
public final class Term {

    private final Keyword keyword;
    private final Document value;
    private final boolean not;
    private String sortKey;

    public Term(Keyword keyword, Document value, boolean not) {
        Objects.requireNonNull(keyword, "Keyword cannot be null");
        if (keyword.isNegated()) {
            throw new IllegalArgumentException("Term keyword must be a positive keyword: " + keyword);
        }
        this.keyword = keyword;
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.not = not;
    }

    public static Term of(Keyword keyword, Document value) {
        return new Term(keyword, value, false);
    }

    public static Term everything() {
        return new Term(Keyword.EVERYTHING, new Document(), false);
    }

    public static Term nothing() {
        return new Term(Keyword.NOTHING, new Document(), false);
    }

    /**
     * Positive DSL keyword of this term.
     */
    public Keyword getKeyword() {
        return keyword;
    }

    public Document getValue() {
        return value;
    }

    public boolean isNot() {
        return not;
    }

    /**
     * Keyword used to store this term, e.g. "notequals" for a negated equals.
     */
    public Keyword getStorageKeyword() {
        return not ? keyword.negate() : keyword;
    }

    public Term negate() {
        if (keyword == Keyword.EVERYTHING) {
            return nothing();
        }
        if (keyword == Keyword.NOTHING) {
            return everything();
        }
        return new Term(keyword, value, !not);
    }

    /**
     * Gets the document field tested by this term, or null for everything/nothing.
     */
    public String getField() {
        switch (keyword) {
            case EXISTS:
                return value.getString("field");
            case EQUALS:
            case RANGE:
            case REGEXP:
                return value.keySet().iterator().next();
            case GEOSPATIAL:
                Document shape = (Document) value.values().iterator().next();
                return shape.keySet().iterator().next();
            default:
                return null;
        }
    }

    /**
     * Renders this term in its wire layout: {@code {keyword: value, not: boolean}}.
     */
    public Document toDocument() {
        return new Document(keyword.getName(), value).append("not", not);
    }

    /**
     * Parses a term rendered by {@link #toDocument()}.
     */
    public static Term fromDocument(Document document) {
        boolean not = document.getBoolean("not", false);
        for (String key : document.keySet()) {
            if (!"not".equals(key)) {
                Object value = document.get(key);
                return new Term(Keyword.fromName(key), value instanceof Document ? (Document) value : new Document(), not);
            }
        }
        throw new IllegalArgumentException("Term document has no keyword: " + document.toJson());
    }

    /**
     * Deterministic ordering key: storage keyword name, then canonical value.
     */
    public String getSortKey() {
        if (sortKey == null) {
            sortKey = getStorageKeyword().getName() + ':' + CanonicalJson.of(value);
        }
        return sortKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Term term = (Term) o;
        return getSortKey().equals(term.getSortKey());
    }

    @Override
    public int hashCode() {
        return getSortKey().hashCode();
    }

    @Override
    public String toString() {
        return (not ? "not " : "") + keyword.getName() + value.toJson();
    }
}
