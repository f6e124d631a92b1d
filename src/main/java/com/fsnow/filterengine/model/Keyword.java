package com.fsnow.filterengine.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Storage keywords, i.e. primitive DSL keywords with the negation folded in.
 * Declaration order is the order in which operand stores are matched
 * against a document.
 */
public enum Keyword {
    EVERYTHING("everything"),
    EQUALS("equals"),
    EXISTS("exists"),
    NOT_EXISTS("notexists"),
    RANGE("range"),
    NOT_RANGE("notrange"),
    NOT_EQUALS("notequals"),
    REGEXP("regexp"),
    NOT_REGEXP("notregexp"),
    GEOSPATIAL("geospatial"),
    NOT_GEOSPATIAL("notgeospatial"),
    NOTHING("nothing");

    private static final Map<String, Keyword> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(Keyword::getName, Function.identity()));

    private final String name;

    Keyword(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the keyword testing the complement of this one.
     */
    public Keyword negate() {
        switch (this) {
            case EVERYTHING: return NOTHING;
            case NOTHING: return EVERYTHING;
            case EQUALS: return NOT_EQUALS;
            case NOT_EQUALS: return EQUALS;
            case EXISTS: return NOT_EXISTS;
            case NOT_EXISTS: return EXISTS;
            case RANGE: return NOT_RANGE;
            case NOT_RANGE: return RANGE;
            case REGEXP: return NOT_REGEXP;
            case NOT_REGEXP: return REGEXP;
            case GEOSPATIAL: return NOT_GEOSPATIAL;
            case NOT_GEOSPATIAL: return GEOSPATIAL;
            default: throw new IllegalStateException("Unhandled keyword: " + this);
        }
    }

    /**
     * Checks if this keyword is the negated form of a primitive keyword.
     */
    public boolean isNegated() {
        return name.startsWith("not") && this != NOTHING;
    }

    /**
     * Resolves a storage keyword from its name, e.g. "notequals".
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Keyword fromName(String name) {
        Keyword keyword = BY_NAME.get(name);
        if (keyword == null) {
            throw new IllegalArgumentException("Unknown storage keyword: " + name);
        }
        return keyword;
    }
}
