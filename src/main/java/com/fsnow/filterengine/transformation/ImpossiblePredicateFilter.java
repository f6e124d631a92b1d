package com.fsnow.filterengine.transformation;

import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.Term;
import com.fsnow.filterengine.storage.operand.ScalarComparator;
import org.bson.Document;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discards AND-clauses that no document can satisfy.
 * <p>
 * Detected contradictions, on a same field:
 * <ul>
 *   <li>{@code equals a=x} and {@code equals a=y}, with x != y</li>
 *   <li>{@code equals a=x} and {@code notequals a=x}</li>
 *   <li>{@code equals}, {@code exists} or {@code range} along with {@code notexists}</li>
 *   <li>{@code equals a=x} and a {@code range} not containing x</li>
 *   <li>any condition along with its own negation</li>
 *   <li>the {@code nothing} condition</li>
 * </ul>
 */
public class ImpossiblePredicateFilter {

    /**
     * Removes impossible clauses.
     *
     * @return the satisfiable clauses, possibly none
     */
    public List<List<Term>> filter(List<List<Term>> clauses) {
        List<List<Term>> result = new ArrayList<>();
        for (List<Term> clause : clauses) {
            if (isSatisfiable(clause)) {
                result.add(clause);
            }
        }
        return result;
    }

    boolean isSatisfiable(List<Term> clause) {
        Map<String, Object> equals = new HashMap<>();
        Map<String, List<Object>> notEquals = new HashMap<>();
        Map<String, List<Document>> ranges = new HashMap<>();
        Set<String> exists = new HashSet<>();
        Set<String> notExists = new HashSet<>();
        Set<String> sortKeys = new HashSet<>();

        for (Term term : clause) {
            sortKeys.add(term.getSortKey());
        }

        for (Term term : clause) {
            if (sortKeys.contains(term.negate().getSortKey())) {
                return false;
            }

            String field = term.getField();
            Keyword keyword = term.getStorageKeyword();

            switch (keyword) {
                case NOTHING:
                    return false;
                case EQUALS: {
                    Object value = term.getValue().get(field);
                    if (equals.containsKey(field) && !ScalarComparator.areEqual(equals.get(field), value)) {
                        return false;
                    }
                    equals.put(field, value);
                    break;
                }
                case NOT_EQUALS:
                    notEquals.computeIfAbsent(field, f -> new ArrayList<>()).add(term.getValue().get(field));
                    break;
                case EXISTS:
                    exists.add(field);
                    break;
                case NOT_EXISTS:
                    notExists.add(field);
                    break;
                case RANGE:
                    ranges.computeIfAbsent(field, f -> new ArrayList<>()).add((Document) term.getValue().get(field));
                    break;
                default:
                    break;
            }
        }

        for (String field : notExists) {
            if (equals.containsKey(field) || exists.contains(field) || ranges.containsKey(field)) {
                return false;
            }
        }

        for (Map.Entry<String, Object> entry : equals.entrySet()) {
            Object value = entry.getValue();

            for (Object excluded : notEquals.getOrDefault(entry.getKey(), List.of())) {
                if (ScalarComparator.areEqual(value, excluded)) {
                    return false;
                }
            }

            for (Document range : ranges.getOrDefault(entry.getKey(), List.of())) {
                if (!(value instanceof Number) || !inRange(((Number) value).doubleValue(), range)) {
                    return false;
                }
            }
        }

        return true;
    }

    static boolean inRange(double value, Document range) {
        if (range.containsKey("gt") && value <= number(range, "gt")) return false;
        if (range.containsKey("gte") && value < number(range, "gte")) return false;
        if (range.containsKey("lt") && value >= number(range, "lt")) return false;
        if (range.containsKey("lte") && value > number(range, "lte")) return false;
        return true;
    }

    private static double number(Document range, String bound) {
        return ((Number) range.get(bound)).doubleValue();
    }
}
