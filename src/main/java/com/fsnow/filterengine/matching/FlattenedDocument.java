package com.fsnow.filterengine.matching;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only view of a document where nested fields are addressed by their
 * dotted path.
 * <p>
 * {@code {a: {b: 1}}} exposes both {@code a} (the nested object) and
 * {@code a.b}. Arrays are leaves: their items are not flattened.
 */
public final class FlattenedDocument {

    /**
     * Field holding the document id, when one is provided.
     */
    public static final String ID_FIELD = "_id";

    private final Map<String, Object> fields;
    private String[] sortedFields;

    private FlattenedDocument(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * Flattens a document.
     *
     * @param document The document, may be null
     * @param documentId The document id, exposed as {@value #ID_FIELD} when not null
     */
    public static FlattenedDocument of(Map<String, Object> document, String documentId) {
        Map<String, Object> fields = new HashMap<>();
        if (document != null) {
            flatten(document, null, fields);
        }
        if (documentId != null) {
            fields.put(ID_FIELD, documentId);
        }
        return new FlattenedDocument(fields);
    }

    public static FlattenedDocument of(Map<String, Object> document) {
        return of(document, null);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(Map<String, Object> source, String prefix, Map<String, Object> target) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String path = prefix == null ? entry.getKey() : prefix + '.' + entry.getKey();
            Object value = entry.getValue();
            target.put(path, value);

            if (value instanceof Map) {
                flatten((Map<String, Object>) value, path, target);
            }
        }
    }

    /**
     * Checks if the field is present, even with a null value.
     */
    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Field paths, in natural order. Computed once per document.
     */
    public String[] sortedFields() {
        if (sortedFields == null) {
            sortedFields = fields.keySet().toArray(new String[0]);
            Arrays.sort(sortedFields);
        }
        return sortedFields;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "FlattenedDocument" + fields;
    }
}
