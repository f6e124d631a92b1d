package com.fsnow.filterengine.model;

import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders values as JSON with object keys sorted at every depth, so that
 * structurally identical values always produce the same text.
 */
public final class CanonicalJson {
    
    private CanonicalJson() {}
    
    /**
     * Renders a document with recursively sorted keys.
     */
    public static String of(Document document) {
        return sorted(document).toJson();
    }
    
    /**
     * Renders any list of documents (or nested lists) with recursively sorted keys.
     */
    public static String of(List<?> values) {
        return new Document("v", sortValue(values)).toJson();
    }
    
    private static Document sorted(Map<String, Object> document) {
        Document result = new Document();
        for (Map.Entry<String, Object> entry : new TreeMap<>(document).entrySet()) {
            result.put(entry.getKey(), sortValue(entry.getValue()));
        }
        return result;
    }
    
    @SuppressWarnings("unchecked")
    private static Object sortValue(Object value) {
        if (value instanceof Map) {
            return sorted((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> result = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                result.add(sortValue(item));
            }
            return result;
        }
        return value;
    }
}
