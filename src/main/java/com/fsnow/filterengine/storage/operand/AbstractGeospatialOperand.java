package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.geo.GeoShape;
import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;
import org.bson.Document;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for geospatial conditions: for each field, the registered shapes by condition id.
 */
abstract class AbstractGeospatialOperand implements OperandStore {

    protected final Map<String, Map<String, OperandEntry<GeoShape>>> fields = new HashMap<>();

    @Override
    public void add(StoredCondition condition, Subfilter subfilter) {
        fields.computeIfAbsent(condition.getField(), f -> new LinkedHashMap<>())
                .computeIfAbsent(condition.getId(), id -> new OperandEntry<>(shape(condition)))
                .add(subfilter);
    }

    @Override
    public void remove(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        Map<String, OperandEntry<GeoShape>> shapes = fields.get(field);
        if (shapes == null) {
            return;
        }

        OperandEntry<GeoShape> entry = shapes.get(condition.getId());
        if (entry != null && entry.remove(subfilter)) {
            shapes.remove(condition.getId());
            if (shapes.isEmpty()) {
                fields.remove(field);
            }
        }
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    private static GeoShape shape(StoredCondition condition) {
        Document value = condition.getTerm().getValue();
        String type = value.keySet().iterator().next();
        Document shape = (Document) value.get(type);
        return GeoShape.fromStandardized(type, shape.get(condition.getField()));
    }
}
