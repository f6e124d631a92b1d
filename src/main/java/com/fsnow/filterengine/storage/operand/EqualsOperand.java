package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;

import java.util.HashMap;
import java.util.Map;

/**
 * {@code equals} conditions: field, then value, to subfilters.
 * A document value is resolved with a single lookup per registered field.
 */
public class EqualsOperand implements OperandStore {

    private final Map<String, Map<Object, OperandEntry<Object>>> fields = new HashMap<>();

    @Override
    public Keyword getKeyword() {
        return Keyword.EQUALS;
    }

    @Override
    public void add(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        Object value = condition.getTerm().getValue().get(field);

        fields.computeIfAbsent(field, f -> new HashMap<>())
                .computeIfAbsent(ScalarComparator.lookupKey(value), v -> new OperandEntry<>(value))
                .add(subfilter);
    }

    @Override
    public void remove(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        Map<Object, OperandEntry<Object>> values = fields.get(field);
        if (values == null) {
            return;
        }

        Object key = ScalarComparator.lookupKey(condition.getTerm().getValue().get(field));
        OperandEntry<Object> entry = values.get(key);

        if (entry != null && entry.remove(subfilter)) {
            values.remove(key);
            if (values.isEmpty()) {
                fields.remove(field);
            }
        }
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        for (Map.Entry<String, Map<Object, OperandEntry<Object>>> field : fields.entrySet()) {
            if (!document.has(field.getKey())) {
                continue;
            }

            Object value = document.get(field.getKey());
            if (!ScalarComparator.isScalar(value)) {
                continue;
            }

            OperandEntry<Object> entry = field.getValue().get(ScalarComparator.lookupKey(value));
            if (entry != null) {
                OperandStore.addMatches(entry.getSubfilters(), context);
            }
        }
    }
}
