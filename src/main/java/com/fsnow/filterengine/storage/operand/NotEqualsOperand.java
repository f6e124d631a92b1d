package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code notequals} conditions: for each field, the registered values sorted
 * with {@link ScalarComparator}.
 * <p>
 * A document matches every registered value of a field except the one equal
 * to its own, located by binary search. A missing or non-scalar field
 * matches all of them.
 */
public class NotEqualsOperand implements OperandStore {

    private final Map<String, List<OperandEntry<Object>>> fields = new HashMap<>();

    @Override
    public Keyword getKeyword() {
        return Keyword.NOT_EQUALS;
    }

    @Override
    public void add(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        Object value = condition.getTerm().getValue().get(field);
        List<OperandEntry<Object>> values = fields.computeIfAbsent(field, f -> new ArrayList<>());
        int index = search(values, value);

        if (index >= 0) {
            values.get(index).add(subfilter);
        } else {
            OperandEntry<Object> entry = new OperandEntry<>(value);
            entry.add(subfilter);
            values.add(-index - 1, entry);
        }
    }

    @Override
    public void remove(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        List<OperandEntry<Object>> values = fields.get(field);
        if (values == null) {
            return;
        }

        int index = search(values, condition.getTerm().getValue().get(field));
        if (index >= 0 && values.get(index).remove(subfilter)) {
            values.remove(index);
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
        for (Map.Entry<String, List<OperandEntry<Object>>> field : fields.entrySet()) {
            List<OperandEntry<Object>> values = field.getValue();
            int excluded = -1;

            if (document.has(field.getKey())) {
                Object value = document.get(field.getKey());
                if (ScalarComparator.isScalar(value)) {
                    excluded = search(values, value);
                }
            }

            for (int i = 0; i < values.size(); i++) {
                if (i != excluded) {
                    OperandStore.addMatches(values.get(i).getSubfilters(), context);
                }
            }
        }
    }

    private static int search(List<OperandEntry<Object>> values, Object value) {
        int low = 0;
        int high = values.size() - 1;

        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = ScalarComparator.INSTANCE.compare(values.get(mid).getOperand(), value);

            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }
}
