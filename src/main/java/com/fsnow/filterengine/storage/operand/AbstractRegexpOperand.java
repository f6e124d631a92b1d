package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.model.RegexpPattern;
import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for regular expression conditions: for each field, the compiled
 * patterns sorted by expression then flags.
 */
abstract class AbstractRegexpOperand implements OperandStore {

    protected final Map<String, List<OperandEntry<RegexpPattern>>> fields = new HashMap<>();

    @Override
    public void add(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        RegexpPattern pattern = pattern(condition);
        List<OperandEntry<RegexpPattern>> patterns = fields.computeIfAbsent(field, f -> new ArrayList<>());
        int index = search(patterns, pattern);

        if (index >= 0) {
            patterns.get(index).add(subfilter);
        } else {
            OperandEntry<RegexpPattern> entry = new OperandEntry<>(pattern);
            entry.add(subfilter);
            patterns.add(-index - 1, entry);
        }
    }

    @Override
    public void remove(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        List<OperandEntry<RegexpPattern>> patterns = fields.get(field);
        if (patterns == null) {
            return;
        }

        int index = search(patterns, pattern(condition));
        if (index >= 0 && patterns.get(index).remove(subfilter)) {
            patterns.remove(index);
            if (patterns.isEmpty()) {
                fields.remove(field);
            }
        }
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    private static RegexpPattern pattern(StoredCondition condition) {
        Document regexp = (Document) condition.getTerm().getValue().get(condition.getField());
        return RegexpPattern.compile(regexp.getString("value"), regexp.getString("flags"));
    }

    private static int search(List<OperandEntry<RegexpPattern>> patterns, RegexpPattern pattern) {
        List<RegexpPattern> keys = new ArrayList<>(patterns.size());
        for (OperandEntry<RegexpPattern> entry : patterns) {
            keys.add(entry.getOperand());
        }
        return Collections.binarySearch(keys, pattern);
    }
}
