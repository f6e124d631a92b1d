package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Base for the conditions testing the presence of a field.
 * Keeps the registered field names in a sorted array, so that they can be
 * merge-joined with the sorted fields of a document.
 */
abstract class AbstractFieldOperand implements OperandStore {

    private static final String[] NO_FIELDS = new String[0];

    protected final Map<String, OperandEntry<String>> entries = new HashMap<>();
    protected String[] sortedFields = NO_FIELDS;

    @Override
    public void add(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        OperandEntry<String> entry = entries.get(field);

        if (entry == null) {
            entry = new OperandEntry<>(field);
            entries.put(field, entry);
            int index = -Arrays.binarySearch(sortedFields, field) - 1;
            String[] updated = new String[sortedFields.length + 1];
            System.arraycopy(sortedFields, 0, updated, 0, index);
            updated[index] = field;
            System.arraycopy(sortedFields, index, updated, index + 1, sortedFields.length - index);
            sortedFields = updated;
        }

        entry.add(subfilter);
    }

    @Override
    public void remove(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        OperandEntry<String> entry = entries.get(field);

        if (entry != null && entry.remove(subfilter)) {
            entries.remove(field);
            int index = Arrays.binarySearch(sortedFields, field);
            String[] updated = new String[sortedFields.length - 1];
            System.arraycopy(sortedFields, 0, updated, 0, index);
            System.arraycopy(sortedFields, index + 1, updated, index, updated.length - index);
            sortedFields = updated;
        }
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
