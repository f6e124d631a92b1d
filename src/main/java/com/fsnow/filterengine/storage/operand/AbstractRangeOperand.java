package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.storage.StoredCondition;
import com.fsnow.filterengine.storage.Subfilter;
import org.bson.Document;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for range conditions: one interval tree per field.
 * Each condition is indexed with the intervals returned by {@link #intervals}.
 */
abstract class AbstractRangeOperand implements OperandStore {

    /**
     * Intervals and entries of one field.
     */
    static final class FieldRanges {
        final IntervalTree<OperandEntry<String>> tree = new IntervalTree<>();
        final Map<String, OperandEntry<String>> entries = new LinkedHashMap<>();
        final Map<String, List<IntervalTree.Interval<OperandEntry<String>>>> intervals = new HashMap<>();
    }

    protected final Map<String, FieldRanges> fields = new HashMap<>();

    /**
     * Builds the intervals a matching value must fall into.
     */
    protected abstract List<IntervalTree.Interval<OperandEntry<String>>> intervals(
            RangeBounds bounds, OperandEntry<String> entry);

    @Override
    public void add(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        FieldRanges ranges = fields.computeIfAbsent(field, f -> new FieldRanges());
        OperandEntry<String> entry = ranges.entries.get(condition.getId());

        if (entry == null) {
            entry = new OperandEntry<>(condition.getId());
            RangeBounds bounds = RangeBounds.of((Document) condition.getTerm().getValue().get(field));
            List<IntervalTree.Interval<OperandEntry<String>>> entryIntervals = intervals(bounds, entry);

            for (IntervalTree.Interval<OperandEntry<String>> interval : entryIntervals) {
                ranges.tree.add(interval);
            }
            ranges.entries.put(condition.getId(), entry);
            ranges.intervals.put(condition.getId(), entryIntervals);
        }

        entry.add(subfilter);
    }

    @Override
    public void remove(StoredCondition condition, Subfilter subfilter) {
        String field = condition.getField();
        FieldRanges ranges = fields.get(field);
        if (ranges == null) {
            return;
        }

        OperandEntry<String> entry = ranges.entries.get(condition.getId());
        if (entry != null && entry.remove(subfilter)) {
            ranges.entries.remove(condition.getId());
            for (IntervalTree.Interval<OperandEntry<String>> interval : ranges.intervals.remove(condition.getId())) {
                ranges.tree.remove(interval);
            }
            if (ranges.entries.isEmpty()) {
                fields.remove(field);
            }
        }
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
