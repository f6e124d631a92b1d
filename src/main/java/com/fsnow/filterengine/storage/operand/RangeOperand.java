package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;

import java.util.List;
import java.util.Map;

/**
 * {@code range} conditions: matches numeric values lying in the registered intervals.
 */
public class RangeOperand extends AbstractRangeOperand {

    @Override
    public Keyword getKeyword() {
        return Keyword.RANGE;
    }

    @Override
    protected List<IntervalTree.Interval<OperandEntry<String>>> intervals(RangeBounds bounds,
                                                                        OperandEntry<String> entry) {
        return List.of(new IntervalTree.Interval<>(bounds.low, bounds.lowInclusive,
                bounds.high, bounds.highInclusive, entry));
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        for (Map.Entry<String, FieldRanges> field : fields.entrySet()) {
            Object value = document.get(field.getKey());

            if (value instanceof Number) {
                field.getValue().tree.query(((Number) value).doubleValue(),
                        entry -> OperandStore.addMatches(entry.getSubfilters(), context));
            }
        }
    }
}
