package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code notrange} conditions.
 * <p>
 * Each condition is indexed with the complement of its range, made of at most
 * two disjoint intervals, so that a value triggers it at most once. Documents
 * without a numeric value for the field match every condition on it.
 */
public class NotRangeOperand extends AbstractRangeOperand {

    @Override
    public Keyword getKeyword() {
        return Keyword.NOT_RANGE;
    }

    @Override
    protected List<IntervalTree.Interval<OperandEntry<String>>> intervals(RangeBounds bounds,
                                                                        OperandEntry<String> entry) {
        List<IntervalTree.Interval<OperandEntry<String>>> complement = new ArrayList<>(2);

        if (!Double.isInfinite(bounds.low)) {
            complement.add(new IntervalTree.Interval<>(Double.NEGATIVE_INFINITY, false,
                    bounds.low, !bounds.lowInclusive, entry));
        }
        if (!Double.isInfinite(bounds.high)) {
            complement.add(new IntervalTree.Interval<>(bounds.high, !bounds.highInclusive,
                    Double.POSITIVE_INFINITY, false, entry));
        }

        return complement;
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        for (Map.Entry<String, FieldRanges> field : fields.entrySet()) {
            Object value = document.get(field.getKey());

            if (value instanceof Number) {
                field.getValue().tree.query(((Number) value).doubleValue(),
                        entry -> OperandStore.addMatches(entry.getSubfilters(), context));
            } else {
                for (OperandEntry<String> entry : field.getValue().entries.values()) {
                    OperandStore.addMatches(entry.getSubfilters(), context);
                }
            }
        }
    }
}
