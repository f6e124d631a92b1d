package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.RegexpPattern;

import java.util.List;
import java.util.Map;

/**
 * {@code notregexp} conditions: matches the patterns a value does not match.
 * Non-string or missing values match every pattern of their field.
 */
public class NotRegexpOperand extends AbstractRegexpOperand {

    @Override
    public Keyword getKeyword() {
        return Keyword.NOT_REGEXP;
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        for (Map.Entry<String, List<OperandEntry<RegexpPattern>>> field : fields.entrySet()) {
            Object value = document.get(field.getKey());

            for (OperandEntry<RegexpPattern> entry : field.getValue()) {
                if (!(value instanceof String) || !entry.getOperand().test((String) value)) {
                    OperandStore.addMatches(entry.getSubfilters(), context);
                }
            }
        }
    }
}
