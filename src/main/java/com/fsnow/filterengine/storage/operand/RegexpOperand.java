package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.RegexpPattern;

import java.util.List;
import java.util.Map;

/**
 * {@code regexp} conditions: string values are tested against every pattern of their field.
 */
public class RegexpOperand extends AbstractRegexpOperand {

    @Override
    public Keyword getKeyword() {
        return Keyword.REGEXP;
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        for (Map.Entry<String, List<OperandEntry<RegexpPattern>>> field : fields.entrySet()) {
            Object value = document.get(field.getKey());
            if (!(value instanceof String)) {
                continue;
            }

            for (OperandEntry<RegexpPattern> entry : field.getValue()) {
                if (entry.getOperand().test((String) value)) {
                    OperandStore.addMatches(entry.getSubfilters(), context);
                }
            }
        }
    }
}
