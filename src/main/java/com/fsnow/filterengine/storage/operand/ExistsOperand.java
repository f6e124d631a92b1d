package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;

/**
 * {@code exists} conditions: matches registered fields present in the document.
 */
public class ExistsOperand extends AbstractFieldOperand {

    @Override
    public Keyword getKeyword() {
        return Keyword.EXISTS;
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        String[] documentFields = document.sortedFields();
        int i = 0;
        int j = 0;

        while (i < sortedFields.length && j < documentFields.length) {
            int cmp = sortedFields[i].compareTo(documentFields[j]);

            if (cmp == 0) {
                OperandStore.addMatches(entries.get(sortedFields[i]).getSubfilters(), context);
                i++;
                j++;
            } else if (cmp < 0) {
                i++;
            } else {
                j++;
            }
        }
    }
}
