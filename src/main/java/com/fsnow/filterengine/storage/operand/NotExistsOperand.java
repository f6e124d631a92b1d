package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;

/**
 * {@code notexists} conditions: matches registered fields absent from the document.
 */
public class NotExistsOperand extends AbstractFieldOperand {

    @Override
    public Keyword getKeyword() {
        return Keyword.NOT_EXISTS;
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        String[] documentFields = document.sortedFields();
        int j = 0;

        for (String field : sortedFields) {
            while (j < documentFields.length && documentFields[j].compareTo(field) < 0) {
                j++;
            }

            if (j == documentFields.length || !documentFields[j].equals(field)) {
                OperandStore.addMatches(entries.get(field).getSubfilters(), context);
            }
        }
    }
}
