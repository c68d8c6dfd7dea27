package com.progmail.template;

import com.progmail.markup.MarkupNode;
import com.progmail.util.RunLog;

/**
 * Decides per schedule record whether an email is produced. Problems with a
 * single record are logged and skip that record only.
 */
public class SelectionFilter {

    private final SelectionCriterion criterion;
    private final AttributeTable attributes;
    private final RunLog log;

    public SelectionFilter(SelectionCriterion criterion, AttributeTable attributes, RunLog log) {
        this.criterion = criterion;
        this.attributes = attributes;
        this.log = log;
    }

    public SelectionOutcome evaluate(MarkupNode person) {
        String fullName = person.getText(AttributeRecord.FULL_NAME);
        if (fullName == null) {
            log.error("Schedule record " + person + " has no '" + AttributeRecord.FULL_NAME + "' -- skipped.");
            return SelectionOutcome.NO_FULL_NAME;
        }

        AttributeRecord record = attributes.find(fullName);
        if (record == null) {
            log.error("For " + fullName + ", not in the attribute table -- skipped.");
            return SelectionOutcome.NOT_IN_ATTRIBUTE_TABLE;
        }

        String value = record.get(criterion.getHeader());
        if (value == null) {
            log.error("For " + fullName + ", header '" + criterion.getHeader()
                    + "' not in the attribute table's columns -- skipped.");
            return SelectionOutcome.MISSING_HEADER;
        }

        if (!criterion.accepts(value)) {
            log.info("For " + fullName + ", '" + value.trim() + "' does not match '"
                    + criterion.getExpectedValue() + "' -- skipped.");
            return SelectionOutcome.VALUE_MISMATCH;
        }
        return SelectionOutcome.SELECTED;
    }
}
