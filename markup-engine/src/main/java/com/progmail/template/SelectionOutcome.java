package com.progmail.template;

/**
 * Why a schedule record was or was not selected for an email.
 */
public enum SelectionOutcome {
    SELECTED,
    NO_FULL_NAME,
    NOT_IN_ATTRIBUTE_TABLE,
    MISSING_HEADER,
    VALUE_MISMATCH;

    public boolean isSelected() {
        return this == SELECTED;
    }
}
