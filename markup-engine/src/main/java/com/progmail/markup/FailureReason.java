package com.progmail.markup;

/**
 * Structural violations reported by {@link BalanceChecker}.
 */
public enum FailureReason {
    /** The document ended while delimiters were still open. */
    UNBALANCED_DELIMITERS("unbalanced delimiters"),
    /** A closing delimiter appeared with nothing open. */
    UNMATCHED_CLOSE("closing delimiter with nothing open"),
    /** A {@code ]]} closed something other than {@code [[}. */
    MISMATCHED_BRACKET("unbalanced [[ ]]"),
    /** A {@code </name>} did not match the innermost open tag. */
    MISMATCHED_TAG("unbalanced <> </>");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
