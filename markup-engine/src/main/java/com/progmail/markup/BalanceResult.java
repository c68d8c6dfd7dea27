package com.progmail.markup;

/**
 * Outcome of a {@link BalanceChecker} run.
 */
public final class BalanceResult {

    private static final BalanceResult BALANCED = new BalanceResult(null, "", "");

    private final FailureReason reason;
    private final String delimiter;
    private final String context;

    private BalanceResult(FailureReason reason, String delimiter, String context) {
        this.reason = reason;
        this.delimiter = delimiter;
        this.context = context;
    }

    public static BalanceResult balanced() {
        return BALANCED;
    }

    public static BalanceResult failure(FailureReason reason, String delimiter, String context) {
        return new BalanceResult(reason, delimiter, context);
    }

    public boolean isBalanced() {
        return reason == null;
    }

    /**
     * @return the violation, or null when the document is balanced
     */
    public FailureReason getReason() {
        return reason;
    }

    /**
     * @return the delimiter at which the check failed (empty when the document ran out)
     */
    public String getDelimiter() {
        return delimiter;
    }

    /**
     * @return the start of the text following the failure point
     */
    public String getContext() {
        return context;
    }

    public String describe() {
        if (isBalanced()) {
            return "balanced";
        }
        StringBuilder sb = new StringBuilder(reason.getDescription());
        if (!delimiter.isEmpty()) {
            sb.append(" at '").append(delimiter).append("'");
        }
        sb.append(" near '").append(context).append("'");
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
