package com.progmail.template;

/**
 * The (header, expected value) pair from the template's {@code <select>} block.
 * The expected value may be empty; it then selects people whose column is blank.
 */
public final class SelectionCriterion {

    private final String header;
    private final String expectedValue;

    public SelectionCriterion(String header, String expectedValue) {
        if (header == null || expectedValue == null) {
            throw new IllegalArgumentException("Selection needs both a header and a value");
        }
        this.header = header.trim();
        this.expectedValue = expectedValue.trim();
    }

    public String getHeader() {
        return header;
    }

    public String getExpectedValue() {
        return expectedValue;
    }

    /**
     * Trimmed, case-insensitive comparison against the expected value.
     */
    public boolean accepts(String value) {
        return value != null && value.trim().equalsIgnoreCase(expectedValue);
    }

    @Override
    public String toString() {
        return header + "='" + expectedValue + "'";
    }
}
