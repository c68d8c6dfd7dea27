package com.progmail.template;

import java.util.List;

/**
 * One person's row from the attribute table: column header to value.
 * Headers are case- and whitespace-insensitive.
 */
public final class AttributeRecord {

    public static final String FULL_NAME = "full name";

    private final NormalizedKeyMap<String> columns;

    private AttributeRecord(NormalizedKeyMap<String> columns) {
        this.columns = columns;
    }

    public boolean hasColumn(String header) {
        return columns.containsKey(header);
    }

    /**
     * @return the value, or null when this row has no such column
     */
    public String get(String header) {
        return columns.get(header);
    }

    public String getFullName() {
        return columns.get(FULL_NAME);
    }

    public List<String> getHeaders() {
        return columns.keys();
    }

    @Override
    public String toString() {
        return columns.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final NormalizedKeyMap<String> columns = new NormalizedKeyMap<>();

        private Builder() {
        }

        public Builder put(String header, String value) {
            columns.put(header, value);
            return this;
        }

        public AttributeRecord build() {
            return new AttributeRecord(columns);
        }
    }
}
