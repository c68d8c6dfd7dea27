package com.progmail.template;

import com.progmail.markup.BracketExtractor;
import com.progmail.markup.BracketedText;
import com.progmail.util.RunLog;

import java.util.List;

/**
 * All attribute rows keyed by full name, plus the set of column headers seen
 * across every row.
 */
public class AttributeTable {

    private final NormalizedKeyMap<AttributeRecord> records = new NormalizedKeyMap<>();
    private final NormalizedKeyMap<Boolean> schema = new NormalizedKeyMap<>();

    /**
     * Parse an attribute document made of {@code <person>} lines, each a run of
     * {@code <header>value</header>} pairs. Rows without a full name are
     * logged and dropped.
     */
    public static AttributeTable fromMarkup(String document, RunLog log) {
        AttributeTable table = new AttributeTable();
        String remaining = document == null ? "" : document;
        int row = 0;

        while (!remaining.isEmpty()) {
            BracketedText line = BracketExtractor.extractNext(remaining);
            if (!line.isFound()) {
                break;
            }
            remaining = line.getTrailing();
            row++;

            AttributeRecord.Builder builder = AttributeRecord.builder();
            String cells = line.getContent();
            while (!cells.isEmpty()) {
                BracketedText cell = BracketExtractor.extractNext(cells);
                if (!cell.isFound()) {
                    break;
                }
                builder.put(cell.getTag(), cell.getContent());
                cells = cell.getTrailing();
            }

            AttributeRecord record = builder.build();
            if (record.getFullName() == null) {
                log.error("Attribute row " + row + " has no '" + AttributeRecord.FULL_NAME + "' column -- skipped.");
                continue;
            }
            if (table.contains(record.getFullName())) {
                log.warn("Attribute row " + row + " repeats '" + record.getFullName() + "'; the later row is used.");
            }
            table.add(record);
        }

        log.info("Loaded " + table.size() + " attribute rows with " + table.getColumns().size() + " columns");
        return table;
    }

    /**
     * Add a row, replacing any earlier row with the same full name.
     *
     * @throws IllegalArgumentException if the row has no full name
     */
    public void add(AttributeRecord record) {
        String fullName = record.getFullName();
        if (fullName == null) {
            throw new IllegalArgumentException("Attribute record has no full name: " + record);
        }
        records.put(fullName, record);
        for (String header : record.getHeaders()) {
            schema.put(header, Boolean.TRUE);
        }
    }

    /**
     * @return the row for this person, or null
     */
    public AttributeRecord find(String fullName) {
        return fullName == null ? null : records.get(fullName);
    }

    public boolean contains(String fullName) {
        return find(fullName) != null;
    }

    /**
     * @return true if any row has this column
     */
    public boolean hasColumn(String header) {
        return schema.containsKey(header);
    }

    public List<String> getColumns() {
        return schema.keys();
    }

    public int size() {
        return records.size();
    }
}
