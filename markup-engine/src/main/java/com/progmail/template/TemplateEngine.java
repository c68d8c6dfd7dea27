package com.progmail.template;

import com.progmail.markup.MarkupNode;
import com.progmail.util.RunLog;

/**
 * Fills an email body for one schedule record.
 *
 * Placeholders are {@code [[...]]}:
 * <ul>
 *   <li>{@code [[schedule]]} expands to the person's program items;</li>
 *   <li>{@code [[prefix|column|suffix]]} expands to prefix, value and suffix,
 *       or to nothing at all when the value is empty;</li>
 *   <li>{@code [[column]]} expands to the column's value.</li>
 * </ul>
 * Substituted text is never scanned again.
 */
public class TemplateEngine {

    public static final String START = "[[";
    public static final String END = "]]";
    public static final String SCHEDULE_TOKEN = "schedule";

    static final String ITEM = "item";
    static final String TITLE = "title";
    static final String PARTICIPANTS = "participants";
    static final String PRECIS = "precis";
    static final String EQUIPMENT = "equipment";

    private final AttributeTable attributes;
    private final RunLog log;

    public TemplateEngine(AttributeTable attributes, RunLog log) {
        this.attributes = attributes;
        this.log = log;
    }

    /**
     * Render the body for one person.
     *
     * @return the text, or a failure naming a column that no attribute row has
     */
    public RenderResult render(TemplateBody body, MarkupNode person) {
        String template = body.getText();
        String fullName = person.getText(AttributeRecord.FULL_NAME, "");
        AttributeRecord record = attributes.find(fullName);

        StringBuilder result = new StringBuilder();
        int cursor = 0;

        while (cursor < template.length()) {
            int startIdx = template.indexOf(START, cursor);
            if (startIdx < 0) {
                result.append(template, cursor, template.length());
                break;
            }

            result.append(template, cursor, startIdx);
            int endIdx = template.indexOf(END, startIdx + START.length());
            if (endIdx < 0) {
                // unterminated placeholder is copied as-is
                result.append(template, startIdx, template.length());
                break;
            }

            String token = template.substring(startIdx + START.length(), endIdx);
            cursor = endIdx + END.length();

            if (token.trim().equalsIgnoreCase(SCHEDULE_TOKEN)) {
                result.append(renderSchedule(person, body.getFormat()));
                continue;
            }

            String[] parts = token.split("\\|", -1);
            String column = parts.length == 3 ? parts[1] : token;
            if (!attributes.hasColumn(column)) {
                log.fatal("Can't find column '" + column.trim() + "' from [[" + token
                        + "]] in the attribute table columns " + attributes.getColumns());
                return RenderResult.missingColumn(column.trim());
            }

            String value = lookup(record, fullName, column);
            if (parts.length == 3) {
                if (!value.isEmpty()) {
                    result.append(parts[0]).append(value).append(parts[2]);
                }
            } else {
                result.append(value);
            }
        }

        return RenderResult.rendered(result.toString());
    }

    private String lookup(AttributeRecord record, String fullName, String column) {
        String value = record == null ? null : record.get(column);
        if (value == null) {
            log.warn("For " + fullName + ", no value for column '" + column.trim() + "'; substituting nothing.");
            return "";
        }
        return value;
    }

    /**
     * One block per {@code item} child, in document order.
     */
    String renderSchedule(MarkupNode person, OutputFormat format) {
        StringBuilder items = new StringBuilder();
        for (MarkupNode item : person.getChildren(ITEM)) {
            String title = item.getText(TITLE, "");
            String participants = item.getText(PARTICIPANTS, "");
            String precis = item.getText(PRECIS, "");
            String equipment = item.getText(EQUIPMENT, "");

            if (format == OutputFormat.HTML) {
                paragraph(items, title);
                paragraph(items, participants);
                if (!equipment.isEmpty()) {
                    paragraph(items, equipment);
                }
                if (!precis.isEmpty()) {
                    paragraph(items, precis);
                }
                paragraph(items, "");
            } else {
                items.append(title).append('\n');
                items.append(participants).append('\n');
                if (!equipment.isEmpty()) {
                    items.append(equipment).append('\n');
                }
                if (!precis.isEmpty()) {
                    items.append(precis).append('\n');
                }
                items.append('\n');
            }
        }
        return items.toString();
    }

    private static void paragraph(StringBuilder sb, String text) {
        sb.append("<p>").append(text).append("</p>\n");
    }
}
