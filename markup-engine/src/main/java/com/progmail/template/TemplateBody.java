package com.progmail.template;

/**
 * Email body text with {@code [[token]]} placeholders, and the format it is rendered in.
 */
public final class TemplateBody {

    private final String text;
    private final OutputFormat format;

    public TemplateBody(String text, OutputFormat format) {
        this.text = text == null ? "" : text;
        this.format = format == null ? OutputFormat.PLAIN_TEXT : format;
    }

    public String getText() {
        return text;
    }

    public OutputFormat getFormat() {
        return format;
    }
}
