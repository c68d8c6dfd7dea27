package com.progmail.template;

/**
 * How the schedule expansion is laid out in the email body.
 */
public enum OutputFormat {
    PLAIN_TEXT,
    HTML;

    /**
     * "html" in any case means HTML; anything else, including null, is plain text.
     */
    public static OutputFormat fromMailFormat(String mailFormat) {
        return mailFormat != null && mailFormat.trim().equalsIgnoreCase("html") ? HTML : PLAIN_TEXT;
    }
}
