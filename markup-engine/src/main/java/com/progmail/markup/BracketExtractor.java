package com.progmail.markup;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Non-greedy extraction of the first {@code <name>...</name>} span in a text.
 *
 * Names are letters, digits and spaces; the closing tag must repeat the name
 * exactly. Nothing is validated: text that is not part of a complete span is
 * left in {@code leading} and callers are free to ignore it.
 */
public final class BracketExtractor {

    private static final Pattern SPAN = Pattern.compile("<([a-zA-Z0-9 ]+)>(.*?)</\\1>", Pattern.DOTALL);

    private BracketExtractor() {
    }

    /**
     * @return the split text; when there is no complete span the whole input is
     *         returned as leading text and everything else is empty
     */
    public static BracketedText extractNext(String text) {
        if (text == null || text.isEmpty()) {
            return new BracketedText("", "", "", "");
        }
        Matcher m = SPAN.matcher(text);
        if (!m.find()) {
            return new BracketedText(text, "", "", "");
        }
        return new BracketedText(text.substring(0, m.start()), m.group(1), m.group(2), text.substring(m.end()));
    }
}
