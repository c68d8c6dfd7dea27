package com.progmail.markup;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical step used by {@link BalanceChecker}: finds the next structurally
 * significant delimiter in a piece of text.
 */
public class DelimiterScanner {

    // <name>, </name> or <name attr=...>; no nested delimiters inside the tag, at least one name character
    private static final Pattern TAG = Pattern.compile("<([^<>\\[\\]]*[^<>\\[\\]\\s/][^<>\\[\\]]*)>");
    private static final Pattern BRACKET = Pattern.compile("\\[\\[|]]");

    /**
     * Locate the earliest delimiter in {@code text}.
     *
     * When an angle-bracket tag and a double bracket are both present, the one
     * whose match ends first wins; on an exact tie the tag wins.
     *
     * @return the delimiter and the text after it, or an end marker when nothing is left
     */
    public Delimiter locateNext(String text) {
        if (text == null || text.isEmpty()) {
            return Delimiter.END;
        }

        Matcher tag = TAG.matcher(text);
        Matcher bracket = BRACKET.matcher(text);
        boolean tagFound = tag.find();
        boolean bracketFound = bracket.find();

        if (!tagFound && !bracketFound) {
            return Delimiter.END;
        }

        if (tagFound && (!bracketFound || tag.end() <= bracket.end())) {
            return new Delimiter(tagName(tag.group(1)), text.substring(tag.end()));
        }
        return new Delimiter(bracket.group(), text.substring(bracket.end()));
    }

    /**
     * Reduce raw tag contents to the tag name: trimmed and cut at the first
     * whitespace, so {@code a href=x} becomes {@code a} and {@code / b} becomes {@code /b}.
     */
    static String tagName(String raw) {
        String name = raw.trim();
        boolean closing = name.startsWith("/");
        if (closing) {
            name = name.substring(1).trim();
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i))) {
                name = name.substring(0, i);
                break;
            }
        }
        return closing ? "/" + name : name;
    }
}
