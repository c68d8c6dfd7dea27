package com.progmail.markup;

/**
 * One step of a delimiter scan: the delimiter found and the text that follows it.
 *
 * Tokens are a tag name for {@code <name>}, {@code /name} for {@code </name>},
 * and the literal {@code [[} or {@code ]]} for double brackets. An empty token
 * marks the end of the scan.
 */
public final class Delimiter {

    public static final String OPEN_BRACKET = "[[";
    public static final String CLOSE_BRACKET = "]]";

    static final Delimiter END = new Delimiter("", "");

    private final String token;
    private final String remainder;

    public Delimiter(String token, String remainder) {
        this.token = token;
        this.remainder = remainder;
    }

    public String getToken() {
        return token;
    }

    public String getRemainder() {
        return remainder;
    }

    public boolean isEnd() {
        return token.isEmpty();
    }

    public boolean isClosing() {
        return CLOSE_BRACKET.equals(token) || token.startsWith("/");
    }

    @Override
    public String toString() {
        return isEnd() ? "<end>" : token;
    }
}
