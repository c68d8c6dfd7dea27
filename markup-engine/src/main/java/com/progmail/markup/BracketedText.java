package com.progmail.markup;

/**
 * A text split around its first complete {@code <tag>...</tag>} span.
 */
public final class BracketedText {

    private final String leading;
    private final String tag;
    private final String content;
    private final String trailing;

    public BracketedText(String leading, String tag, String content, String trailing) {
        this.leading = leading;
        this.tag = tag;
        this.content = content;
        this.trailing = trailing;
    }

    /** Text before the opening tag. */
    public String getLeading() {
        return leading;
    }

    /** Tag name, empty when no span was found. */
    public String getTag() {
        return tag;
    }

    /** Everything between the opening and closing tag. */
    public String getContent() {
        return content;
    }

    /** Text after the closing tag. */
    public String getTrailing() {
        return trailing;
    }

    public boolean isFound() {
        return !tag.isEmpty();
    }

    @Override
    public String toString() {
        return "BracketedText{tag='" + tag + "', content='" + content + "', trailing='" + trailing + "'}";
    }
}
