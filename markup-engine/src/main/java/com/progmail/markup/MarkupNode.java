package com.progmail.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a parsed markup document.
 *
 * A node holds either raw text or an ordered list of children, never both.
 * It starts out as text and may be promoted to an interior node once, by
 * {@link MarkupTree#resolve(MarkupNode)}.
 */
public final class MarkupNode {

    /**
     * The value held by a node: {@link Leaf} or {@link Interior}.
     */
    public abstract static class Value {
        private Value() {
        }
    }

    public static final class Leaf extends Value {
        private final String text;

        Leaf(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }
    }

    public static final class Interior extends Value {
        private final List<MarkupNode> children;

        Interior(List<MarkupNode> children) {
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        public List<MarkupNode> getChildren() {
            return children;
        }
    }

    private final String key;
    private Value value;
    private boolean resolved;

    public MarkupNode(String key, String text) {
        this.key = key;
        this.value = new Leaf(text == null ? "" : text);
    }

    public String getKey() {
        return key;
    }

    public Value getValue() {
        return value;
    }

    public boolean isLeaf() {
        return value instanceof Leaf;
    }

    /**
     * @return the raw text of a leaf, empty for an interior node
     */
    public String getText() {
        return value instanceof Leaf ? ((Leaf) value).getText() : "";
    }

    /**
     * @return the children of an interior node, empty for a leaf
     */
    public List<MarkupNode> getChildren() {
        return value instanceof Interior ? ((Interior) value).getChildren() : List.of();
    }

    public int size() {
        return getChildren().size();
    }

    public MarkupNode getChild(int index) {
        return getChildren().get(index);
    }

    /**
     * Children with the given key (case-insensitive), in document order.
     */
    public List<MarkupNode> getChildren(String childKey) {
        List<MarkupNode> matches = new ArrayList<>();
        for (MarkupNode child : getChildren()) {
            if (child.matches(childKey)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Text of the first child whose key matches (case-insensitive).
     *
     * @return the child's text, or null when there is no such child
     */
    public String getText(String childKey) {
        for (MarkupNode child : getChildren()) {
            if (child.matches(childKey)) {
                return child.getText();
            }
        }
        return null;
    }

    public String getText(String childKey, String defaultValue) {
        String text = getText(childKey);
        return text != null ? text : defaultValue;
    }

    public boolean matches(String otherKey) {
        return otherKey != null && key.trim().equalsIgnoreCase(otherKey.trim());
    }

    boolean isResolved() {
        return resolved;
    }

    void markResolved() {
        resolved = true;
    }

    void setText(String text) {
        value = new Leaf(text);
    }

    void setChildren(List<MarkupNode> children) {
        value = new Interior(children);
    }

    @Override
    public String toString() {
        return isLeaf()
                ? key + "='" + getText() + "'"
                : key + getChildren();
    }
}
