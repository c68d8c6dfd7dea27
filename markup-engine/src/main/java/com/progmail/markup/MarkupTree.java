package com.progmail.markup;

import com.progmail.util.RunLog;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent builder that turns bracketed markup into a tree of {@link MarkupNode}s.
 *
 * <pre>
 * &lt;person&gt;&lt;full name&gt;Ann&lt;/full name&gt;&lt;item&gt;&lt;title&gt;Panel&lt;/title&gt;&lt;/item&gt;&lt;/person&gt;
 * </pre>
 * resolves to {@code Main[person[full name='Ann', item[title='Panel']]]}.
 *
 * Parsing is tolerant: text outside complete spans is dropped without comment,
 * so documents should pass {@link BalanceChecker} first.
 */
public class MarkupTree {

    public static final String ROOT_KEY = "Main";

    private final RunLog log;

    public MarkupTree(RunLog log) {
        this.log = log;
    }

    /**
     * Parse a whole document into a resolved tree rooted at {@value #ROOT_KEY}.
     */
    public MarkupNode parse(String document) {
        MarkupNode root = new MarkupNode(ROOT_KEY, document);
        resolve(root);
        log.debug("MarkupTree: resolved " + root.size() + " top-level nodes");
        return root;
    }

    /**
     * Resolve a node's text into children, depth-first. A node whose text
     * holds no complete span stays a leaf. Resolving a node twice has no effect.
     */
    public MarkupNode resolve(MarkupNode node) {
        if (node.isResolved()) {
            return node;
        }
        node.markResolved();

        String text = node.getText();
        List<MarkupNode> children = new ArrayList<>();

        while (!text.isEmpty()) {
            BracketedText next = BracketExtractor.extractNext(text);
            if (next.getTag().isEmpty() && next.getContent().isEmpty()) {
                if (!next.getTrailing().isEmpty()) {
                    node.setText(next.getTrailing());
                    return node;
                }
                break;
            }
            MarkupNode child = new MarkupNode(next.getTag(), next.getContent());
            resolve(child);
            children.add(child);
            text = next.getTrailing();
        }

        if (!children.isEmpty()) {
            node.setChildren(children);
        }
        return node;
    }
}
