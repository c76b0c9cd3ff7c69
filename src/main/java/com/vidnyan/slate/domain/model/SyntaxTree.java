package com.vidnyan.slate.domain.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The structural model of one source file: the text, its line table and the root node.
 * Built once per file per run and discarded after diagnostics and edits are extracted.
 */
public record SyntaxTree(
    String text,
    LineIndex lines,
    Node root
) {

    /**
     * Create a tree for the given text and root.
     */
    public static SyntaxTree of(String text, Node root) {
        return new SyntaxTree(text, LineIndex.of(text), root);
    }

    /**
     * Verify the parser contract: the root lies within the text, every child lies within its
     * parent, and siblings are ordered by start offset and never overlap.
     *
     * @return a description of the first violation found, or empty when the tree is well-formed
     */
    public Optional<String> wellFormednessProblem() {
        if (root.span().endOffset() > text.length()) {
            return Optional.of("Root " + root + " extends past end of text (" + text.length() + ")");
        }

        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node parent = stack.pop();
            List<Node> children = parent.children();
            Node previous = null;
            for (Node child : children) {
                if (!parent.span().contains(child.span())) {
                    return Optional.of("Child " + child + " is not contained in parent " + parent);
                }
                if (previous != null) {
                    if (child.span().startOffset() < previous.span().startOffset()) {
                        return Optional.of("Sibling " + child + " is out of order after " + previous);
                    }
                    if (child.span().startOffset() < previous.span().endOffset()) {
                        return Optional.of("Sibling " + child + " overlaps " + previous);
                    }
                }
                previous = child;
                stack.push(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Number of nodes in the tree.
     */
    public int nodeCount() {
        return root.size();
    }

    /**
     * Source text covered by a span.
     */
    public String slice(Span span) {
        return text.substring(span.startOffset(), span.endOffset());
    }
}
