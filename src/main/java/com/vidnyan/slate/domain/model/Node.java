package com.vidnyan.slate.domain.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * A structural unit of a parsed source file.
 * Immutable. Children are owned by their parent; there is no back-reference to the parent.
 * Identity semantics: two nodes are equal only when they are the same instance.
 */
public final class Node {

    private final NodeKind kind;
    private final Span span;
    private final List<Node> children;
    private final String text;

    private Node(NodeKind kind, Span span, List<Node> children, String text) {
        if (kind == null || span == null) {
            throw new IllegalArgumentException("Node kind and span are required");
        }
        this.kind = kind;
        this.span = span;
        this.children = List.copyOf(children);
        this.text = text;
    }

    /**
     * Create an interior node.
     */
    public static Node branch(NodeKind kind, Span span, List<Node> children) {
        return new Node(kind, span, children, null);
    }

    /**
     * Create a leaf node carrying its token text.
     */
    public static Node leaf(NodeKind kind, Span span, String text) {
        return new Node(kind, span, List.of(), text);
    }

    public NodeKind kind() {
        return kind;
    }

    public Span span() {
        return span;
    }

    public List<Node> children() {
        return children;
    }

    /**
     * Leaf token text, if the parser recorded one.
     */
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean is(NodeKind other) {
        return kind.equals(other);
    }

    /**
     * First direct child of the given kind.
     */
    public Optional<Node> firstChild(NodeKind childKind) {
        return children.stream()
                .filter(c -> c.is(childKind))
                .findFirst();
    }

    /**
     * Direct children of the given kind, in source order.
     */
    public List<Node> childrenOf(NodeKind childKind) {
        return children.stream()
                .filter(c -> c.is(childKind))
                .toList();
    }

    /**
     * Number of nodes in this subtree, including this node.
     */
    public int size() {
        int total = 0;
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            total++;
            node.children.forEach(stack::push);
        }
        return total;
    }

    @Override
    public String toString() {
        return kind.name() + "[" + span.startOffset() + "," + span.endOffset() + ")";
    }
}
