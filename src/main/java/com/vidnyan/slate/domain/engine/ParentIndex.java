package com.vidnyan.slate.domain.engine;

import com.vidnyan.slate.domain.model.Node;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transient node-to-parent lookup for one traversal.
 * Keyed by node identity; never stored on the nodes and discarded with the traversal.
 * Filled as the walk descends, so every ancestor of the node being visited is already present.
 */
final class ParentIndex {

    private final Map<Node, Node> parents = new IdentityHashMap<>();
    private final Map<Node, Integer> siblingIndexes = new IdentityHashMap<>();

    void register(Node parent, Node child, int index) {
        parents.put(child, parent);
        siblingIndexes.put(child, index);
    }

    Optional<Node> parent(Node node) {
        return Optional.ofNullable(parents.get(node));
    }

    List<Node> ancestors(Node node) {
        List<Node> chain = new ArrayList<>();
        Node current = parents.get(node);
        while (current != null) {
            chain.add(current);
            current = parents.get(current);
        }
        return chain;
    }

    int siblingIndex(Node node) {
        return siblingIndexes.getOrDefault(node, 0);
    }
}
