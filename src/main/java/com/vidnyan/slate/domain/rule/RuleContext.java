package com.vidnyan.slate.domain.rule;

import com.vidnyan.slate.domain.model.LineIndex;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.model.SyntaxTree;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the current traversal handed to a rule.
 * One context exists per rule per traversal.
 */
public interface RuleContext {

    /**
     * Id of the rule this context belongs to.
     */
    String ruleId();

    SyntaxTree tree();

    default String sourceText() {
        return tree().text();
    }

    default LineIndex lines() {
        return tree().lines();
    }

    /**
     * Parent of a node, empty for the root.
     * Ancestors of the node being evaluated are always resolvable.
     */
    Optional<Node> parent(Node node);

    /**
     * Ancestors of a node, nearest first, ending with the root.
     */
    List<Node> ancestors(Node node);

    /**
     * Position of a node among its parent's children, 0 for the root.
     */
    int siblingIndex(Node node);

    /**
     * Parameters configured for this rule.
     */
    RuleParameters parameters();

    /**
     * Mutable scratch space private to this rule for the current traversal only.
     */
    Map<String, Object> scratch();

    /**
     * Create a finding attributed to this rule at its default severity.
     */
    Finding finding(Span span, String message);

    /**
     * Create a finding carrying a proposed fix.
     */
    Finding finding(Span span, String message, Edit fix);

    /**
     * Create an edit attributed to this rule.
     */
    Edit edit(Span span, String replacement);
}
