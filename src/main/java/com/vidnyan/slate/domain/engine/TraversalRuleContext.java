package com.vidnyan.slate.domain.engine;

import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.model.SyntaxTree;
import com.vidnyan.slate.domain.rule.Edit;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.RegisteredRule;
import com.vidnyan.slate.domain.rule.RuleContext;
import com.vidnyan.slate.domain.rule.RuleParameters;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rule context bound to one rule and one traversal.
 */
final class TraversalRuleContext implements RuleContext {

    private final RegisteredRule registered;
    private final SyntaxTree tree;
    private final ParentIndex parents;
    private final Map<String, Object> scratch = new HashMap<>();

    TraversalRuleContext(RegisteredRule registered, SyntaxTree tree, ParentIndex parents) {
        this.registered = registered;
        this.tree = tree;
        this.parents = parents;
    }

    @Override
    public String ruleId() {
        return registered.id();
    }

    @Override
    public SyntaxTree tree() {
        return tree;
    }

    @Override
    public Optional<Node> parent(Node node) {
        return parents.parent(node);
    }

    @Override
    public List<Node> ancestors(Node node) {
        return Collections.unmodifiableList(parents.ancestors(node));
    }

    @Override
    public int siblingIndex(Node node) {
        return parents.siblingIndex(node);
    }

    @Override
    public RuleParameters parameters() {
        return registered.parameters();
    }

    @Override
    public Map<String, Object> scratch() {
        return scratch;
    }

    @Override
    public Finding finding(Span span, String message) {
        return new Finding(ruleId(), registered.rule().defaultSeverity(), span, message, null);
    }

    @Override
    public Finding finding(Span span, String message, Edit fix) {
        return new Finding(ruleId(), registered.rule().defaultSeverity(), span, message, fix);
    }

    @Override
    public Edit edit(Span span, String replacement) {
        return new Edit(ruleId(), span, replacement);
    }
}
