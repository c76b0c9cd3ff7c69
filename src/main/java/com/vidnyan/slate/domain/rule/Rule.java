package com.vidnyan.slate.domain.rule;

import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.NodeKind;

import java.util.List;
import java.util.Set;

/**
 * Contract every check implements.
 *
 * A rule declares the node kinds it wants to visit and produces zero or more findings per visited
 * node. Rules are trusted plugins registered at configuration time:
 * <ul>
 *   <li>they must not mutate the tree or any shared structure;</li>
 *   <li>they must hold no state across files; per-file scratch state lives in
 *       {@link RuleContext#scratch()}, which is created fresh for every traversal;</li>
 *   <li>they must not assume any other rule has or has not run.</li>
 * </ul>
 */
public interface Rule {

    /**
     * Unique rule id (e.g. "trailing-whitespace").
     */
    String id();

    /**
     * Rule version, reported alongside the id.
     */
    default String version() {
        return "1";
    }

    /**
     * Short description of what this rule checks.
     */
    String description();

    /**
     * Node kinds this rule subscribes to. Must not be empty.
     */
    Set<NodeKind> interestedKinds();

    Severity defaultSeverity();

    /**
     * True when the edits this rule proposes may be applied automatically.
     */
    default boolean fixable() {
        return false;
    }

    /**
     * Validate rule-specific parameters before any file is processed.
     *
     * @throws InvalidConfigurationException when the parameters are unusable
     */
    default void validate(RuleParameters parameters) {
    }

    /**
     * Evaluate one node.
     *
     * @param node    a node whose kind is in {@link #interestedKinds()}
     * @param context read-only traversal context
     * @return findings, possibly empty
     */
    List<Finding> evaluate(Node node, RuleContext context);
}
