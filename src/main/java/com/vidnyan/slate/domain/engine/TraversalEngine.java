package com.vidnyan.slate.domain.engine;

import com.vidnyan.slate.domain.diagnostic.Diagnostic;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.SyntaxTree;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.RegisteredRule;
import com.vidnyan.slate.domain.rule.RuleRegistry;
import com.vidnyan.slate.domain.rule.Severity;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a syntax tree once, dispatching every node to the rules interested in its kind.
 *
 * Cost is linear in tree size regardless of rule count: each node costs one index lookup plus one
 * invocation per interested rule. Rules are invoked in registration order. A rule that throws is
 * contained: the failure becomes an {@value Diagnostic#INTERNAL_ERROR_RULE_ID} finding and the walk
 * continues with the remaining rules and nodes.
 *
 * Stateless; one engine may serve many concurrent traversals.
 */
@Slf4j
public final class TraversalEngine {

    private final RuleRegistry registry;

    public TraversalEngine(RuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Result of one traversal.
     *
     * @param findings      all findings, unordered and not yet canonicalized
     * @param nodesVisited  number of nodes walked
     * @param invocations   number of rule invocations
     * @param ruleFailures  number of contained rule failures
     * @param executionTime wall time of the walk
     */
    public record TraversalResult(
        List<Finding> findings,
        int nodesVisited,
        int invocations,
        int ruleFailures,
        Duration executionTime
    ) {}

    /**
     * Evaluate every active rule against a well-formed tree.
     */
    public TraversalResult traverse(SyntaxTree tree) {
        Instant start = Instant.now();
        ParentIndex parents = new ParentIndex();
        Map<String, TraversalRuleContext> contexts = new HashMap<>();
        List<Finding> findings = new ArrayList<>();
        int visited = 0;
        int invocations = 0;
        int failures = 0;

        Deque<Node> stack = new ArrayDeque<>();
        stack.push(tree.root());
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            visited++;

            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                Node child = children.get(i);
                parents.register(node, child, i);
                stack.push(child);
            }

            for (RegisteredRule registered : registry.rulesFor(node.kind())) {
                invocations++;
                TraversalRuleContext context = contexts.computeIfAbsent(
                        registered.id(), id -> new TraversalRuleContext(registered, tree, parents));
                if (!invoke(registered, node, context, tree, findings)) {
                    failures++;
                }
            }
        }

        Duration elapsed = Duration.between(start, Instant.now());
        log.debug("Traversed {} nodes with {} rule invocations in {}ms ({} failures)",
                visited, invocations, elapsed.toMillis(), failures);
        return new TraversalResult(findings, visited, invocations, failures, elapsed);
    }

    private boolean invoke(
            RegisteredRule registered,
            Node node,
            TraversalRuleContext context,
            SyntaxTree tree,
            List<Finding> sink
    ) {
        List<Finding> produced;
        try {
            produced = registered.rule().evaluate(node, context);
        } catch (RuntimeException | StackOverflowError | AssertionError | LinkageError e) {
            log.warn("Rule {} failed on {}: {}", registered.id(), node, e.toString());
            sink.add(internalError(registered, node, "failed while evaluating "
                    + node.kind().name() + ": " + describe(e)));
            return false;
        }
        if (produced == null) {
            return true;
        }

        for (Finding finding : produced) {
            String problem = contractProblem(registered, finding, tree);
            if (problem != null) {
                log.warn("Rule {} produced an invalid finding on {}: {}", registered.id(), node, problem);
                sink.add(internalError(registered, node, problem));
                return false;
            }
        }
        sink.addAll(produced);
        return true;
    }

    private static String contractProblem(RegisteredRule registered, Finding finding, SyntaxTree tree) {
        if (finding == null) {
            return "returned a null finding";
        }
        if (!registered.id().equals(finding.ruleId())) {
            return "returned a finding attributed to '" + finding.ruleId() + "'";
        }
        int length = tree.text().length();
        if (finding.span().endOffset() > length) {
            return "reported a span past the end of the text";
        }
        if (finding.fix() != null) {
            if (!registered.id().equals(finding.fix().ruleId())) {
                return "proposed an edit attributed to '" + finding.fix().ruleId() + "'";
            }
            if (finding.fix().endOffset() > length) {
                return "proposed an edit past the end of the text";
            }
        }
        return null;
    }

    private static Finding internalError(RegisteredRule registered, Node node, String detail) {
        return Finding.of(
                Diagnostic.INTERNAL_ERROR_RULE_ID,
                Severity.ERROR,
                node.span(),
                "Rule '" + registered.id() + "' " + detail);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }
}
