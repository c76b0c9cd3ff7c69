package com.vidnyan.slate.domain.engine;

import com.vidnyan.slate.domain.diagnostic.Diagnostic;
import com.vidnyan.slate.domain.engine.TraversalEngine.TraversalResult;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.model.SyntaxTree;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.LintConfiguration;
import com.vidnyan.slate.domain.rule.Rule;
import com.vidnyan.slate.domain.rule.RuleRegistry;
import com.vidnyan.slate.domain.rule.Severity;
import com.vidnyan.slate.support.TestKind;
import com.vidnyan.slate.support.TestRule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.vidnyan.slate.support.Trees.branch;
import static com.vidnyan.slate.support.Trees.leaf;
import static org.junit.jupiter.api.Assertions.*;

class TraversalEngineTest {

    private static final String TEXT = "ab cd ef";

    // ROOT[0,8) -> BLOCK[0,5) -> (TOKEN[0,2), TOKEN[3,5)), TOKEN[6,8)
    private static SyntaxTree sampleTree() {
        Node root = branch(TEXT, TestKind.ROOT, 0, 8,
                branch(TEXT, TestKind.BLOCK, 0, 5,
                        leaf(TEXT, TestKind.TOKEN, 0, 2),
                        leaf(TEXT, TestKind.TOKEN, 3, 5)),
                leaf(TEXT, TestKind.TOKEN, 6, 8));
        return SyntaxTree.of(TEXT, root);
    }

    private static TraversalEngine engineFor(Rule... rules) {
        return new TraversalEngine(RuleRegistry.build(List.of(rules), LintConfiguration.defaults()));
    }

    @Test
    void traverse_ShouldVisitNodesInPreOrder() {
        // Arrange
        List<String> visits = new ArrayList<>();
        TestRule recorder = TestRule.on("recorder", TestKind.ROOT, TestKind.BLOCK, TestKind.TOKEN)
                .evaluating((node, ctx) -> {
                    visits.add(node.toString());
                    return List.of();
                });

        // Act
        TraversalResult result = engineFor(recorder).traverse(sampleTree());

        // Assert
        assertEquals(List.of("ROOT[0,8)", "BLOCK[0,5)", "TOKEN[0,2)", "TOKEN[3,5)", "TOKEN[6,8)"), visits);
        assertEquals(5, result.nodesVisited());
        assertEquals(5, result.invocations());
        assertEquals(0, result.ruleFailures());
    }

    @Test
    void traverse_ShouldOnlyInvokeRulesForInterestedKinds() {
        TestRule tokens = TestRule.on("tokens", TestKind.TOKEN)
                .evaluating((node, ctx) -> List.of(ctx.finding(node.span(), "token")));

        TraversalResult result = engineFor(tokens).traverse(sampleTree());

        assertEquals(3, result.findings().size());
        assertEquals(3, result.invocations());
        assertTrue(result.findings().stream().allMatch(f -> f.severity() == Severity.WARN));
    }

    @Test
    void traverse_ShouldContainRuleFailuresAndContinue() {
        // Arrange
        TestRule broken = TestRule.on("broken", TestKind.BLOCK)
                .evaluating((node, ctx) -> {
                    throw new IllegalStateException("boom");
                });
        TestRule healthy = TestRule.on("healthy", TestKind.TOKEN, TestKind.BLOCK)
                .evaluating((node, ctx) -> List.of(ctx.finding(node.span(), "seen")));

        // Act
        TraversalResult result = engineFor(broken, healthy).traverse(sampleTree());

        // Assert
        List<Finding> internal = result.findings().stream()
                .filter(f -> f.ruleId().equals(Diagnostic.INTERNAL_ERROR_RULE_ID))
                .toList();
        assertEquals(1, internal.size());
        assertEquals(Severity.ERROR, internal.get(0).severity());
        assertEquals("Rule 'broken' failed while evaluating BLOCK: IllegalStateException: boom",
                internal.get(0).message());
        assertEquals(4, result.findings().stream().filter(f -> f.ruleId().equals("healthy")).count());
        assertEquals(1, result.ruleFailures());
    }

    @Test
    void traverse_ShouldContainErrorsThrownByRules() {
        TestRule recursive = TestRule.on("recursive", TestKind.TOKEN)
                .evaluating((node, ctx) -> {
                    throw new StackOverflowError();
                });
        TestRule asserting = TestRule.on("asserting", TestKind.BLOCK)
                .evaluating((node, ctx) -> {
                    throw new AssertionError("broken invariant");
                });
        TestRule healthy = TestRule.on("healthy", TestKind.TOKEN)
                .evaluating((node, ctx) -> List.of(ctx.finding(node.span(), "seen")));

        TraversalResult result = engineFor(recursive, asserting, healthy).traverse(sampleTree());

        assertEquals(4, result.ruleFailures());
        assertEquals(4, result.findings().stream()
                .filter(f -> f.ruleId().equals(Diagnostic.INTERNAL_ERROR_RULE_ID))
                .count());
        assertEquals(3, result.findings().stream().filter(f -> f.ruleId().equals("healthy")).count());
        assertTrue(result.findings().stream()
                .anyMatch(f -> f.message().equals(
                        "Rule 'asserting' failed while evaluating BLOCK: AssertionError: broken invariant")));
    }

    @Test
    void traverse_ShouldRejectFindingsAttributedToAnotherRule() {
        TestRule impostor = TestRule.on("impostor", TestKind.ROOT)
                .evaluating((node, ctx) -> List.of(Finding.of("someone-else", Severity.INFO, node.span(), "x")));

        TraversalResult result = engineFor(impostor).traverse(sampleTree());

        assertEquals(1, result.findings().size());
        assertEquals(Diagnostic.INTERNAL_ERROR_RULE_ID, result.findings().get(0).ruleId());
    }

    @Test
    void traverse_ShouldResolveParentsAndAncestors() {
        List<String> lineage = new ArrayList<>();
        TestRule lookup = TestRule.on("lookup", TestKind.TOKEN)
                .evaluating((node, ctx) -> {
                    String parent = ctx.parent(node).map(Node::toString).orElse("-");
                    lineage.add(node + "<" + parent + "@" + ctx.siblingIndex(node)
                            + " depth " + ctx.ancestors(node).size());
                    return List.of();
                });

        engineFor(lookup).traverse(sampleTree());

        assertEquals(List.of(
                "TOKEN[0,2)<BLOCK[0,5)@0 depth 2",
                "TOKEN[3,5)<BLOCK[0,5)@1 depth 2",
                "TOKEN[6,8)<ROOT[0,8)@1 depth 1"), lineage);
    }

    @Test
    void traverse_ShouldGiveEachTraversalFreshScratch() {
        TestRule counter = TestRule.on("counter", TestKind.TOKEN)
                .evaluating((node, ctx) -> {
                    int seen = (int) ctx.scratch().merge("count", 1, (a, b) -> (int) a + (int) b);
                    return seen == 3 ? List.of(ctx.finding(node.span(), "third token")) : List.of();
                });
        TraversalEngine engine = engineFor(counter);

        assertEquals(1, engine.traverse(sampleTree()).findings().size());
        assertEquals(1, engine.traverse(sampleTree()).findings().size());
    }

    @Test
    void traverse_ShouldHandleVeryDeepTreesWithoutRecursion() {
        // Arrange
        String text = "x";
        Node node = leaf(text, TestKind.TOKEN, 0, 1);
        for (int i = 0; i < 200_000; i++) {
            node = Node.branch(TestKind.BLOCK, node.span(), List.of(node));
        }
        SyntaxTree tree = SyntaxTree.of(text, node);
        TestRule deepest = TestRule.on("deepest", TestKind.TOKEN)
                .evaluating((n, ctx) -> List.of(ctx.finding(n.span(), "depth " + ctx.ancestors(n).size())));

        // Act
        TraversalResult result = engineFor(deepest).traverse(tree);

        // Assert
        assertEquals(200_001, result.nodesVisited());
        assertEquals("depth 200000", result.findings().get(0).message());
    }

    @Test
    void traverse_ShouldReportSpansPastTheText() {
        TestRule overreach = TestRule.on("overreach", TestKind.ROOT)
                .evaluating((node, ctx) -> {
                    Span beyond = SyntaxTree.of(TEXT + "!!", node).lines().span(9, 10);
                    return List.of(ctx.finding(beyond, "too far"));
                });

        TraversalResult result = engineFor(overreach).traverse(sampleTree());

        assertEquals(Diagnostic.INTERNAL_ERROR_RULE_ID, result.findings().get(0).ruleId());
        assertTrue(result.findings().get(0).message().contains("past the end"));
    }
}
