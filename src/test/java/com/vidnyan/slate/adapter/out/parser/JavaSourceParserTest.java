package com.vidnyan.slate.adapter.out.parser;

import com.vidnyan.slate.application.port.out.SourceSyntaxException;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaSourceParserTest {

    private final JavaSourceParser parser = new JavaSourceParser();

    private static final String SOURCE = """
            package com.example;

            import java.util.List;

            /** Docs. */
            public class Sample {
                private static final int MAX_SIZE = 10, minSize = 1;

                // counts things
                public int count(List<String> items) {
                    return items.size(); /* trailing */
                }
            }
            """;

    private static List<Node> allNodes(Node root) {
        List<Node> nodes = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            nodes.add(node);
            node.children().forEach(stack::push);
        }
        return nodes;
    }

    @Test
    void supports_ShouldAcceptOnlyJavaFiles() {
        assertTrue(parser.supports("src/Main.java"));
        assertFalse(parser.supports("README.md"));
    }

    @Test
    void parse_ShouldProduceWellFormedTreeCoveringTheText() throws SourceSyntaxException {
        SyntaxTree tree = parser.parse(SOURCE);

        assertTrue(tree.wellFormednessProblem().isEmpty(), () -> tree.wellFormednessProblem().get());
        assertEquals(JavaNodeKind.COMPILATION_UNIT, tree.root().kind());
        assertEquals(0, tree.root().span().startOffset());
        assertEquals(SOURCE.length(), tree.root().span().endOffset());
    }

    @Test
    void parse_ShouldMapDeclarationsToKinds() throws SourceSyntaxException {
        // Arrange & Act
        SyntaxTree tree = parser.parse(SOURCE);
        List<Node> nodes = allNodes(tree.root());

        // Assert
        Node type = nodes.stream().filter(n -> n.is(JavaNodeKind.CLASS_OR_INTERFACE_DECLARATION)).findFirst().orElseThrow();
        assertEquals("Sample", tree.slice(type.firstChild(JavaNodeKind.NAME).orElseThrow().span()));

        Node field = nodes.stream().filter(n -> n.is(JavaNodeKind.FIELD_DECLARATION)).findFirst().orElseThrow();
        List<String> declared = field.childrenOf(JavaNodeKind.VARIABLE_DECLARATOR).stream()
                .map(v -> tree.slice(v.firstChild(JavaNodeKind.NAME).orElseThrow().span()))
                .toList();
        assertEquals(List.of("MAX_SIZE", "minSize"), declared);
        assertEquals(List.of("private", "static", "final"), field.childrenOf(JavaNodeKind.MODIFIER).stream()
                .map(m -> tree.slice(m.span()))
                .toList());

        assertEquals(1, nodes.stream().filter(n -> n.is(JavaNodeKind.METHOD_DECLARATION)).count());
        assertEquals(1, nodes.stream().filter(n -> n.is(JavaNodeKind.IMPORT_DECLARATION)).count());
        assertEquals(1, nodes.stream().filter(n -> n.is(JavaNodeKind.PACKAGE_DECLARATION)).count());
    }

    @Test
    void parse_ShouldInsertCommentsAsNodes() throws SourceSyntaxException {
        SyntaxTree tree = parser.parse(SOURCE);

        List<String> comments = allNodes(tree.root()).stream()
                .filter(n -> n.is(JavaNodeKind.COMMENT))
                .map(n -> n.text().orElseThrow().strip())
                .sorted()
                .toList();

        assertEquals(List.of("/* trailing */", "/** Docs. */", "// counts things"), comments);
    }

    @Test
    void parse_ShouldHandleCarriageReturnLineEndings() throws SourceSyntaxException {
        String text = "class A {\r\n  int b;\r\n}\r\n";

        SyntaxTree tree = parser.parse(text);

        Node field = allNodes(tree.root()).stream()
                .filter(n -> n.is(JavaNodeKind.FIELD_DECLARATION))
                .findFirst()
                .orElseThrow();
        assertEquals("int b;", tree.slice(field.span()));
        assertTrue(tree.wellFormednessProblem().isEmpty());
    }

    @Test
    void parse_ShouldRaiseSyntaxErrorWithLocation() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> parser.parse("class Broken {\n  void m( {\n}\n"));

        assertTrue(e.getMessage().startsWith("Syntax error:"));
        assertNotNull(e.span());
        assertTrue(e.span().start().line() >= 2);
    }

    @Test
    void parse_ShouldAcceptEmptyText() throws SourceSyntaxException {
        SyntaxTree tree = parser.parse("");

        assertEquals(0, tree.root().span().endOffset());
        assertTrue(tree.root().isLeaf());
    }
}
