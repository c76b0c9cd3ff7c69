package com.vidnyan.slate.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.CommentsCollection;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import com.vidnyan.slate.application.port.out.SourceParser;
import com.vidnyan.slate.application.port.out.SourceSyntaxException;
import com.vidnyan.slate.domain.model.LineIndex;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.NodeKind;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.model.SyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * JavaParser-based implementation of SourceParser for {@code .java} files.
 *
 * The JavaParser AST is mapped onto {@link JavaNodeKind} nodes. JavaParser ranges are inclusive
 * line/column pairs; they are converted to half-open offsets through the file's {@link LineIndex}.
 * Nodes that fall outside their parent or overlap an earlier sibling (JavaParser shares some type
 * nodes between declarators) are left out, so the resulting tree always nests cleanly.
 * Comments are not attributed to nodes; each one is inserted under the deepest node containing it.
 */
@Slf4j
@Component
@Order(10)
public class JavaSourceParser implements SourceParser {

    @Override
    public boolean supports(String fileName) {
        return fileName.endsWith(".java");
    }

    @Override
    public SyntaxTree parse(String text) throws SourceSyntaxException {
        // JavaParser instances are not thread-safe
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false));
        ParseResult<CompilationUnit> result = parser.parse(text);
        LineIndex lines = LineIndex.of(text);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw syntaxError(result.getProblems(), lines);
        }

        Draft root = new Draft(JavaNodeKind.COMPILATION_UNIT, 0, text.length());
        collect(result.getResult().get(), root, lines);
        result.getCommentsCollection()
                .map(CommentsCollection::getComments)
                .ifPresent(comments -> comments.forEach(c -> insertComment(c, root, lines)));

        Node tree = build(root, lines);
        log.trace("Mapped Java source of {} chars onto {} nodes", text.length(), tree.size());
        return new SyntaxTree(text, lines, tree);
    }

    @Override
    public String getName() {
        return "JavaParser";
    }

    private static void collect(com.github.javaparser.ast.Node unit, Draft root, LineIndex lines) {
        record Pending(com.github.javaparser.ast.Node source, Draft parent) {
        }

        Deque<Pending> stack = new ArrayDeque<>();
        unit.getChildNodes().forEach(c -> stack.push(new Pending(c, root)));
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            com.github.javaparser.ast.Node source = pending.source();
            Optional<int[]> bounds = source.getRange().flatMap(r -> offsets(r, lines));
            if (bounds.isEmpty()) {
                source.getChildNodes().forEach(c -> stack.push(new Pending(c, pending.parent())));
                continue;
            }

            Draft draft = new Draft(kindOf(source), bounds.get()[0], bounds.get()[1]);
            if (!pending.parent().encloses(draft.start, draft.end)) {
                continue;
            }
            pending.parent().children.add(draft);
            source.getChildNodes().forEach(c -> stack.push(new Pending(c, draft)));
        }
    }

    private static void insertComment(Comment comment, Draft root, LineIndex lines) {
        Optional<int[]> bounds = comment.getRange().flatMap(r -> offsets(r, lines));
        if (bounds.isEmpty()) {
            return;
        }
        int start = bounds.get()[0];
        int end = bounds.get()[1];

        Draft target = root;
        Optional<Draft> deeper = target.childEnclosing(start, end);
        while (deeper.isPresent()) {
            target = deeper.get();
            deeper = target.childEnclosing(start, end);
        }
        target.children.add(new Draft(JavaNodeKind.COMMENT, start, end));
    }

    private static Node build(Draft root, LineIndex lines) {
        // Post-order without recursion: drafts are built after all of their children
        List<Draft> order = new ArrayList<>();
        Deque<Draft> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Draft draft = stack.pop();
            order.add(draft);
            draft.children.forEach(stack::push);
        }

        for (int i = order.size() - 1; i >= 0; i--) {
            Draft draft = order.get(i);
            draft.children.sort(Comparator.<Draft>comparingInt(d -> d.start).thenComparingInt(d -> d.end));

            List<Node> children = new ArrayList<>();
            int lastEnd = draft.start;
            for (Draft child : draft.children) {
                if (child.start < lastEnd) {
                    continue;
                }
                children.add(child.built);
                lastEnd = child.end;
            }

            Span span = lines.span(draft.start, draft.end);
            draft.built = children.isEmpty()
                    ? Node.leaf(draft.kind, span, lines.text().substring(draft.start, draft.end))
                    : Node.branch(draft.kind, span, children);
        }
        return root.built;
    }

    private static NodeKind kindOf(com.github.javaparser.ast.Node node) {
        if (node instanceof PackageDeclaration) return JavaNodeKind.PACKAGE_DECLARATION;
        if (node instanceof ImportDeclaration) return JavaNodeKind.IMPORT_DECLARATION;
        if (node instanceof ClassOrInterfaceDeclaration) return JavaNodeKind.CLASS_OR_INTERFACE_DECLARATION;
        if (node instanceof EnumDeclaration) return JavaNodeKind.ENUM_DECLARATION;
        if (node instanceof RecordDeclaration) return JavaNodeKind.RECORD_DECLARATION;
        if (node instanceof AnnotationDeclaration) return JavaNodeKind.ANNOTATION_DECLARATION;
        if (node instanceof FieldDeclaration) return JavaNodeKind.FIELD_DECLARATION;
        if (node instanceof VariableDeclarator) return JavaNodeKind.VARIABLE_DECLARATOR;
        if (node instanceof MethodDeclaration) return JavaNodeKind.METHOD_DECLARATION;
        if (node instanceof ConstructorDeclaration) return JavaNodeKind.CONSTRUCTOR_DECLARATION;
        if (node instanceof Parameter) return JavaNodeKind.PARAMETER;
        if (node instanceof BlockStmt) return JavaNodeKind.BLOCK_STMT;
        if (node instanceof Statement) return JavaNodeKind.STATEMENT;
        if (node instanceof AnnotationExpr) return JavaNodeKind.ANNOTATION;
        if (node instanceof SimpleName || node instanceof Name) return JavaNodeKind.NAME;
        if (node instanceof Expression) return JavaNodeKind.EXPRESSION;
        if (node instanceof Type) return JavaNodeKind.TYPE;
        if (node instanceof Modifier) return JavaNodeKind.MODIFIER;
        if (node instanceof Comment) return JavaNodeKind.COMMENT;
        return JavaNodeKind.OTHER;
    }

    /**
     * Convert an inclusive JavaParser range into half-open offsets.
     */
    private static Optional<int[]> offsets(Range range, LineIndex lines) {
        int start = offset(range.begin, lines);
        int last = offset(range.end, lines);
        if (start < 0 || last < 0) {
            return Optional.empty();
        }
        int end = Math.min(last + 1, lines.text().length());
        if (end < start) {
            return Optional.empty();
        }
        return Optional.of(new int[] {start, end});
    }

    private static int offset(com.github.javaparser.Position position, LineIndex lines) {
        if (position.line < 1 || position.line > lines.lineCount() || position.column < 1) {
            return -1;
        }
        return lines.offset(position.line, position.column);
    }

    private static SourceSyntaxException syntaxError(List<Problem> problems, LineIndex lines) {
        if (problems.isEmpty()) {
            return new SourceSyntaxException(null, "Syntax error: parser returned no compilation unit");
        }
        Problem first = problems.get(0);
        Span span = first.getLocation()
                .flatMap(TokenRange::toRange)
                .flatMap(r -> offsets(r, lines))
                .map(b -> lines.span(b[0], b[1]))
                .orElse(null);
        String message = first.getMessage().lines().findFirst().orElse("unknown problem");
        return new SourceSyntaxException(span, "Syntax error: " + message);
    }

    private static final class Draft {
        private final NodeKind kind;
        private final int start;
        private final int end;
        private final List<Draft> children = new ArrayList<>();
        private Node built;

        private Draft(NodeKind kind, int start, int end) {
            this.kind = kind;
            this.start = start;
            this.end = end;
        }

        private boolean encloses(int otherStart, int otherEnd) {
            return start <= otherStart && otherEnd <= end;
        }

        private Optional<Draft> childEnclosing(int otherStart, int otherEnd) {
            return children.stream()
                    .filter(c -> c.encloses(otherStart, otherEnd))
                    .findFirst();
        }
    }
}
