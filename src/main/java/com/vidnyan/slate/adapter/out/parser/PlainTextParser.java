package com.vidnyan.slate.adapter.out.parser;

import com.vidnyan.slate.application.port.out.SourceParser;
import com.vidnyan.slate.application.port.out.SourceSyntaxException;
import com.vidnyan.slate.domain.model.LineIndex;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.SyntaxTree;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fallback parser for any file without a dedicated language parser.
 *
 * Produces DOCUMENT -> (LINE, LINE_BREAK)* where each LINE holds WORD, WHITESPACE and
 * PUNCTUATION leaves. The leaves tile the text exactly. Text containing NUL characters is
 * treated as binary and rejected.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class PlainTextParser implements SourceParser {

    @Override
    public boolean supports(String fileName) {
        return true;
    }

    @Override
    public SyntaxTree parse(String text) throws SourceSyntaxException {
        LineIndex lines = LineIndex.of(text);
        int nul = text.indexOf('\u0000');
        if (nul >= 0) {
            throw new SourceSyntaxException(lines.span(nul, nul + 1), "Binary content: NUL character at offset " + nul);
        }

        List<Node> children = new ArrayList<>();
        for (int line = 1; line <= lines.lineCount(); line++) {
            int start = lines.lineStart(line);
            int end = lines.contentEnd(line);
            children.add(Node.branch(TextNodeKind.LINE, lines.span(start, end), tokens(text, start, end, lines)));
            if (line < lines.lineCount()) {
                int next = lines.lineStart(line + 1);
                children.add(Node.leaf(TextNodeKind.LINE_BREAK, lines.span(end, next), text.substring(end, next)));
            }
        }
        return new SyntaxTree(text, lines, Node.branch(TextNodeKind.DOCUMENT, lines.fullSpan(), children));
    }

    @Override
    public String getName() {
        return "PlainText";
    }

    private static List<Node> tokens(String text, int start, int end, LineIndex lines) {
        List<Node> tokens = new ArrayList<>();
        int i = start;
        while (i < end) {
            int codePoint = text.codePointAt(i);
            TextNodeKind kind = classify(codePoint);
            int j = i + Character.charCount(codePoint);
            if (kind != TextNodeKind.PUNCTUATION) {
                while (j < end && classify(text.codePointAt(j)) == kind) {
                    j += Character.charCount(text.codePointAt(j));
                }
            }
            tokens.add(Node.leaf(kind, lines.span(i, j), text.substring(i, j)));
            i = j;
        }
        return tokens;
    }

    private static TextNodeKind classify(int codePoint) {
        if (Character.isLetterOrDigit(codePoint) || codePoint == '_') {
            return TextNodeKind.WORD;
        }
        if (Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint)) {
            return TextNodeKind.WHITESPACE;
        }
        return TextNodeKind.PUNCTUATION;
    }
}
