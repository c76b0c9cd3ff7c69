package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.domain.model.LineIndex;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.InvalidConfigurationException;
import com.vidnyan.slate.domain.rule.RuleContext;
import com.vidnyan.slate.domain.rule.RuleParameters;
import com.vidnyan.slate.domain.rule.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags tab characters in leading indentation.
 * The fix rewrites the indentation with spaces, advancing each tab to the next multiple of
 * {@code indentSize}. Lines holding only whitespace are left alone.
 */
@Component
@Order(20)
public class NoTabIndentRule extends AbstractLineRule {

    public static final String ID = "no-tab-indent";
    static final String INDENT_SIZE = "indentSize";
    static final int DEFAULT_INDENT_SIZE = 4;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Indentation must use spaces, not tabs";
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.WARN;
    }

    @Override
    public boolean fixable() {
        return true;
    }

    @Override
    public void validate(RuleParameters parameters) {
        int indentSize = parameters.getInt(INDENT_SIZE, DEFAULT_INDENT_SIZE);
        if (indentSize < 1 || indentSize > 16) {
            throw new InvalidConfigurationException(
                    ID + ": '" + INDENT_SIZE + "' must be between 1 and 16 but was " + indentSize);
        }
    }

    @Override
    protected void checkLine(int line, LineIndex lines, RuleContext context, List<Finding> findings) {
        String text = lines.text();
        int start = lines.lineStart(line);
        int end = lines.contentEnd(line);
        int indentEnd = start;
        boolean hasTab = false;
        while (indentEnd < end && (text.charAt(indentEnd) == ' ' || text.charAt(indentEnd) == '\t')) {
            hasTab |= text.charAt(indentEnd) == '\t';
            indentEnd++;
        }
        // whitespace-only lines belong to trailing-whitespace
        if (!hasTab || indentEnd == end) {
            return;
        }

        int indentSize = context.parameters().getInt(INDENT_SIZE, DEFAULT_INDENT_SIZE);
        String expanded = expand(text.substring(start, indentEnd), indentSize);
        Span span = lines.span(start, indentEnd);
        findings.add(context.finding(span, "Tab character in indentation", context.edit(span, expanded)));
    }

    static String expand(String indentation, int indentSize) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < indentation.length(); i++) {
            if (indentation.charAt(i) == '\t') {
                int pad = indentSize - (out.length() % indentSize);
                out.append(" ".repeat(pad));
            } else {
                out.append(' ');
            }
        }
        return out.toString();
    }
}
