package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.domain.model.LineIndex;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.RuleContext;
import com.vidnyan.slate.domain.rule.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags spaces and tabs before a line terminator. The fix deletes them.
 */
@Component
@Order(10)
public class TrailingWhitespaceRule extends AbstractLineRule {

    public static final String ID = "trailing-whitespace";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Lines must not end with whitespace";
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
    protected void checkLine(int line, LineIndex lines, RuleContext context, List<Finding> findings) {
        String text = lines.text();
        int start = lines.lineStart(line);
        int end = lines.contentEnd(line);
        int trimmed = end;
        while (trimmed > start && isBlank(text.charAt(trimmed - 1))) {
            trimmed--;
        }
        if (trimmed == end) {
            return;
        }

        Span span = lines.span(trimmed, end);
        findings.add(context.finding(span, "Trailing whitespace", context.edit(span, "")));
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B';
    }
}
