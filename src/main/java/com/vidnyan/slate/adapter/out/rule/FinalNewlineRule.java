package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.NodeKind;
import com.vidnyan.slate.domain.model.Span;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.Rule;
import com.vidnyan.slate.domain.rule.RuleContext;
import com.vidnyan.slate.domain.rule.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Flags non-empty files that do not end with a line terminator. The fix appends {@code \n}.
 */
@Component
@Order(30)
public class FinalNewlineRule implements Rule {

    public static final String ID = "final-newline";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Files must end with a line terminator";
    }

    @Override
    public Set<NodeKind> interestedKinds() {
        return AbstractLineRule.ROOT_KINDS;
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.INFO;
    }

    @Override
    public boolean fixable() {
        return true;
    }

    @Override
    public List<Finding> evaluate(Node node, RuleContext context) {
        String text = context.sourceText();
        if (text.isEmpty() || text.endsWith("\n") || text.endsWith("\r")) {
            return List.of();
        }
        Span end = context.lines().span(text.length(), text.length());
        return List.of(context.finding(end, "File does not end with a line terminator", context.edit(end, "\n")));
    }
}
