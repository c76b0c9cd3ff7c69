package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.adapter.out.parser.JavaNodeKind;
import com.vidnyan.slate.adapter.out.parser.TextNodeKind;
import com.vidnyan.slate.domain.model.LineIndex;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.NodeKind;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.Rule;
import com.vidnyan.slate.domain.rule.RuleContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Base for layout rules that look at raw lines rather than syntax.
 * Subscribes to the root kind of every parser and is therefore evaluated once per file.
 */
public abstract class AbstractLineRule implements Rule {

    static final Set<NodeKind> ROOT_KINDS = Set.of(TextNodeKind.DOCUMENT, JavaNodeKind.COMPILATION_UNIT);

    @Override
    public Set<NodeKind> interestedKinds() {
        return ROOT_KINDS;
    }

    @Override
    public List<Finding> evaluate(Node node, RuleContext context) {
        LineIndex lines = context.lines();
        List<Finding> findings = new ArrayList<>();
        for (int line = 1; line <= lines.lineCount(); line++) {
            checkLine(line, lines, context, findings);
        }
        return findings;
    }

    /**
     * Inspect one 1-based line and add any findings.
     */
    protected abstract void checkLine(int line, LineIndex lines, RuleContext context, List<Finding> findings);
}
