package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.domain.model.LineIndex;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.InvalidConfigurationException;
import com.vidnyan.slate.domain.rule.RuleContext;
import com.vidnyan.slate.domain.rule.RuleParameters;
import com.vidnyan.slate.domain.rule.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags lines longer than {@code max} characters (code points, terminator excluded).
 */
@Component
@Order(40)
public class MaxLineLengthRule extends AbstractLineRule {

    public static final String ID = "max-line-length";
    static final String MAX = "max";
    static final int DEFAULT_MAX = 120;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Lines must not exceed the configured length";
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.WARN;
    }

    @Override
    public void validate(RuleParameters parameters) {
        int max = parameters.getInt(MAX, DEFAULT_MAX);
        if (max < 1) {
            throw new InvalidConfigurationException(ID + ": '" + MAX + "' must be positive but was " + max);
        }
    }

    @Override
    protected void checkLine(int line, LineIndex lines, RuleContext context, List<Finding> findings) {
        int max = context.parameters().getInt(MAX, DEFAULT_MAX);
        int start = lines.lineStart(line);
        int end = lines.contentEnd(line);
        int length = lines.text().codePointCount(start, end);
        if (length > max) {
            findings.add(context.finding(lines.span(start, end),
                    "Line is " + length + " characters long, exceeding the limit of " + max));
        }
    }
}
