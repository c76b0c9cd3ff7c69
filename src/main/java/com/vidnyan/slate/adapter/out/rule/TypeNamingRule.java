package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.adapter.out.parser.JavaNodeKind;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.NodeKind;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.Rule;
import com.vidnyan.slate.domain.rule.RuleContext;
import com.vidnyan.slate.domain.rule.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Java type names (classes, interfaces, enums, records, annotations) must be UpperCamelCase.
 */
@Component
@Order(50)
public class TypeNamingRule implements Rule {

    public static final String ID = "type-naming";

    private static final Pattern UPPER_CAMEL_CASE = Pattern.compile("[A-Z][A-Za-z0-9]*");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Type names must be UpperCamelCase";
    }

    @Override
    public Set<NodeKind> interestedKinds() {
        return Set.of(
                JavaNodeKind.CLASS_OR_INTERFACE_DECLARATION,
                JavaNodeKind.ENUM_DECLARATION,
                JavaNodeKind.RECORD_DECLARATION,
                JavaNodeKind.ANNOTATION_DECLARATION);
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.ERROR;
    }

    @Override
    public List<Finding> evaluate(Node node, RuleContext context) {
        return node.firstChild(JavaNodeKind.NAME)
                .filter(name -> !UPPER_CAMEL_CASE.matcher(context.tree().slice(name.span())).matches())
                .map(name -> context.finding(name.span(),
                        "Type name '" + context.tree().slice(name.span()) + "' should be UpperCamelCase"))
                .map(List::of)
                .orElse(List.of());
    }
}
