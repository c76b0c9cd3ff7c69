package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.adapter.out.parser.JavaNodeKind;
import com.vidnyan.slate.domain.model.Node;
import com.vidnyan.slate.domain.model.NodeKind;
import com.vidnyan.slate.domain.model.SyntaxTree;
import com.vidnyan.slate.domain.rule.Finding;
import com.vidnyan.slate.domain.rule.Rule;
import com.vidnyan.slate.domain.rule.RuleContext;
import com.vidnyan.slate.domain.rule.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fields declared {@code static final} must be UPPER_SNAKE_CASE.
 * Serialization fields are exempt. Only explicit modifiers count.
 */
@Component
@Order(60)
public class ConstantNamingRule implements Rule {

    public static final String ID = "constant-naming";

    private static final Pattern UPPER_SNAKE_CASE = Pattern.compile("[A-Z][A-Z0-9]*(_[A-Z0-9]+)*");
    private static final Set<String> EXEMPT = Set.of("serialVersionUID", "serialPersistentFields");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Constants (static final fields) must be UPPER_SNAKE_CASE";
    }

    @Override
    public Set<NodeKind> interestedKinds() {
        return Set.of(JavaNodeKind.VARIABLE_DECLARATOR);
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.WARN;
    }

    @Override
    public List<Finding> evaluate(Node node, RuleContext context) {
        Optional<Node> field = context.parent(node).filter(p -> p.is(JavaNodeKind.FIELD_DECLARATION));
        if (field.isEmpty() || !isStaticFinal(field.get(), context.tree())) {
            return List.of();
        }

        Optional<Node> name = node.firstChild(JavaNodeKind.NAME);
        if (name.isEmpty()) {
            return List.of();
        }
        String identifier = context.tree().slice(name.get().span());
        if (EXEMPT.contains(identifier) || UPPER_SNAKE_CASE.matcher(identifier).matches()) {
            return List.of();
        }
        return List.of(context.finding(name.get().span(),
                "Constant '" + identifier + "' should be UPPER_SNAKE_CASE"));
    }

    private static boolean isStaticFinal(Node field, SyntaxTree tree) {
        List<String> modifiers = field.childrenOf(JavaNodeKind.MODIFIER).stream()
                .map(m -> tree.slice(m.span()).trim())
                .toList();
        return modifiers.contains("static") && modifiers.contains("final");
    }
}
