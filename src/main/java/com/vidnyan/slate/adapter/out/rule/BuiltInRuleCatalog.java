package com.vidnyan.slate.adapter.out.rule;

import com.vidnyan.slate.application.port.out.RuleCatalog;
import com.vidnyan.slate.domain.rule.Rule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rule catalog backed by the rule beans in the application context.
 * Spring injects them sorted by {@code @Order}, which becomes the registration order.
 */
@Component
@RequiredArgsConstructor
public class BuiltInRuleCatalog implements RuleCatalog {

    private final List<Rule> rules;

    @Override
    public List<Rule> findAll() {
        return List.copyOf(rules);
    }

    /**
     * The built-in rules in registration order, without a Spring context.
     */
    public static List<Rule> defaultRules() {
        return List.of(
                new TrailingWhitespaceRule(),
                new NoTabIndentRule(),
                new FinalNewlineRule(),
                new MaxLineLengthRule(),
                new TypeNamingRule(),
                new ConstantNamingRule());
    }
}
