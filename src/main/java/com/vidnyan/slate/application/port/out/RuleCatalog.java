package com.vidnyan.slate.application.port.out;

import com.vidnyan.slate.domain.rule.Rule;

import java.util.List;

/**
 * Port for the list of concrete rule implementations registered at startup.
 */
public interface RuleCatalog {

    /**
     * All available rules, in registration order.
     */
    List<Rule> findAll();
}
