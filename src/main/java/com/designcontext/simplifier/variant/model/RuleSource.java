package com.designcontext.simplifier.variant.model;

/**
 * Where a property rule came from. Inferred rules are heuristic and carry less
 * confidence than rules supplied in the heuristics configuration.
 */
public enum RuleSource {
    CONFIGURED,
    INFERRED
}
