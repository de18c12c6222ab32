package org.stylecast.lowering.ir;

import java.util.List;

/**
 * A rule of the IR. Within one build there is at most one rule per
 * (selector, atRuleStack) pair.
 *
 * @param selector     The selector with parser sentinels removed, {@code &} for the component itself.
 * @param atRuleStack  Enclosing at-rule preludes, outermost first.
 * @param declarations The declarations in source order.
 */
public record CssRule(String selector, List<String> atRuleStack, List<CssDeclaration> declarations) {
    public CssRule {
        atRuleStack = List.copyOf(atRuleStack);
        declarations = List.copyOf(declarations);
    }
}
