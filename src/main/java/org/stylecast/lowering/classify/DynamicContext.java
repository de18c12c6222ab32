package org.stylecast.lowering.classify;

import java.util.List;

/**
 * Where a slot sits in the CSS, as seen by the matchers.
 *
 * @param kind        The placement kind.
 * @param property    The declaration property, empty for standalone blocks and non-declaration kinds.
 * @param selector    The enclosing rule selector.
 * @param atRuleStack The enclosing at-rules, outermost first.
 * @param fullValue   Whether the slot makes up the entire declaration value.
 */
public record DynamicContext(Kind kind, String property, String selector, List<String> atRuleStack, boolean fullValue) {

    public enum Kind {
        DECLARATION_VALUE,
        SELECTOR,
        AT_RULE_PARAMS
    }

    public DynamicContext {
        property = property == null ? "" : property;
        atRuleStack = List.copyOf(atRuleStack);
    }

    public static DynamicContext declaration(String property, String selector, List<String> atRuleStack, boolean fullValue) {
        return new DynamicContext(Kind.DECLARATION_VALUE, property, selector, atRuleStack, fullValue);
    }

    public static DynamicContext selector(String selector, List<String> atRuleStack) {
        return new DynamicContext(Kind.SELECTOR, "", selector, atRuleStack, false);
    }

    public static DynamicContext atRuleParams(String selector, List<String> atRuleStack) {
        return new DynamicContext(Kind.AT_RULE_PARAMS, "", selector, atRuleStack, false);
    }

    /**
     * @return {@code true} for a slot that stands for a whole block of declarations.
     */
    public boolean isStandaloneBlock() {
        return kind == Kind.DECLARATION_VALUE && property.isEmpty();
    }

    /**
     * @return {@code true} for a slot inside the value of a named property.
     */
    public boolean isPropertyValue() {
        return kind == Kind.DECLARATION_VALUE && !property.isEmpty();
    }
}
