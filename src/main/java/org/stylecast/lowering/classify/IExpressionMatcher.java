package org.stylecast.lowering.classify;

import org.stylecast.lowering.frontend.js.JsNode;

import java.util.Optional;

/**
 * A single recognizer of interpolation patterns. Matchers are pure: they inspect the
 * expression and context and either produce a decision or decline.
 */
public interface IExpressionMatcher {

    /**
     * @param expression The slot expression, never null.
     * @param context    Where the slot sits.
     * @param env        Adapter, scope and options.
     * @return The decision, or empty if this matcher does not apply.
     */
    Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env);

    /**
     * @return A short name used in logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
