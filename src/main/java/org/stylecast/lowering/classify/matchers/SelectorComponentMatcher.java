package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsPrinter;

import java.util.Optional;

/**
 * A component reference in selector position, e.g. {@code ${Icon}:hover &}. Such selectors
 * target another component's element and have no static equivalent, so the component bails
 * with a {@code component-selector} warning.
 */
public class SelectorComponentMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (context.kind() != DynamicContext.Kind.SELECTOR) {
            return Optional.empty();
        }
        if (expression instanceof JsNode.Identifier || expression instanceof JsNode.MemberExpr) {
            return Optional.of(new LoweringDecision.Bail(
                    "component selector " + JsPrinter.print(expression) + " is not supported",
                    WarningCategory.COMPONENT_SELECTOR));
        }
        return Optional.empty();
    }
}
