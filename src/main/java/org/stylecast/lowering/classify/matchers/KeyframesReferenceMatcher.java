package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.frontend.js.JsNode;

import java.util.List;
import java.util.Optional;

/**
 * A reference to a {@code keyframes} binding of the same file. The identifier is kept;
 * the animation body is never inlined.
 */
public class KeyframesReferenceMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isPropertyValue()) {
            return Optional.empty();
        }
        JsNode body = ArrowBinding.of(expression).body();
        if (body instanceof JsNode.Identifier id && env.scope().isKeyframes(id.name())) {
            return Optional.of(new LoweringDecision.Convert(id.name(), List.of()));
        }
        return Optional.empty();
    }
}
