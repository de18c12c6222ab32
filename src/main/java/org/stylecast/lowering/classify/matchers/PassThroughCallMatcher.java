package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.adapter.CallRequest;
import org.stylecast.lowering.classify.AdapterOutcome;
import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.BranchFragments;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.condition.Conditions;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsPrinter;

import java.util.List;
import java.util.Optional;

/**
 * Calls, {@code css} tagged templates and css helper references, passed through verbatim.
 * Calls are first offered to the adapter.
 */
public class PassThroughCallMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (context.kind() == DynamicContext.Kind.SELECTOR) {
            return Optional.empty();
        }
        JsNode body = ArrowBinding.of(expression).body();
        if (body instanceof JsNode.CallExpr call) {
            String calleeSource = JsPrinter.print(call.callee());
            String calleeName = Conditions.dottedPath(call.callee()).orElse(calleeSource);
            AdapterOutcome outcome = env.resolveCall(new CallRequest(calleeName, calleeSource, call.arguments()));
            if (outcome instanceof AdapterOutcome.Resolved resolved) {
                return Optional.of(new LoweringDecision.Convert(resolved.resolution().expr(), resolved.resolution().imports()));
            }
            if (outcome instanceof AdapterOutcome.Rejected rejected) {
                return Optional.of(BranchFragments.unparseable(rejected));
            }
            return verbatim(body);
        }
        if (body instanceof JsNode.TaggedTemplate tagged
                && tagged.tag() instanceof JsNode.Identifier tag && "css".equals(tag.name())) {
            return verbatim(body);
        }
        if (context.isStandaloneBlock() && body instanceof JsNode.Identifier id && env.scope().isCssHelper(id.name())) {
            return verbatim(body);
        }
        return Optional.empty();
    }

    private static Optional<LoweringDecision> verbatim(JsNode body) {
        return Optional.of(new LoweringDecision.Convert(JsPrinter.print(body), List.of()));
    }
}
