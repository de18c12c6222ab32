package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.adapter.ValueRequest;
import org.stylecast.lowering.classify.AdapterOutcome;
import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.BranchFragments;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.frontend.js.JsNode;

import java.util.List;
import java.util.Optional;

/**
 * {@code props.theme.a.b} resolved through the adapter. When the adapter declines,
 * the expression falls through to the generic prop access matcher.
 */
public class ThemePathMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isPropertyValue() && context.kind() != DynamicContext.Kind.AT_RULE_PARAMS) {
            return Optional.empty();
        }
        ArrowBinding binding = ArrowBinding.of(expression);
        Optional<List<String>> path = binding.propPath(binding.body());
        if (path.isEmpty() || path.get().size() < 2 || !path.get().get(0).equals(env.themeKey())) {
            return Optional.empty();
        }
        String themePath = String.join(".", path.get().subList(1, path.get().size()));
        AdapterOutcome outcome = env.resolveValue(ValueRequest.theme(themePath));
        if (outcome instanceof AdapterOutcome.Resolved resolved) {
            return Optional.of(new LoweringDecision.Convert(resolved.resolution().expr(), resolved.resolution().imports()));
        }
        if (outcome instanceof AdapterOutcome.Rejected rejected) {
            return Optional.of(BranchFragments.unparseable(rejected));
        }
        return Optional.empty();
    }
}
