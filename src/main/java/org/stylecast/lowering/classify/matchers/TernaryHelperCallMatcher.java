package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.condition.Condition;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.template.TernaryHelper;

import java.util.List;
import java.util.Optional;

/**
 * {@code p => pick(p.$active)} where {@code pick} is a file-level ternary helper. The helper's
 * literal branches are attributed to the prop passed in.
 */
public class TernaryHelperCallMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isStandaloneBlock() && !(context.isPropertyValue() && context.fullValue())) {
            return Optional.empty();
        }
        ArrowBinding binding = ArrowBinding.of(expression);
        if (!(binding.body() instanceof JsNode.CallExpr call)
                || !(call.callee() instanceof JsNode.Identifier callee)
                || call.arguments().size() != 1) {
            return Optional.empty();
        }
        TernaryHelper helper = env.scope().ternaryHelpers().get(callee.name());
        Optional<String> prop = binding.propName(call.arguments().get(0));
        if (helper == null || prop.isEmpty()) {
            return Optional.empty();
        }
        // the helper's branches are literals and never read props
        ArrowBinding helperBinding = ArrowBinding.of(helper.truthy());
        Optional<CollectedBranches> collected = CollectedBranches.collect(
                List.of(helper.truthy(), helper.falsy()), helperBinding, context, env);
        if (collected.isEmpty()) {
            return Optional.empty();
        }
        if (collected.get().failed()) {
            return Optional.of(collected.get().bail());
        }
        Condition condition = new Condition.Prop(prop.get());
        return Optional.of(new LoweringDecision.SplitVariants(List.of(
                new LoweringDecision.Branch("truthy", condition, collected.get().styles().get(0)),
                new LoweringDecision.Branch("falsy", Condition.negate(condition), collected.get().styles().get(1)))));
    }
}
