package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.condition.Condition;
import org.stylecast.lowering.condition.Conditions;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.template.CssHelper;

import java.util.List;
import java.util.Optional;

/**
 * {@code p.$x && "color: red;"} and {@code p.$x && helper}. A guard over a static css
 * helper becomes a {@link LoweringDecision.Variant}; other guards a single {@code truthy} branch.
 */
public class LogicalAndMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isStandaloneBlock() && !(context.isPropertyValue() && context.fullValue())) {
            return Optional.empty();
        }
        ArrowBinding binding = ArrowBinding.of(expression);
        if (!(binding.body() instanceof JsNode.LogicalExpr and) || !"&&".equals(and.operator())) {
            return Optional.empty();
        }
        Condition condition = Conditions.fromExpression(and.left(), binding::propName)
                .orElseGet(() -> new Condition.Opaque(binding.strip(and.left())));

        if (context.isStandaloneBlock() && condition instanceof Condition.Prop prop
                && and.right() instanceof JsNode.Identifier id && env.scope().isCssHelper(id.name())) {
            CssHelper helper = env.scope().cssHelpers().get(id.name());
            if (helper.isStatic()) {
                return Optional.of(new LoweringDecision.Variant(prop.path(), helper.staticStyle()));
            }
        }

        Optional<CollectedBranches> collected = CollectedBranches.collect(List.of(and.right()), binding, context, env);
        if (collected.isEmpty()) {
            return Optional.empty();
        }
        if (collected.get().failed()) {
            return Optional.of(collected.get().bail());
        }
        return Optional.of(new LoweringDecision.SplitVariants(List.of(
                new LoweringDecision.Branch("truthy", condition, collected.get().styles().get(0)))));
    }
}
