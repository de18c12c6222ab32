package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.BranchFragments;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.css.PropertyNames;
import org.stylecast.lowering.css.StyleFragments;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.style.StyleValue;

import java.util.Optional;

/**
 * {@code p.$color || "red"} (also {@code ??}): a style function of the target property
 * with the literal as its fallback.
 */
public class LogicalOrMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isPropertyValue() || !context.fullValue()) {
            return Optional.empty();
        }
        ArrowBinding binding = ArrowBinding.of(expression);
        if (!(binding.body() instanceof JsNode.LogicalExpr or)
                || !("||".equals(or.operator()) || "??".equals(or.operator()))) {
            return Optional.empty();
        }
        Optional<String> prop = binding.propName(or.left());
        if (prop.isEmpty()) {
            return Optional.empty();
        }
        StyleValue fallback;
        if (or.right() instanceof JsNode.NumberLiteral n) {
            fallback = new StyleValue.Num(n.raw());
        } else {
            Optional<String> text = BranchFragments.staticText(or.right());
            if (text.isEmpty()) {
                return Optional.empty();
            }
            fallback = StyleFragments.literal(text.get());
        }
        return Optional.of(new LoweringDecision.DynamicStyleFunction(
                PropertyNames.normalize(context.property()), fallback, prop.get()));
    }
}
