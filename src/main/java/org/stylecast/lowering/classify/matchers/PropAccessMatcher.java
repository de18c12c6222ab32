package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.BranchFragments;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.css.StyleFragments;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.style.StyleValue;

import java.util.List;
import java.util.Optional;

/**
 * {@code p.$size} or a destructured {@code ({ size = "1rem" }) => size}: a style function
 * parameterized by the prop. A literal destructuring default becomes the fallback.
 */
public class PropAccessMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isPropertyValue()) {
            return Optional.empty();
        }
        ArrowBinding binding = ArrowBinding.of(expression);
        Optional<List<String>> path = binding.propPath(binding.body());
        if (path.isEmpty()) {
            return Optional.empty();
        }
        List<String> segments = path.get();
        String last = segments.get(segments.size() - 1);
        String paramName = last.startsWith("$") ? last.substring(1) : last;
        StyleValue fallback = segments.size() == 1
                ? binding.defaultFor(segments.get(0)).flatMap(PropAccessMatcher::literal).orElse(null)
                : null;
        return Optional.of(new LoweringDecision.DynamicStyleFunction(paramName, fallback, String.join(".", segments)));
    }

    private static Optional<StyleValue> literal(JsNode node) {
        if (node instanceof JsNode.NumberLiteral n) {
            return Optional.of(new StyleValue.Num(n.raw()));
        }
        return BranchFragments.staticText(node).map(StyleFragments::literal);
    }
}
