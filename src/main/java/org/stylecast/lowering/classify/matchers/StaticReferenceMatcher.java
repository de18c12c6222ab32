package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.BranchFragments;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsPrinter;

import java.util.List;
import java.util.Optional;

/**
 * Literals, static templates and references to constants. Identifiers naming keyframes,
 * components or css helpers are left to the more specific matchers.
 */
public class StaticReferenceMatcher implements IExpressionMatcher {

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isPropertyValue() && context.kind() != DynamicContext.Kind.AT_RULE_PARAMS) {
            return Optional.empty();
        }
        ArrowBinding binding = ArrowBinding.of(expression);
        JsNode body = binding.body();
        if (isLiteral(body)) {
            return convert(body);
        }
        if (binding.propPath(body).isPresent() || !BranchFragments.isStaticReference(body)) {
            return Optional.empty();
        }
        if (body instanceof JsNode.Identifier id
                && (env.scope().isKeyframes(id.name()) || env.scope().isComponent(id.name()) || env.scope().isCssHelper(id.name()))) {
            return Optional.empty();
        }
        return convert(body);
    }

    private static Optional<LoweringDecision> convert(JsNode body) {
        return Optional.of(new LoweringDecision.Convert(JsPrinter.print(body), List.of()));
    }

    private static boolean isLiteral(JsNode node) {
        return node instanceof JsNode.StringLiteral
                || node instanceof JsNode.NumberLiteral
                || (node instanceof JsNode.TemplateLiteral t && t.isStatic());
    }
}
