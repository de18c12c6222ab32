package org.stylecast.lowering.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.frontend.js.JsNode;

import java.util.Optional;

/**
 * Classifies slot expressions by running the registered matchers in order;
 * the first matcher that produces a decision wins.
 */
public class DynamicExpressionClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(DynamicExpressionClassifier.class);

    /** Reason used when no matcher applies. */
    public static final String UNSUPPORTED = "unsupported interpolation";

    private final MatcherRegistry registry;
    private final MatchContext env;

    public DynamicExpressionClassifier(MatcherRegistry registry, MatchContext env) {
        this.registry = registry;
        this.env = env;
    }

    /**
     * @param expression The slot expression; null if it did not parse.
     * @param context    Where the slot sits.
     * @return The decision, never null.
     */
    public LoweringDecision classify(JsNode expression, DynamicContext context) {
        if (expression == null) {
            return new LoweringDecision.Bail("interpolation could not be parsed", WarningCategory.PARSE_ERROR);
        }
        for (IExpressionMatcher matcher : registry.matchers()) {
            Optional<LoweringDecision> decision = matcher.match(expression, context, env);
            if (decision.isPresent()) {
                LOG.debug("{} matched {} slot in '{}' as {}", matcher.name(), context.kind(),
                        context.property(), decision.get().getClass().getSimpleName());
                return decision.get();
            }
        }
        LOG.debug("No matcher applies to {} slot in '{}'", context.kind(), context.property());
        return new LoweringDecision.Bail(UNSUPPORTED);
    }
}
