package org.stylecast.lowering.classify;

import org.stylecast.lowering.classify.matchers.KeyframesReferenceMatcher;
import org.stylecast.lowering.classify.matchers.LogicalAndMatcher;
import org.stylecast.lowering.classify.matchers.LogicalOrMatcher;
import org.stylecast.lowering.classify.matchers.PassThroughCallMatcher;
import org.stylecast.lowering.classify.matchers.PropAccessMatcher;
import org.stylecast.lowering.classify.matchers.SelectorComponentMatcher;
import org.stylecast.lowering.classify.matchers.StaticReferenceMatcher;
import org.stylecast.lowering.classify.matchers.TernaryHelperCallMatcher;
import org.stylecast.lowering.classify.matchers.TernaryMatcher;
import org.stylecast.lowering.classify.matchers.ThemePathMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry for expression matchers applied in order. The order is a priority:
 * several matchers can structurally match the same expression.
 */
public final class MatcherRegistry {

    private final List<IExpressionMatcher> matchers = new ArrayList<>();

    /**
     * Registers a matcher after all previously registered ones.
     * @param matcher The matcher to register.
     */
    public void register(IExpressionMatcher matcher) {
        matchers.add(matcher);
    }

    /**
     * @return The registered matchers in priority order.
     */
    public List<IExpressionMatcher> matchers() {
        return Collections.unmodifiableList(matchers);
    }

    /**
     * Initializes a new registry with the default matchers.
     * @return A new registry with default matchers.
     */
    public static MatcherRegistry initializeWithDefaults() {
        MatcherRegistry reg = new MatcherRegistry();
        reg.register(new StaticReferenceMatcher());
        reg.register(new KeyframesReferenceMatcher());
        reg.register(new ThemePathMatcher());
        reg.register(new TernaryMatcher());
        reg.register(new LogicalAndMatcher());
        reg.register(new LogicalOrMatcher());
        reg.register(new PropAccessMatcher());
        reg.register(new TernaryHelperCallMatcher());
        reg.register(new PassThroughCallMatcher());
        reg.register(new SelectorComponentMatcher());
        return reg;
    }
}
