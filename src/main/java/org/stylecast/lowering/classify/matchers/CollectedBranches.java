package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.BranchFragment;
import org.stylecast.lowering.classify.BranchFragments;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.style.StyleValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fragments of all branches of one conditional, or the bail of the first branch that failed.
 */
record CollectedBranches(List<Map<String, StyleValue>> styles, LoweringDecision.Bail bail) {

    /**
     * @return Empty if any branch has no static form.
     */
    static Optional<CollectedBranches> collect(List<JsNode> branches, ArrowBinding binding,
                                               DynamicContext context, MatchContext env) {
        List<Map<String, StyleValue>> styles = new ArrayList<>();
        for (JsNode branch : branches) {
            BranchFragment fragment = BranchFragments.of(branch, binding, context, env);
            if (fragment instanceof BranchFragment.Failed failed) {
                return Optional.of(new CollectedBranches(null, failed.bail()));
            }
            if (!(fragment instanceof BranchFragment.Fragment f)) {
                return Optional.empty();
            }
            styles.add(f.style());
        }
        return Optional.of(new CollectedBranches(styles, null));
    }

    boolean failed() {
        return bail != null;
    }
}
