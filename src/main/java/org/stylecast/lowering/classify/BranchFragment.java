package org.stylecast.lowering.classify;

import org.stylecast.lowering.style.StyleValue;

import java.util.Map;

/**
 * The style fragment a branch of a conditional interpolation contributes.
 */
public sealed interface BranchFragment {

    /** The branch lowers to a fragment, possibly empty. */
    record Fragment(Map<String, StyleValue> style) implements BranchFragment {}

    /** The branch has the right shape but its content cannot be lowered. */
    record Failed(LoweringDecision.Bail bail) implements BranchFragment {}

    /** The branch has no static form; the matcher does not apply. */
    record NoMatch() implements BranchFragment {}
}
