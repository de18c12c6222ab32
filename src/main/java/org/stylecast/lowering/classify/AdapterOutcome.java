package org.stylecast.lowering.classify;

import org.stylecast.lowering.adapter.Resolution;

/**
 * The outcome of asking the adapter, after checking that its expression parses.
 */
public sealed interface AdapterOutcome {

    /** The adapter does not handle the request. */
    record Declined() implements AdapterOutcome {}

    record Resolved(Resolution resolution) implements AdapterOutcome {}

    /** The adapter answered with an expression that does not parse. */
    record Rejected(String expr) implements AdapterOutcome {}
}
