package org.stylecast.lowering.adapter;

import org.stylecast.lowering.frontend.js.JsNode;

import java.util.List;

/**
 * A helper call the adapter is asked to resolve.
 *
 * @param calleeName   The callee identifier, e.g. {@code color}.
 * @param calleeSource The callee as written, e.g. {@code helpers.color}.
 * @param arguments    The call arguments.
 */
public record CallRequest(String calleeName, String calleeSource, List<JsNode> arguments) {
    public CallRequest {
        arguments = List.copyOf(arguments);
    }
}
