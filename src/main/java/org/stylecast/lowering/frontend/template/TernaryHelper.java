package org.stylecast.lowering.frontend.template;

import org.stylecast.lowering.frontend.js.JsNode;

/**
 * A helper of the form {@code const f = (x) => x ? <literal> : <literal>}.
 *
 * @param name   The helper name.
 * @param truthy The value returned for a truthy argument.
 * @param falsy  The value returned for a falsy argument.
 */
public record TernaryHelper(String name, JsNode truthy, JsNode falsy) {
}
