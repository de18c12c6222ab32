package org.stylecast.lowering.ir;

import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.frontend.js.JsNode;

/**
 * One interpolation point of a template.
 *
 * @param id          Index of the interpolation within its template.
 * @param placeholder The text standing in for the interpolation in the CSS.
 * @param expression  The parsed expression, or null if the source did not parse.
 * @param source      The interpolation source text as written.
 * @param location    Where the interpolation starts in the file.
 */
public record Slot(int id, String placeholder, JsNode expression, String source, SourceLocation location) {
}
