package org.stylecast.lowering.frontend.template;

import org.stylecast.lowering.style.StyleValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A top-level {@code css} template of a file.
 *
 * @param name        The binding name.
 * @param staticStyle The parsed style if the template holds only flat static declarations, otherwise null.
 */
public record CssHelper(String name, Map<String, StyleValue> staticStyle) {
    public CssHelper {
        staticStyle = staticStyle == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(staticStyle));
    }

    public boolean isStatic() {
        return staticStyle != null;
    }
}
