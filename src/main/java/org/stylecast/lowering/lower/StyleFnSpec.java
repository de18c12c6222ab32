package org.stylecast.lowering.lower;

import org.stylecast.lowering.style.StyleValue;

import java.util.List;

/**
 * A style function taking one runtime value.
 *
 * @param styleKey         Generated name of the function in the style object.
 * @param paramName        The parameter name.
 * @param originalPropName The prop the value is read from, e.g. {@code $size} or {@code theme.x}.
 * @param properties       The style properties the parameter is written to.
 * @param scope            Pseudo selector and at-rule keys the properties are nested under, outermost first.
 * @param fallback         Value used when the prop is absent, or null.
 * @param important        Whether the generated values carry {@code !important}.
 */
public record StyleFnSpec(
        String styleKey,
        String paramName,
        String originalPropName,
        List<String> properties,
        List<String> scope,
        StyleValue fallback,
        boolean important
) {
    public StyleFnSpec {
        properties = List.copyOf(properties);
        scope = List.copyOf(scope);
    }
}
