package org.stylecast.lowering.css;

import org.stylecast.lowering.style.StyleValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns single CSS declarations into style object fragments.
 */
public final class StyleFragments {

    private static final Pattern NUMBER = Pattern.compile("-?(\\d+(\\.\\d+)?|\\.\\d+)");

    private StyleFragments() {}

    /**
     * Classifies literal CSS text: plain numbers become numeric values, everything else a string.
     * @param text The literal text.
     * @return The style value.
     */
    public static StyleValue literal(String text) {
        String trimmed = text.trim();
        return NUMBER.matcher(trimmed).matches() ? new StyleValue.Num(trimmed) : new StyleValue.Str(trimmed);
    }

    /**
     * Converts a static declaration. Expandable shorthands become string longhands;
     * anything else keeps its camelCased property.
     *
     * @param property  The property as written.
     * @param value     The value without {@code !important}.
     * @param important Whether {@code !important} was present; kept as a string suffix.
     * @return The fragment in longhand order.
     */
    public static Map<String, StyleValue> fromDeclaration(String property, String value, boolean important) {
        String suffix = important ? " !important" : "";
        Map<String, StyleValue> fragment = new LinkedHashMap<>();
        Optional<Map<String, String>> expanded = ShorthandTable.expand(property, value);
        if (expanded.isPresent()) {
            expanded.get().forEach((longhand, v) -> fragment.put(longhand, new StyleValue.Str(v + suffix)));
            return fragment;
        }
        String name = PropertyNames.normalize(property);
        fragment.put(name, important ? new StyleValue.Str(value.trim() + suffix) : literal(value));
        return fragment;
    }

    /**
     * Converts one branch value of a conditional bound to a property. String values go
     * through shorthand expansion; numbers and expressions are kept under the property.
     *
     * @param property The property as written.
     * @param value    The branch value.
     * @return The fragment.
     */
    public static Map<String, StyleValue> forValue(String property, StyleValue value) {
        if (value instanceof StyleValue.Str s) {
            Optional<Map<String, String>> expanded = ShorthandTable.expand(property, s.value());
            if (expanded.isPresent()) {
                Map<String, StyleValue> fragment = new LinkedHashMap<>();
                expanded.get().forEach((longhand, v) -> fragment.put(longhand, new StyleValue.Str(v)));
                return fragment;
            }
        }
        Map<String, StyleValue> fragment = new LinkedHashMap<>();
        fragment.put(PropertyNames.normalize(property), value);
        return fragment;
    }
}
