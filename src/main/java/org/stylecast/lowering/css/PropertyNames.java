package org.stylecast.lowering.css;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts CSS property names to the camelCase form used in style objects.
 */
public final class PropertyNames {

    private static final Pattern DASH_LETTER = Pattern.compile("-([a-z])");
    private static final String[] VENDOR_PREFIXES = {"webkit", "moz", "ms"};

    private PropertyNames() {}

    /**
     * Normalizes a property name. Custom properties ({@code --x}) are returned unchanged.
     * @param property The property as written, kebab-case or camelCase.
     * @return The camelCase name, e.g. {@code -webkit-line-clamp} becomes {@code webkitLineClamp}.
     */
    public static String normalize(String property) {
        String p = property.trim();
        if (p.startsWith("--")) {
            return p;
        }
        for (String vendor : VENDOR_PREFIXES) {
            String prefix = "-" + vendor + "-";
            if (p.startsWith(prefix)) {
                return vendor + capitalize(kebabToCamel(p.substring(prefix.length())));
            }
        }
        return kebabToCamel(p);
    }

    /**
     * @param text kebab-case text.
     * @return camelCase text.
     */
    public static String kebabToCamel(String text) {
        Matcher m = DASH_LETTER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, m.group(1).toUpperCase());
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
