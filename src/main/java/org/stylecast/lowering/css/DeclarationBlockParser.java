package org.stylecast.lowering.css;

import org.stylecast.lowering.style.StyleValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the CSS text of a conditional block ({@code "color: red; margin: 0;"}).
 * Only flat {@code property: value} pairs are accepted; any other content makes
 * the whole block unparseable.
 */
public final class DeclarationBlockParser {

    private static final Pattern PAIR = Pattern.compile("^([^:]+):([\\s\\S]+)$");
    private static final Pattern PROPERTY = Pattern.compile("-{0,2}[a-zA-Z][\\w-]*");
    private static final Pattern IMPORTANT = Pattern.compile("!important\\s*$", Pattern.CASE_INSENSITIVE);

    private DeclarationBlockParser() {}

    /**
     * @param cssText The block text.
     * @return The style fragment, or empty if the text holds anything but flat pairs.
     */
    public static Optional<Map<String, StyleValue>> parse(String cssText) {
        if (cssText.indexOf('{') >= 0 || cssText.indexOf('}') >= 0) {
            return Optional.empty();
        }
        Map<String, StyleValue> result = new LinkedHashMap<>();
        for (String chunk : cssText.split(";")) {
            String statement = chunk.trim();
            if (statement.isEmpty()) continue;
            Matcher m = PAIR.matcher(statement);
            if (!m.matches()) {
                return Optional.empty();
            }
            String property = m.group(1).trim();
            String value = m.group(2).trim();
            if (!PROPERTY.matcher(property).matches() || value.isEmpty()) {
                return Optional.empty();
            }
            Matcher important = IMPORTANT.matcher(value);
            boolean isImportant = important.find();
            if (isImportant) {
                value = value.substring(0, important.start()).trim();
            }
            result.putAll(StyleFragments.fromDeclaration(property, value, isImportant));
        }
        return Optional.of(result);
    }
}
