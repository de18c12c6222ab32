package org.stylecast.lowering.condition;

import org.stylecast.lowering.css.PropertyNames;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives stable, readable style key suffixes from conditions.
 * <p>
 * Examples: {@code $isActive} gives {@code Active}, {@code config.enabled} gives
 * {@code ConfigEnabled}, {@code size === "large"} gives {@code SizeLarge},
 * {@code user.role === Role.admin} gives {@code UserRoleAdmin}.
 */
public final class StyleKeyNaming {

    /** Suffix used when a condition has no readable name. */
    public static final String COND_TRUTHY = "CondTruthy";

    private static final Pattern SIMPLE_RHS = Pattern.compile("[A-Za-z_][0-9A-Za-z_]*|-?\\d+(\\.\\d+)?");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("(?=[A-Z])");
    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^0-9A-Za-z_]");

    private StyleKeyNaming() {}

    /**
     * Converts a prop name or "when" string to a PascalCase suffix.
     * @param propOrCondition The prop name or condition source.
     * @return The suffix; the same input always gives the same suffix.
     */
    public static String toSuffixFromProp(String propOrCondition) {
        String raw = propOrCondition.startsWith("$") ? propOrCondition.substring(1) : propOrCondition;
        if (raw.isBlank()) {
            return "Variant";
        }
        if (raw.startsWith("--")) {
            return cssVariableSuffix(raw);
        }
        return suffix(Conditions.parse(propOrCondition));
    }

    /**
     * @param condition A structured condition.
     * @return The PascalCase suffix.
     */
    public static String suffix(Condition condition) {
        if (condition instanceof Condition.Prop prop) {
            return propSuffix(prop.path());
        }
        if (condition instanceof Condition.Not not) {
            return "Not" + suffix(not.inner());
        }
        if (condition instanceof Condition.And and) {
            return joinParts(and.parts(), "");
        }
        if (condition instanceof Condition.Or or) {
            return joinParts(or.parts(), "Or");
        }
        if (condition instanceof Condition.Compare compare) {
            return compareSuffix(compare);
        }
        return COND_TRUTHY;
    }

    /**
     * @param componentName The component name, e.g. {@code PrimaryButton}.
     * @return The base style key, e.g. {@code primaryButton}.
     */
    public static String styleKey(String componentName) {
        if (componentName.isEmpty()) return "root";
        return Character.toLowerCase(componentName.charAt(0)) + componentName.substring(1);
    }

    private static String joinParts(List<Condition> parts, String separator) {
        List<String> suffixes = new ArrayList<>();
        for (Condition part : parts) {
            String s = suffix(part);
            if (COND_TRUTHY.equals(s)) {
                return COND_TRUTHY;
            }
            suffixes.add(s);
        }
        return String.join(separator, suffixes);
    }

    private static String propSuffix(String path) {
        String raw = path.startsWith("$") ? path.substring(1) : path;
        if (raw.isEmpty()) {
            return "Variant";
        }
        if (raw.startsWith("--")) {
            return cssVariableSuffix(raw);
        }
        if (raw.contains(".")) {
            return sanitize(dottedToPascal(raw));
        }
        if (raw.startsWith("is") && raw.length() > 2 && Character.isUpperCase(raw.charAt(2))) {
            return sanitize(raw.substring(2));
        }
        return sanitize(PropertyNames.capitalize(raw));
    }

    private static String compareSuffix(Condition.Compare compare) {
        String lhs = compare.lhs().startsWith("$") ? compare.lhs().substring(1) : compare.lhs();
        String rhs = compare.rhs();
        if (compare.literalRhs()) {
            rhs = rhs.replaceAll("^['\"]|['\"]$", "");
        } else {
            rhs = dottedToPascal(rhs);
        }
        if (!rhs.isEmpty() && !SIMPLE_RHS.matcher(rhs).matches()) {
            return COND_TRUTHY;
        }
        if (rhs.isEmpty()) {
            rhs = compare.isNegated() ? "NotMatch" : "Match";
        }
        String lhsSuffix = PropertyNames.capitalize(dottedToPascal(lhs));
        String rhsSuffix = PropertyNames.capitalize(rhs);
        String combined = compare.isNegated() ? lhsSuffix + "Not" + rhsSuffix : lhsSuffix + rhsSuffix;
        return sanitize(dedupeWords(combined));
    }

    private static String cssVariableSuffix(String raw) {
        StringBuilder sb = new StringBuilder();
        for (String part : raw.substring(2).split("-")) {
            sb.append(PropertyNames.capitalize(part));
        }
        return sb.length() == 0 ? "Var" : sanitize(sb.toString());
    }

    private static String dottedToPascal(String path) {
        if (!path.contains(".")) {
            return path;
        }
        StringBuilder sb = new StringBuilder();
        for (String part : path.split("\\.")) {
            sb.append(PropertyNames.capitalize(part.startsWith("$") ? part.substring(1) : part));
        }
        return sb.toString();
    }

    /**
     * Removes consecutive duplicate PascalCase words, compared case-insensitively.
     */
    static String dedupeWords(String text) {
        List<String> words = new ArrayList<>();
        for (String word : WORD_BOUNDARY.split(text)) {
            if (word.isEmpty()) continue;
            if (words.isEmpty() || !words.get(words.size() - 1).equalsIgnoreCase(word)) {
                words.add(word);
            }
        }
        return String.join("", words);
    }

    private static String sanitize(String suffix) {
        return NON_IDENTIFIER.matcher(suffix).replaceAll("");
    }
}
