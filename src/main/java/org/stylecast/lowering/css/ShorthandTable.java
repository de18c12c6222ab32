package org.stylecast.lowering.css;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shorthand CSS properties and their expansion into longhands.
 * <p>
 * All methods accept kebab-case or camelCase property names. Values are split into
 * whitespace separated tokens; parenthesized groups such as {@code rgba(0, 0, 0, .5)}
 * stay one token.
 */
public final class ShorthandTable {

    private static final Map<String, List<String>> LONGHANDS = new LinkedHashMap<>();

    static {
        LONGHANDS.put("background", List.of("backgroundColor", "backgroundImage", "backgroundPosition", "backgroundSize", "backgroundRepeat"));
        LONGHANDS.put("border", List.of("borderWidth", "borderStyle", "borderColor"));
        for (String side : List.of("Top", "Right", "Bottom", "Left")) {
            LONGHANDS.put("border" + side, List.of("border" + side + "Width", "border" + side + "Style", "border" + side + "Color"));
        }
        LONGHANDS.put("borderWidth", List.of("borderTopWidth", "borderRightWidth", "borderBottomWidth", "borderLeftWidth"));
        LONGHANDS.put("borderStyle", List.of("borderTopStyle", "borderRightStyle", "borderBottomStyle", "borderLeftStyle"));
        LONGHANDS.put("borderColor", List.of("borderTopColor", "borderRightColor", "borderBottomColor", "borderLeftColor"));
        LONGHANDS.put("borderRadius", List.of("borderTopLeftRadius", "borderTopRightRadius", "borderBottomRightRadius", "borderBottomLeftRadius"));
        LONGHANDS.put("margin", List.of("marginTop", "marginRight", "marginBottom", "marginLeft"));
        LONGHANDS.put("padding", List.of("paddingTop", "paddingRight", "paddingBottom", "paddingLeft"));
        LONGHANDS.put("flex", List.of("flexGrow", "flexShrink", "flexBasis"));
        LONGHANDS.put("font", List.of("fontStyle", "fontVariant", "fontWeight", "fontSize", "lineHeight", "fontFamily"));
        LONGHANDS.put("animation", List.of("animationName", "animationDuration", "animationTimingFunction", "animationDelay",
                "animationIterationCount", "animationDirection", "animationFillMode", "animationPlayState"));
        LONGHANDS.put("transition", List.of("transitionProperty", "transitionDuration", "transitionTimingFunction", "transitionDelay"));
        LONGHANDS.put("outline", List.of("outlineWidth", "outlineStyle", "outlineColor"));
        LONGHANDS.put("listStyle", List.of("listStyleType", "listStylePosition", "listStyleImage"));
        LONGHANDS.put("gap", List.of("rowGap", "columnGap"));
        LONGHANDS.put("overflow", List.of("overflowX", "overflowY"));
        LONGHANDS.put("placeContent", List.of("alignContent", "justifyContent"));
        LONGHANDS.put("placeItems", List.of("alignItems", "justifyItems"));
        LONGHANDS.put("placeSelf", List.of("alignSelf", "justifySelf"));
        LONGHANDS.put("inset", List.of("top", "right", "bottom", "left"));
    }

    private static final Set<String> BORDER_WIDTH_KEYWORDS = Set.of("thin", "medium", "thick");
    private static final Set<String> BORDER_STYLES = Set.of(
            "none", "hidden", "dotted", "dashed", "solid", "double", "groove", "ridge", "inset", "outset");

    private static final Set<String> TIMING_FUNCTIONS = Set.of(
            "linear", "ease", "ease-in", "ease-out", "ease-in-out", "step-start", "step-end");
    private static final Set<String> DIRECTIONS = Set.of("normal", "reverse", "alternate", "alternate-reverse");
    private static final Set<String> FILL_MODES = Set.of("none", "forwards", "backwards", "both");
    private static final Set<String> PLAY_STATES = Set.of("running", "paused");

    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?|\\.\\d+");

    private ShorthandTable() {}

    /**
     * @param property The property name.
     * @return {@code true} if the property is a known shorthand.
     */
    public static boolean isShorthand(String property) {
        return LONGHANDS.containsKey(PropertyNames.normalize(property));
    }

    /**
     * @param property The property name.
     * @return The longhands of a shorthand property, empty for longhands.
     */
    public static Optional<List<String>> longhandsOf(String property) {
        return Optional.ofNullable(LONGHANDS.get(PropertyNames.normalize(property)));
    }

    /**
     * Expands a shorthand declaration.
     *
     * @param property The property name.
     * @param rawValue The value text.
     * @return The longhands in a fixed order, or empty if the property is not
     *         expandable or the value has no static expansion.
     */
    public static Optional<Map<String, String>> expand(String property, String rawValue) {
        String name = PropertyNames.normalize(property);
        List<String> tokens = tokenize(rawValue);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        switch (name) {
            case "margin":
            case "padding":
                return Optional.of(box(LONGHANDS.get(name), tokens));
            case "border":
            case "borderTop":
            case "borderRight":
            case "borderBottom":
            case "borderLeft":
                return border(LONGHANDS.get(name), tokens);
            case "borderRadius":
                return Optional.of(borderRadius(rawValue));
            case "animation":
                return Optional.of(animation(tokens));
            case "flex":
                return Optional.of(flex(tokens));
            case "gap":
                return Optional.of(axes("rowGap", "columnGap", tokens));
            case "overflow":
                return Optional.of(axes("overflowX", "overflowY", tokens));
            case "background":
                if (rawValue.contains("url") || rawValue.contains("gradient")) {
                    return Optional.empty();
                }
                return Optional.of(single("backgroundColor", rawValue.trim()));
            default:
                return Optional.empty();
        }
    }

    /**
     * Splits a value on whitespace outside parentheses.
     * @param value The value text.
     * @return The tokens.
     */
    public static List<String> tokenize(String value) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        int depth = 0;
        for (char c : value.trim().toCharArray()) {
            if (c == '(') depth++;
            if (c == ')') depth = Math.max(0, depth - 1);
            if (Character.isWhitespace(c) && depth == 0) {
                if (token.length() > 0) {
                    tokens.add(token.toString());
                    token.setLength(0);
                }
            } else {
                token.append(c);
            }
        }
        if (token.length() > 0) {
            tokens.add(token.toString());
        }
        return tokens;
    }

    // --- expanders ---

    private static Map<String, String> box(List<String> sides, List<String> tokens) {
        String top = tokens.get(0);
        String right = tokens.size() > 1 ? tokens.get(1) : top;
        String bottom = tokens.size() > 2 ? tokens.get(2) : top;
        String left = tokens.size() > 3 ? tokens.get(3) : right;
        if (tokens.size() > 4) {
            right = bottom = left = top;
        }
        Map<String, String> result = new LinkedHashMap<>();
        result.put(sides.get(0), top);
        result.put(sides.get(1), right);
        result.put(sides.get(2), bottom);
        result.put(sides.get(3), left);
        return result;
    }

    private static Optional<Map<String, String>> border(List<String> longhands, List<String> tokens) {
        String width = null;
        String style = null;
        String color = null;
        for (String token : tokens) {
            if (Character.isDigit(token.charAt(0)) || BORDER_WIDTH_KEYWORDS.contains(token)) {
                width = token;
            } else if (BORDER_STYLES.contains(token)) {
                style = token;
            } else {
                color = token;
            }
        }
        Map<String, String> result = new LinkedHashMap<>();
        if (width != null) result.put(longhands.get(0), width);
        if (style != null) result.put(longhands.get(1), style);
        if (color != null) result.put(longhands.get(2), color);
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    private static Map<String, String> borderRadius(String rawValue) {
        int slash = rawValue.indexOf('/');
        String horizontal = slash < 0 ? rawValue : rawValue.substring(0, slash);
        // vertical radii have no longhand representation here and are left out
        return box(LONGHANDS.get("borderRadius"), tokenize(horizontal));
    }

    private static Map<String, String> animation(List<String> tokens) {
        Map<String, String> result = new LinkedHashMap<>();
        boolean durationFound = false;
        for (String token : tokens) {
            if ((Character.isDigit(token.charAt(0)) || token.charAt(0) == '.') && token.endsWith("s")) {
                if (!durationFound) {
                    result.put("animationDuration", token);
                    durationFound = true;
                } else {
                    result.putIfAbsent("animationDelay", token);
                }
            } else if (TIMING_FUNCTIONS.contains(token) || token.startsWith("cubic-bezier") || token.startsWith("steps")) {
                result.put("animationTimingFunction", token);
            } else if ("infinite".equals(token) || INTEGER.matcher(token).matches()) {
                result.put("animationIterationCount", token);
            } else if (DIRECTIONS.contains(token)) {
                result.put("animationDirection", token);
            } else if (FILL_MODES.contains(token)) {
                result.put("animationFillMode", token);
            } else if (PLAY_STATES.contains(token)) {
                result.put("animationPlayState", token);
            } else {
                result.putIfAbsent("animationName", token);
            }
        }
        return result;
    }

    private static Map<String, String> flex(List<String> tokens) {
        if (tokens.size() == 1) {
            String only = tokens.get(0);
            switch (only) {
                case "none": return flexOf("0", "0", "auto");
                case "auto": return flexOf("1", "1", "auto");
                case "initial": return flexOf("0", "1", "auto");
                default:
                    return NUMBER.matcher(only).matches() ? flexOf(only, "1", "0") : flexOf("1", "1", only);
            }
        }
        if (tokens.size() == 2) {
            return NUMBER.matcher(tokens.get(1)).matches()
                    ? flexOf(tokens.get(0), tokens.get(1), "0")
                    : flexOf(tokens.get(0), "1", tokens.get(1));
        }
        if (tokens.size() == 3) {
            return flexOf(tokens.get(0), tokens.get(1), tokens.get(2));
        }
        return flexOf("1", "1", "auto");
    }

    private static Map<String, String> flexOf(String grow, String shrink, String basis) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("flexGrow", grow);
        result.put("flexShrink", shrink);
        result.put("flexBasis", basis);
        return result;
    }

    private static Map<String, String> axes(String first, String second, List<String> tokens) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put(first, tokens.get(0));
        result.put(second, tokens.size() > 1 ? tokens.get(1) : tokens.get(0));
        return result;
    }

    private static Map<String, String> single(String property, String value) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put(property, value);
        return result;
    }
}
