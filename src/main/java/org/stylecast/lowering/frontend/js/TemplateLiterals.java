package org.stylecast.lowering.frontend.js;

import java.util.ArrayList;
import java.util.List;

/**
 * Scanning helpers for template literals. Understands nested interpolations,
 * quoted strings, nested templates and comments inside {@code ${...}}.
 */
public final class TemplateLiterals {

    /**
     * The static and interpolated pieces of a template body.
     *
     * @param quasis            Raw static text, always one more entry than expressions.
     * @param expressions       Source text of each interpolation.
     * @param expressionOffsets Offset of each interpolation's source within the body.
     */
    public record Parts(List<String> quasis, List<String> expressions, List<Integer> expressionOffsets) {
        public Parts {
            quasis = List.copyOf(quasis);
            expressions = List.copyOf(expressions);
            expressionOffsets = List.copyOf(expressionOffsets);
        }
    }

    private TemplateLiterals() {}

    /**
     * Finds the backtick that closes a template literal.
     *
     * @param src  The source text.
     * @param from Index just after the opening backtick.
     * @return Index of the closing backtick, or -1 if the template is unterminated.
     */
    public static int findClosingBacktick(String src, int from) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '`') {
                return i;
            } else if (c == '$' && i + 1 < src.length() && src.charAt(i + 1) == '{') {
                int end = findExpressionEnd(src, i + 2);
                if (end < 0) return -1;
                i = end + 1;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * Finds the brace that closes an interpolation.
     *
     * @param src  The source text.
     * @param from Index just after {@code ${}.
     * @return Index of the matching {@code '}'}, or -1.
     */
    public static int findExpressionEnd(String src, int from) {
        int depth = 0;
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            switch (c) {
                case '"', '\'' -> {
                    int end = findQuoteEnd(src, i + 1, c);
                    if (end < 0) return -1;
                    i = end + 1;
                }
                case '`' -> {
                    int end = findClosingBacktick(src, i + 1);
                    if (end < 0) return -1;
                    i = end + 1;
                }
                case '{' -> {
                    depth++;
                    i++;
                }
                case '}' -> {
                    if (depth == 0) return i;
                    depth--;
                    i++;
                }
                case '/' -> {
                    if (src.startsWith("/*", i)) {
                        int end = src.indexOf("*/", i + 2);
                        if (end < 0) return -1;
                        i = end + 2;
                    } else if (src.startsWith("//", i)) {
                        int end = src.indexOf('\n', i);
                        i = end < 0 ? src.length() : end + 1;
                    } else {
                        i++;
                    }
                }
                default -> i++;
            }
        }
        return -1;
    }

    private static int findQuoteEnd(String src, int from, char quote) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * Splits a template body (the text between the backticks) into its parts.
     *
     * @param body The template body.
     * @return The parts.
     * @throws IllegalArgumentException if an interpolation is not closed.
     */
    public static Parts split(String body) {
        List<String> quasis = new ArrayList<>();
        List<String> expressions = new ArrayList<>();
        List<Integer> offsets = new ArrayList<>();
        StringBuilder quasi = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                quasi.append(c).append(body.charAt(i + 1));
                i += 2;
            } else if (c == '$' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                int end = findExpressionEnd(body, i + 2);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated interpolation at offset " + i);
                }
                quasis.add(quasi.toString());
                quasi.setLength(0);
                expressions.add(body.substring(i + 2, end));
                offsets.add(i + 2);
                i = end + 1;
            } else {
                quasi.append(c);
                i++;
            }
        }
        quasis.add(quasi.toString());
        return new Parts(quasis, expressions, offsets);
    }
}
