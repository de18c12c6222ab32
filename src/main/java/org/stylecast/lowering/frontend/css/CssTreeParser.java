package org.stylecast.lowering.frontend.css;

import java.util.ArrayList;
import java.util.List;

/**
 * A small, forgiving CSS parser for styled templates. It mirrors the behaviour of
 * the preprocessors CSS-in-JS libraries run at build time:
 * <ul>
 *   <li>{@code //} line comments are rewritten to {@code /* text*&#47;} (no space before the closer),</li>
 *   <li>every {@code &} in a selector is followed by a form-feed sentinel,</li>
 *   <li>nested rules are resolved against their parent selector,</li>
 *   <li>statements without a colon that are not closed by {@code ;} are dropped,</li>
 *   <li>text without a terminating {@code ;} is merged into the following statement.</li>
 * </ul>
 * The last two are what the IR builder's placeholder handling compensates for.
 */
public class CssTreeParser {

    /** Sentinel inserted after each {@code &} of a selector. */
    public static final char SELECTOR_SENTINEL = '\f';

    private final String css;
    private int pos = 0;

    /**
     * @param css The CSS text, with interpolations already replaced by placeholders.
     */
    public CssTreeParser(String css) {
        this.css = css;
    }

    /**
     * Parses the given CSS text.
     * @param css The CSS text.
     * @return The top-level nodes.
     */
    public static List<CssNode> parse(String css) {
        return new CssTreeParser(css).parse();
    }

    /**
     * Parses the whole input. Unbalanced closing braces end the input early.
     * @return The top-level nodes.
     */
    public List<CssNode> parse() {
        pos = 0;
        return block(null);
    }

    private List<CssNode> block(String parentSelector) {
        List<CssNode> nodes = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        int parenDepth = 0;
        while (pos < css.length()) {
            char c = css.charAt(pos);
            if (c == '/' && css.startsWith("/*", pos)) {
                int end = css.indexOf("*/", pos + 2);
                int stop = end < 0 ? css.length() : end + 2;
                nodes.add(new CssNode.Comment(css.substring(pos, stop)));
                pos = stop;
                continue;
            }
            if (c == '/' && css.startsWith("//", pos) && parenDepth == 0 && (pos == 0 || css.charAt(pos - 1) != ':')) {
                int end = css.indexOf('\n', pos);
                int stop = end < 0 ? css.length() : end;
                String text = css.substring(pos + 2, stop).trim();
                nodes.add(new CssNode.Comment(text.isEmpty() ? "/**/" : "/* " + text + "*/"));
                pos = stop;
                continue;
            }
            if (c == '"' || c == '\'') {
                int end = quoteEnd(pos + 1, c);
                buffer.append(css, pos, end);
                pos = end;
                continue;
            }
            if (c == '(') parenDepth++;
            if (c == ')' && parenDepth > 0) parenDepth--;
            if (parenDepth == 0) {
                if (c == ';') {
                    flushStatement(buffer, nodes, true);
                    pos++;
                    continue;
                }
                if (c == '{') {
                    String prelude = buffer.toString().trim();
                    buffer.setLength(0);
                    pos++;
                    nodes.add(prelude.startsWith("@")
                            ? atRule(prelude, parentSelector)
                            : rule(prelude, parentSelector));
                    continue;
                }
                if (c == '}') {
                    flushStatement(buffer, nodes, false);
                    pos++;
                    return nodes;
                }
            }
            buffer.append(c);
            pos++;
        }
        flushStatement(buffer, nodes, false);
        return nodes;
    }

    private CssNode rule(String prelude, String parentSelector) {
        String selector = resolveSelector(prelude, parentSelector);
        return new CssNode.Rule(selector, block(selector));
    }

    private CssNode atRule(String prelude, String parentSelector) {
        String body = prelude.substring(1);
        int space = indexOfWhitespace(body);
        String name = space < 0 ? body : body.substring(0, space);
        String params = space < 0 ? "" : body.substring(space).trim().replaceAll("\\s+", " ");
        List<CssNode> children = block(parentSelector);
        if (parentSelector == null) {
            return new CssNode.AtRule(name, params, children);
        }
        // declarations directly inside a nested at-rule belong to the enclosing rule
        List<CssNode> own = new ArrayList<>();
        List<CssNode> nested = new ArrayList<>();
        for (CssNode child : children) {
            if (child instanceof CssNode.Rule || child instanceof CssNode.AtRule) {
                nested.add(child);
            } else {
                own.add(child);
            }
        }
        List<CssNode> wrapped = new ArrayList<>();
        if (!own.isEmpty()) {
            wrapped.add(new CssNode.Rule(parentSelector, own));
        }
        wrapped.addAll(nested);
        return new CssNode.AtRule(name, params, wrapped);
    }

    private void flushStatement(StringBuilder buffer, List<CssNode> nodes, boolean terminated) {
        String text = buffer.toString().trim();
        buffer.setLength(0);
        if (text.isEmpty()) return;
        if (text.startsWith("@")) {
            String body = text.substring(1);
            int space = indexOfWhitespace(body);
            nodes.add(new CssNode.AtRule(
                    space < 0 ? body : body.substring(0, space),
                    space < 0 ? "" : body.substring(space).trim(),
                    List.of()));
            return;
        }
        if (text.indexOf(':') >= 0 || terminated) {
            nodes.add(new CssNode.Declaration(text));
        }
    }

    /**
     * Resolves a selector against its parent and inserts the {@code &} sentinel.
     * @param selector The selector as written.
     * @param parent The resolved parent selector, or null at top level.
     * @return The resolved selector.
     */
    static String resolveSelector(String selector, String parent) {
        List<String> resolved = new ArrayList<>();
        for (String item : splitTopLevel(selector.replaceAll("\\s+", " "))) {
            String part = item.trim();
            if (part.isEmpty()) continue;
            if (parent == null) {
                resolved.add(part.replace("&", "&" + SELECTOR_SENTINEL));
            } else if (part.contains("&")) {
                resolved.add(part.replace("&", parent));
            } else {
                resolved.add(parent + " " + part);
            }
        }
        return String.join(",", resolved);
    }

    private static List<String> splitTopLevel(String selector) {
        List<String> items = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (c == '(' || c == '[') depth++;
            else if (c == ')' || c == ']') depth--;
            else if (c == ',' && depth == 0) {
                items.add(selector.substring(start, i));
                start = i + 1;
            }
        }
        items.add(selector.substring(start));
        return items;
    }

    private int quoteEnd(int from, char quote) {
        int i = from;
        while (i < css.length()) {
            char c = css.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        return css.length();
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) return i;
        }
        return -1;
    }
}
