package org.stylecast.lowering.frontend.js;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link JsNode}s back to canonical source. Parentheses are inserted only
 * where operator precedence requires them; strings are always double-quoted.
 */
public final class JsPrinter {

    private static final int ARROW = 2;
    private static final int CONDITIONAL = 3;
    private static final int NULLISH = 4;
    private static final int OR = 5;
    private static final int AND = 6;
    private static final int EQUALITY = 10;
    private static final int RELATIONAL = 11;
    private static final int ADDITIVE = 13;
    private static final int MULTIPLICATIVE = 14;
    private static final int UNARY = 15;
    private static final int POSTFIX = 18;
    private static final int PRIMARY = 20;

    private JsPrinter() {}

    /**
     * @param node The node to print.
     * @return Canonical source for the node.
     */
    public static String print(JsNode node) {
        return print(node, 0);
    }

    /**
     * Quotes a string the way string literals are printed.
     * @param value The raw string value.
     * @return The double-quoted, escaped literal.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static String print(JsNode node, int minPrecedence) {
        String text = render(node);
        return precedence(node) < minPrecedence ? "(" + text + ")" : text;
    }

    private static String render(JsNode node) {
        if (node instanceof JsNode.Identifier id) return id.name();
        if (node instanceof JsNode.StringLiteral s) return quote(s.value());
        if (node instanceof JsNode.NumberLiteral n) return n.raw();
        if (node instanceof JsNode.BooleanLiteral b) return String.valueOf(b.value());
        if (node instanceof JsNode.NullLiteral) return "null";
        if (node instanceof JsNode.TemplateLiteral t) return template(t);
        if (node instanceof JsNode.TaggedTemplate t) return print(t.tag(), POSTFIX) + template(t.quasi());
        if (node instanceof JsNode.MemberExpr m) {
            String object = print(m.object(), POSTFIX);
            if (m.computed() != null) {
                return object + (m.optional() ? "?.[" : "[") + print(m.computed()) + "]";
            }
            return object + (m.optional() ? "?." : ".") + m.property();
        }
        if (node instanceof JsNode.CallExpr c) {
            List<String> args = new ArrayList<>();
            for (JsNode arg : c.arguments()) {
                args.add(print(arg, ARROW));
            }
            return print(c.callee(), POSTFIX) + "(" + String.join(", ", args) + ")";
        }
        if (node instanceof JsNode.ArrowFunction a) return arrow(a);
        if (node instanceof JsNode.ConditionalExpr c) {
            return print(c.test(), NULLISH) + " ? " + print(c.consequent(), ARROW) + " : " + print(c.alternate(), ARROW);
        }
        if (node instanceof JsNode.LogicalExpr l) {
            int p = precedence(l);
            return print(l.left(), p) + " " + l.operator() + " " + print(l.right(), p + 1);
        }
        if (node instanceof JsNode.BinaryExpr b) {
            int p = precedence(b);
            return print(b.left(), p) + " " + b.operator() + " " + print(b.right(), p + 1);
        }
        if (node instanceof JsNode.UnaryExpr u) {
            String operator = "typeof".equals(u.operator()) ? "typeof " : u.operator();
            return operator + print(u.argument(), UNARY);
        }
        throw new IllegalStateException("Unknown node type: " + node.getClass().getSimpleName());
    }

    private static String template(JsNode.TemplateLiteral t) {
        StringBuilder sb = new StringBuilder("`");
        for (int i = 0; i < t.quasis().size(); i++) {
            sb.append(t.quasis().get(i));
            if (i < t.expressions().size()) {
                sb.append("${").append(print(t.expressions().get(i))).append('}');
            }
        }
        return sb.append('`').toString();
    }

    private static String arrow(JsNode.ArrowFunction a) {
        String params;
        if (a.params().size() == 1
                && a.params().get(0) instanceof JsNode.IdentifierParam ip
                && ip.defaultValue() == null) {
            params = ip.name();
        } else {
            List<String> rendered = new ArrayList<>();
            for (JsNode.Param param : a.params()) {
                rendered.add(param(param));
            }
            params = "(" + String.join(", ", rendered) + ")";
        }
        return params + " => " + print(a.body(), ARROW);
    }

    private static String param(JsNode.Param param) {
        if (param instanceof JsNode.IdentifierParam ip) {
            return ip.defaultValue() == null ? ip.name() : ip.name() + " = " + print(ip.defaultValue(), ARROW);
        }
        JsNode.ObjectPatternParam pattern = (JsNode.ObjectPatternParam) param;
        List<String> parts = new ArrayList<>();
        for (JsNode.PatternProperty p : pattern.properties()) {
            String part = p.key().equals(p.localName()) ? p.key() : p.key() + ": " + p.localName();
            if (p.defaultValue() != null) {
                part += " = " + print(p.defaultValue(), ARROW);
            }
            parts.add(part);
        }
        if (pattern.restName() != null) {
            parts.add("..." + pattern.restName());
        }
        return parts.isEmpty() ? "{}" : "{ " + String.join(", ", parts) + " }";
    }

    private static int precedence(JsNode node) {
        if (node instanceof JsNode.ArrowFunction) return ARROW;
        if (node instanceof JsNode.ConditionalExpr) return CONDITIONAL;
        if (node instanceof JsNode.LogicalExpr l) {
            switch (l.operator()) {
                case "??": return NULLISH;
                case "||": return OR;
                default: return AND;
            }
        }
        if (node instanceof JsNode.BinaryExpr b) {
            switch (b.operator()) {
                case "===", "!==", "==", "!=": return EQUALITY;
                case "<", ">", "<=", ">=": return RELATIONAL;
                case "+", "-": return ADDITIVE;
                default: return MULTIPLICATIVE;
            }
        }
        if (node instanceof JsNode.UnaryExpr) return UNARY;
        if (node instanceof JsNode.MemberExpr || node instanceof JsNode.CallExpr || node instanceof JsNode.TaggedTemplate) {
            return POSTFIX;
        }
        if (node instanceof JsNode.NumberLiteral n && n.raw().startsWith("-")) return UNARY;
        return PRIMARY;
    }
}
