package org.stylecast.lowering.condition;

import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsParser;
import org.stylecast.lowering.frontend.js.JsPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Construction and comparison of {@link Condition}s.
 */
public final class Conditions {

    private Conditions() {}

    /**
     * Builds a condition from a test expression.
     *
     * @param test     The test expression.
     * @param propPath Resolves an expression to the prop path it reads, if any.
     * @return The condition, or empty if the test has no structured form.
     */
    public static Optional<Condition> fromExpression(JsNode test, Function<JsNode, Optional<String>> propPath) {
        Optional<String> path = propPath.apply(test);
        if (path.isPresent()) {
            return Optional.of(new Condition.Prop(path.get()));
        }
        if (test instanceof JsNode.UnaryExpr u && "!".equals(u.operator())) {
            return fromExpression(u.argument(), propPath).map(Condition::negate);
        }
        if (test instanceof JsNode.LogicalExpr l && !"??".equals(l.operator())) {
            Optional<Condition> left = fromExpression(l.left(), propPath);
            Optional<Condition> right = fromExpression(l.right(), propPath);
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            boolean and = "&&".equals(l.operator());
            List<Condition> parts = new ArrayList<>();
            for (Condition part : List.of(left.get(), right.get())) {
                if (and && part instanceof Condition.And a) {
                    parts.addAll(a.parts());
                } else if (!and && part instanceof Condition.Or o) {
                    parts.addAll(o.parts());
                } else {
                    parts.add(part);
                }
            }
            return Optional.of(and ? new Condition.And(parts) : new Condition.Or(parts));
        }
        if (test instanceof JsNode.BinaryExpr b && isEquality(b.operator())) {
            Optional<String> lhs = propPath.apply(b.left());
            JsNode rhs = b.right();
            if (lhs.isEmpty()) {
                lhs = propPath.apply(b.right());
                rhs = b.left();
            }
            if (lhs.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Condition.Compare(lhs.get(), b.operator(), JsPrinter.print(rhs), isLiteral(rhs)));
        }
        return Optional.empty();
    }

    /**
     * Parses a "when" string. Bare identifiers and member chains are treated as props.
     * @param source The condition source.
     * @return The condition; text without a structured form becomes {@link Condition.Opaque}.
     */
    public static Condition parse(String source) {
        Optional<JsNode> node = JsParser.tryParse(source);
        if (node.isEmpty()) {
            return new Condition.Opaque(source.trim());
        }
        return fromExpression(node.get(), Conditions::dottedPath)
                .orElseGet(() -> new Condition.Opaque(source.trim()));
    }

    /**
     * @param node An identifier or member chain.
     * @return The dotted path, e.g. {@code user.role}, or empty for other expressions.
     */
    public static Optional<String> dottedPath(JsNode node) {
        if (node instanceof JsNode.Identifier id) {
            return "undefined".equals(id.name()) ? Optional.empty() : Optional.of(id.name());
        }
        if (node instanceof JsNode.MemberExpr m) {
            Optional<String> object = dottedPath(m.object());
            if (object.isEmpty()) return Optional.empty();
            if (m.computed() == null) return Optional.of(object.get() + "." + m.property());
            if (m.computed() instanceof JsNode.StringLiteral s) return Optional.of(object.get() + "." + s.value());
        }
        return Optional.empty();
    }

    /**
     * Checks whether two "when" strings are exact negations of each other
     * ({@code X} and {@code !X}), ignoring whitespace and one layer of enclosing parentheses.
     */
    public static boolean isComplementary(String a, String b) {
        return isNegation(a, b) || isNegation(b, a);
    }

    /**
     * @param candidate A "when" string.
     * @param base      Another "when" string.
     * @return {@code true} if {@code candidate} is {@code !base}, compared as in {@link #isComplementary}.
     */
    public static boolean isNegation(String candidate, String base) {
        String normalized = normalize(candidate);
        if (!normalized.startsWith("!")) {
            return false;
        }
        return normalize(normalized.substring(1)).equals(normalize(base));
    }

    static String normalize(String source) {
        String compact = source.replaceAll("\\s+", "");
        if (compact.startsWith("(") && compact.endsWith(")") && closingParen(compact) == compact.length() - 1) {
            return compact.substring(1, compact.length() - 1);
        }
        return compact;
    }

    private static int closingParen(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') depth++;
            else if (c == ')' && --depth == 0) return i;
        }
        return -1;
    }

    private static boolean isEquality(String operator) {
        return "===".equals(operator) || "!==".equals(operator) || "==".equals(operator) || "!=".equals(operator);
    }

    private static boolean isLiteral(JsNode node) {
        return node instanceof JsNode.StringLiteral
                || node instanceof JsNode.NumberLiteral
                || node instanceof JsNode.BooleanLiteral
                || node instanceof JsNode.NullLiteral
                || (node instanceof JsNode.UnaryExpr u && "-".equals(u.operator()) && u.argument() instanceof JsNode.NumberLiteral);
    }
}
