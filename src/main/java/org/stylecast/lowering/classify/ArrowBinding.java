package org.stylecast.lowering.classify;

import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsPrinter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The props binding of an interpolation. For {@code (props) => ...} reads go through
 * {@code props}; for {@code ({ $a, b: c = 1 }) => ...} each destructured local stands for
 * its key. A non-function interpolation has no binding and its whole expression is the body.
 */
public final class ArrowBinding {

    private final String propsName;
    private final Map<String, String> localToKey;
    private final Map<String, JsNode> defaults;
    private final JsNode body;
    private final boolean function;

    private ArrowBinding(String propsName, Map<String, String> localToKey, Map<String, JsNode> defaults,
                         JsNode body, boolean function) {
        this.propsName = propsName;
        this.localToKey = localToKey;
        this.defaults = defaults;
        this.body = body;
        this.function = function;
    }

    /**
     * @param expression A slot expression.
     * @return The binding of an arrow function, or a binding without props for any other expression.
     */
    public static ArrowBinding of(JsNode expression) {
        if (!(expression instanceof JsNode.ArrowFunction arrow)) {
            return new ArrowBinding(null, Map.of(), Map.of(), expression, false);
        }
        if (arrow.params().isEmpty()) {
            return new ArrowBinding(null, Map.of(), Map.of(), arrow.body(), true);
        }
        JsNode.Param first = arrow.params().get(0);
        if (first instanceof JsNode.IdentifierParam id) {
            return new ArrowBinding(id.name(), Map.of(), Map.of(), arrow.body(), true);
        }
        JsNode.ObjectPatternParam pattern = (JsNode.ObjectPatternParam) first;
        Map<String, String> locals = new LinkedHashMap<>();
        Map<String, JsNode> defaults = new LinkedHashMap<>();
        for (JsNode.PatternProperty property : pattern.properties()) {
            locals.put(property.localName(), property.key());
            if (property.defaultValue() != null) {
                defaults.put(property.key(), property.defaultValue());
            }
        }
        return new ArrowBinding(pattern.restName(), locals, defaults, arrow.body(), true);
    }

    public JsNode body() {
        return body;
    }

    /**
     * @return {@code true} if the interpolation was a function of props.
     */
    public boolean isFunction() {
        return function;
    }

    /**
     * Resolves an expression to the prop path it reads.
     * @param node An expression from the body.
     * @return The non-empty path, e.g. {@code [theme, colors, primary]}, or empty.
     */
    public Optional<List<String>> propPath(JsNode node) {
        List<String> segments = new ArrayList<>();
        if (!collect(node, segments) || segments.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableList(segments));
    }

    /**
     * @param node An expression from the body.
     * @return The dotted prop path, e.g. {@code $size} or {@code user.role}.
     */
    public Optional<String> propName(JsNode node) {
        return propPath(node).map(path -> String.join(".", path));
    }

    /**
     * @param key A destructured prop key.
     * @return The default value declared in the pattern.
     */
    public Optional<JsNode> defaultFor(String key) {
        return Optional.ofNullable(defaults.get(key));
    }

    /**
     * Prints an expression with every props read rewritten to its prop path, so
     * {@code props.$a && p.b} prints as {@code $a && b}.
     * @param node An expression from the body.
     * @return The rewritten source.
     */
    public String strip(JsNode node) {
        return JsPrinter.print(rewrite(node));
    }

    private JsNode rewrite(JsNode node) {
        Optional<String> name = propName(node);
        if (name.isPresent()) {
            return new JsNode.Identifier(name.get());
        }
        if (node instanceof JsNode.UnaryExpr u) {
            return new JsNode.UnaryExpr(u.operator(), rewrite(u.argument()));
        }
        if (node instanceof JsNode.BinaryExpr b) {
            return new JsNode.BinaryExpr(b.operator(), rewrite(b.left()), rewrite(b.right()));
        }
        if (node instanceof JsNode.LogicalExpr l) {
            return new JsNode.LogicalExpr(l.operator(), rewrite(l.left()), rewrite(l.right()));
        }
        if (node instanceof JsNode.ConditionalExpr c) {
            return new JsNode.ConditionalExpr(rewrite(c.test()), rewrite(c.consequent()), rewrite(c.alternate()));
        }
        if (node instanceof JsNode.CallExpr call) {
            List<JsNode> args = new ArrayList<>();
            for (JsNode arg : call.arguments()) {
                args.add(rewrite(arg));
            }
            return new JsNode.CallExpr(rewrite(call.callee()), args);
        }
        if (node instanceof JsNode.MemberExpr m) {
            return new JsNode.MemberExpr(rewrite(m.object()), m.property(),
                    m.computed() == null ? null : rewrite(m.computed()), m.optional());
        }
        return node;
    }

    private boolean collect(JsNode node, List<String> segments) {
        if (node instanceof JsNode.Identifier id) {
            if (id.name().equals(propsName)) {
                return true;
            }
            String key = localToKey.get(id.name());
            if (key != null) {
                segments.add(key);
                return true;
            }
            return false;
        }
        if (node instanceof JsNode.MemberExpr m) {
            if (!collect(m.object(), segments)) {
                return false;
            }
            if (m.computed() == null) {
                segments.add(m.property());
                return true;
            }
            if (m.computed() instanceof JsNode.StringLiteral s) {
                segments.add(s.value());
                return true;
            }
        }
        return false;
    }
}
