package org.stylecast.lowering.frontend.js;

import java.util.List;

/**
 * The expression AST. Only the closed subset of JavaScript that style
 * interpolations use is modelled; everything else is a syntax error.
 */
public sealed interface JsNode {

    record Identifier(String name) implements JsNode {}

    /** A quoted string; {@code value} is unescaped. */
    record StringLiteral(String value) implements JsNode {}

    /** A number, kept in its source spelling. */
    record NumberLiteral(String raw) implements JsNode {}

    record BooleanLiteral(boolean value) implements JsNode {}

    record NullLiteral() implements JsNode {}

    /**
     * A template literal. {@code quasis} holds the raw static text and has exactly
     * one more element than {@code expressions}.
     */
    record TemplateLiteral(List<String> quasis, List<JsNode> expressions) implements JsNode {
        public TemplateLiteral {
            quasis = List.copyOf(quasis);
            expressions = List.copyOf(expressions);
        }

        /**
         * @return {@code true} if the template has no interpolations.
         */
        public boolean isStatic() {
            return expressions.isEmpty();
        }
    }

    record TaggedTemplate(JsNode tag, TemplateLiteral quasi) implements JsNode {}

    /**
     * Member access. {@code computed} is null for dot access, where {@code property}
     * holds the name; for bracket access {@code property} is null.
     */
    record MemberExpr(JsNode object, String property, JsNode computed, boolean optional) implements JsNode {}

    record CallExpr(JsNode callee, List<JsNode> arguments) implements JsNode {
        public CallExpr {
            arguments = List.copyOf(arguments);
        }
    }

    record ArrowFunction(List<Param> params, JsNode body) implements JsNode {
        public ArrowFunction {
            params = List.copyOf(params);
        }
    }

    record ConditionalExpr(JsNode test, JsNode consequent, JsNode alternate) implements JsNode {}

    /** {@code &&}, {@code ||} and {@code ??}. */
    record LogicalExpr(String operator, JsNode left, JsNode right) implements JsNode {}

    record BinaryExpr(String operator, JsNode left, JsNode right) implements JsNode {}

    record UnaryExpr(String operator, JsNode argument) implements JsNode {}

    // --- arrow function parameters ---

    sealed interface Param permits IdentifierParam, ObjectPatternParam {}

    /** {@code name} or {@code name = default}; {@code defaultValue} may be null. */
    record IdentifierParam(String name, JsNode defaultValue) implements Param {}

    /** {@code { a, b: c, d = 1, ...rest }}; {@code restName} may be null. */
    record ObjectPatternParam(List<PatternProperty> properties, String restName) implements Param {
        public ObjectPatternParam {
            properties = List.copyOf(properties);
        }
    }

    record PatternProperty(String key, String localName, JsNode defaultValue) {}
}
