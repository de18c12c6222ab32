package org.stylecast.lowering.style;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A value inside a static style object.
 */
public sealed interface StyleValue {

    /** Shared instance of {@link Null}. */
    StyleValue NULL = new Null();

    /** A string literal. */
    record Str(String value) implements StyleValue {}

    /** A numeric literal in its source spelling. */
    record Num(String raw) implements StyleValue {}

    /** A JavaScript expression to be emitted verbatim, with the imports it needs. */
    record Expr(String source, List<ImportSpec> imports) implements StyleValue {
        public Expr {
            imports = List.copyOf(imports);
        }
    }

    /** An explicit {@code null}, used to seed {@code default} entries. */
    record Null() implements StyleValue {}

    /**
     * A conditional value keyed by pseudo selector or at-rule, always holding {@code default}.
     * The map is mutable while a component is assembled.
     */
    record Nested(Map<String, StyleValue> entries) implements StyleValue {

        /**
         * @param defaultValue The value of the {@code default} entry.
         * @return A fresh nested value holding only {@code default}.
         */
        public static Nested seededWith(StyleValue defaultValue) {
            Map<String, StyleValue> entries = new LinkedHashMap<>();
            entries.put(DEFAULT_KEY, defaultValue);
            return new Nested(entries);
        }
    }

    /** Key of the unconditional entry of a {@link Nested} value. */
    String DEFAULT_KEY = "default";

    /**
     * @param expression Expression source.
     * @return An expression value without imports.
     */
    static StyleValue expr(String expression) {
        return new Expr(expression, List.of());
    }
}
