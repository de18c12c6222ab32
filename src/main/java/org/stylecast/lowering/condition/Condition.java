package org.stylecast.lowering.condition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A boolean condition gating a variant bucket. Conditions are built once from the
 * classified expression; {@link #toSource()} renders the canonical "when" string
 * that keys buckets.
 */
public sealed interface Condition {

    /**
     * @return Canonical source form of the condition.
     */
    String toSource();

    /** A prop (or dotted prop path) tested for truthiness. */
    record Prop(String path) implements Condition {
        @Override
        public String toSource() {
            return path;
        }
    }

    record Not(Condition inner) implements Condition {
        @Override
        public String toSource() {
            return "!" + ConditionSources.wrapUnlessSimple(inner);
        }
    }

    record And(List<Condition> parts) implements Condition {
        public And {
            parts = List.copyOf(parts);
        }

        @Override
        public String toSource() {
            return parts.stream()
                    .map(p -> p instanceof Or || p instanceof Opaque ? ConditionSources.wrapUnlessSimple(p) : p.toSource())
                    .collect(Collectors.joining(" && "));
        }
    }

    record Or(List<Condition> parts) implements Condition {
        public Or {
            parts = List.copyOf(parts);
        }

        @Override
        public String toSource() {
            return parts.stream()
                    .map(p -> p instanceof Opaque ? ConditionSources.wrapUnlessSimple(p) : p.toSource())
                    .collect(Collectors.joining(" || "));
        }
    }

    /**
     * An equality test of a prop against a literal ({@code literalRhs}) or a reference
     * such as an enum member.
     */
    record Compare(String lhs, String operator, String rhs, boolean literalRhs) implements Condition {
        @Override
        public String toSource() {
            return lhs + " " + operator + " " + rhs;
        }

        /**
         * @return {@code true} for {@code !==} and {@code !=}.
         */
        public boolean isNegated() {
            return operator.startsWith("!");
        }
    }

    /** A test that has no structured form; kept verbatim. */
    record Opaque(String source) implements Condition {
        @Override
        public String toSource() {
            return source;
        }
    }

    /**
     * Negates a condition, removing a double negation.
     * @param condition The condition.
     * @return The negated condition.
     */
    static Condition negate(Condition condition) {
        return condition instanceof Not not ? not.inner() : new Not(condition);
    }
}
