package org.stylecast.lowering.condition;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stylecast.lowering.frontend.js.JsParser;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Conditions} and the canonical source form of {@link Condition}.
 */
public class ConditionsTest {

    /**
     * Verifies that logical tests become structured conditions with flattened operands.
     */
    @Test
    @Tag("unit")
    void testParseBuildsStructuredConditions() {
        // Act
        Condition condition = Conditions.parse("$a && $b && !$c");

        // Assert
        assertThat(condition).isEqualTo(new Condition.And(List.of(
                new Condition.Prop("$a"),
                new Condition.Prop("$b"),
                new Condition.Not(new Condition.Prop("$c")))));
        assertThat(condition.toSource()).isEqualTo("$a && $b && !$c");
    }

    @Test
    @Tag("unit")
    void testOrInsideAndIsParenthesized() {
        Condition condition = Conditions.parse("$a && ($b || $c)");

        assertThat(condition.toSource()).isEqualTo("$a && ($b || $c)");
    }

    @Test
    @Tag("unit")
    void testComparisonWithLiteralOnTheLeft() {
        Condition condition = Conditions.parse("'large' === $size");

        assertThat(condition).isEqualTo(new Condition.Compare("$size", "===", "\"large\"", true));
    }

    @Test
    @Tag("unit")
    void testUnstructuredTestIsOpaque() {
        assertThat(Conditions.parse("$count > 2")).isEqualTo(new Condition.Opaque("$count > 2"));
        assertThat(Conditions.parse("a = ")).isEqualTo(new Condition.Opaque("a ="));
    }

    @Test
    @Tag("unit")
    void testNegateRemovesDoubleNegation() {
        Condition prop = new Condition.Prop("$on");

        assertThat(Condition.negate(Condition.negate(prop))).isEqualTo(prop);
        assertThat(Condition.negate(new Condition.And(List.of(prop, new Condition.Prop("$x")))).toSource())
                .isEqualTo("!($on && $x)");
    }

    @Test
    @Tag("unit")
    void testDottedPath() {
        assertThat(Conditions.dottedPath(JsParser.parse("props.user['role']"))).contains("props.user.role");
        assertThat(Conditions.dottedPath(JsParser.parse("undefined"))).isEmpty();
        assertThat(Conditions.dottedPath(JsParser.parse("f(x).y"))).isEmpty();
    }

    /**
     * Verifies complement detection, which decides whether two buckets can be merged
     * into one ternary application.
     */
    @Test
    @Tag("unit")
    void testComplementDetection() {
        assertThat(Conditions.isComplementary("$primary", "!$primary")).isTrue();
        assertThat(Conditions.isComplementary("!$primary", "$primary")).isTrue();
        assertThat(Conditions.isComplementary("$a && $b", "!($a && $b)")).isTrue();
        assertThat(Conditions.isComplementary("$a", "$b")).isFalse();
        assertThat(Conditions.isComplementary("$a", "$a")).isFalse();
        assertThat(Conditions.isNegation("!$a", "$a")).isTrue();
        assertThat(Conditions.isNegation("$a", "!$a")).isFalse();
    }
}
