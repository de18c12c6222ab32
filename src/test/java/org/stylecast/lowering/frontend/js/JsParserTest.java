package org.stylecast.lowering.frontend.js;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link JsParser} and {@link JsPrinter}.
 * These tests verify that interpolation expressions are parsed into the expected
 * node shapes and printed back in canonical form.
 */
public class JsParserTest {

    /**
     * Verifies that an arrow function with a bare parameter reading a prop is parsed.
     */
    @Test
    @Tag("unit")
    void testParsesArrowWithIdentifierParam() {
        // Arrange
        String source = "props => props.$color";

        // Act
        JsNode node = JsParser.parse(source);

        // Assert
        assertThat(node).isInstanceOf(JsNode.ArrowFunction.class);
        JsNode.ArrowFunction arrow = (JsNode.ArrowFunction) node;
        assertThat(arrow.params()).containsExactly(new JsNode.IdentifierParam("props", null));
        assertThat(arrow.body()).isEqualTo(new JsNode.MemberExpr(new JsNode.Identifier("props"), "$color", null, false));
    }

    /**
     * Verifies destructured parameters with renames, defaults, a rest element and a type annotation.
     */
    @Test
    @Tag("unit")
    void testParsesObjectPatternParam() {
        // Act
        JsNode node = JsParser.parse("({ $size = 2, theme: t, ...rest }: Props) => $size");

        // Assert
        JsNode.ArrowFunction arrow = (JsNode.ArrowFunction) node;
        JsNode.ObjectPatternParam pattern = (JsNode.ObjectPatternParam) arrow.params().get(0);
        assertThat(pattern.properties()).containsExactly(
                new JsNode.PatternProperty("$size", "$size", new JsNode.NumberLiteral("2")),
                new JsNode.PatternProperty("theme", "t", null));
        assertThat(pattern.restName()).isEqualTo("rest");
        assertThat(arrow.body()).isEqualTo(new JsNode.Identifier("$size"));
    }

    @Test
    @Tag("unit")
    void testParsesBlockBodyWithSingleReturn() {
        JsNode node = JsParser.parse("(p) => { return p.$on ? 1 : 0; }");

        JsNode.ArrowFunction arrow = (JsNode.ArrowFunction) node;
        assertThat(arrow.body()).isInstanceOf(JsNode.ConditionalExpr.class);
    }

    /**
     * Verifies operator precedence between logical and equality operators.
     */
    @Test
    @Tag("unit")
    void testLogicalAndBindsTighterThanOr() {
        // Act
        JsNode node = JsParser.parse("a || b && c === 'x'");

        // Assert
        JsNode.LogicalExpr or = (JsNode.LogicalExpr) node;
        assertThat(or.operator()).isEqualTo("||");
        JsNode.LogicalExpr and = (JsNode.LogicalExpr) or.right();
        assertThat(and.operator()).isEqualTo("&&");
        assertThat(and.right()).isEqualTo(new JsNode.BinaryExpr("===",
                new JsNode.Identifier("c"), new JsNode.StringLiteral("x")));
    }

    @Test
    @Tag("unit")
    void testParsesTaggedTemplateWithInterpolation() {
        JsNode node = JsParser.parse("css`color: ${p => p.c};`");

        JsNode.TaggedTemplate tagged = (JsNode.TaggedTemplate) node;
        assertThat(tagged.tag()).isEqualTo(new JsNode.Identifier("css"));
        assertThat(tagged.quasi().quasis()).containsExactly("color: ", ";");
        assertThat(tagged.quasi().expressions()).hasSize(1);
        assertThat(tagged.quasi().isStatic()).isFalse();
    }

    @Test
    @Tag("unit")
    void testParsesCallsAndOptionalMembers() {
        JsNode node = JsParser.parse("darken(0.1, props.theme?.primary)");

        JsNode.CallExpr call = (JsNode.CallExpr) node;
        assertThat(call.callee()).isEqualTo(new JsNode.Identifier("darken"));
        assertThat(call.arguments()).hasSize(2);
        assertThat(call.arguments().get(1)).isEqualTo(new JsNode.MemberExpr(
                new JsNode.MemberExpr(new JsNode.Identifier("props"), "theme", null, false), "primary", null, true));
    }

    /**
     * Verifies that source outside the supported subset is rejected.
     */
    @Test
    @Tag("unit")
    void testRejectsUnsupportedSource() {
        assertThatThrownBy(() -> JsParser.parse("a = 1")).isInstanceOf(JsSyntaxException.class);
        assertThatThrownBy(() -> JsParser.parse("a | b")).isInstanceOf(JsSyntaxException.class);
        assertThat(JsParser.tryParse("(p) => { const x = 1; return x; }")).isEmpty();
        assertThat(JsParser.tryParse("'unterminated")).isEmpty();
        assertThat(JsParser.tryParse("p.x")).isPresent();
    }

    /**
     * Verifies the canonical printed form, including parentheses required by precedence.
     */
    @Test
    @Tag("unit")
    void testPrinterCanonicalForm() {
        assertThat(JsPrinter.print(JsParser.parse("p=>p.a?'x':\"y\""))).isEqualTo("p => p.a ? \"x\" : \"y\"");
        assertThat(JsPrinter.print(JsParser.parse("(a || b) && !c"))).isEqualTo("(a || b) && !c");
        assertThat(JsPrinter.print(JsParser.parse("!(a && b)"))).isEqualTo("!(a && b)");
        assertThat(JsPrinter.print(JsParser.parse("({ a, b: c = 1 }) => a"))).isEqualTo("({ a, b: c = 1 }) => a");
        assertThat(JsPrinter.print(JsParser.parse("`${a}px`"))).isEqualTo("`${a}px`");
    }

    @Test
    @Tag("unit")
    void testQuoteEscapes() {
        assertThat(JsPrinter.quote("a\"b\\c\n")).isEqualTo("\"a\\\"b\\\\c\\n\"");
    }

    @Test
    @Tag("unit")
    void testTemplateSplitKeepsNestedBraces() {
        TemplateLiterals.Parts parts = TemplateLiterals.split("a ${ {x: 1}.x } b ${c}");

        assertThat(parts.quasis()).isEqualTo(List.of("a ", " b ", ""));
        assertThat(parts.expressions()).isEqualTo(List.of(" {x: 1}.x ", "c"));
    }
}
