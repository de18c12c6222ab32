package org.stylecast.lowering.frontend.css;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CssTreeParser}. These tests verify nesting,
 * selector resolution, comment handling and the treatment of incomplete statements.
 */
public class CssTreeParserTest {

    private static final String HOVER = "&" + CssTreeParser.SELECTOR_SENTINEL + ":hover";

    /**
     * Verifies that top-level declarations and nested rules are kept in source order.
     */
    @Test
    @Tag("unit")
    void testParsesDeclarationsAndNestedRule() {
        // Act
        List<CssNode> nodes = CssTreeParser.parse("color: red;\n&:hover { color: blue; }");

        // Assert
        assertThat(nodes).containsExactly(
                new CssNode.Declaration("color: red"),
                new CssNode.Rule(HOVER, List.of(new CssNode.Declaration("color: blue"))));
    }

    @Test
    @Tag("unit")
    void testNestedSelectorsResolveAgainstParent() {
        List<CssNode> nodes = CssTreeParser.parse("&:hover { .icon { fill: red; } }");

        CssNode.Rule hover = (CssNode.Rule) nodes.get(0);
        assertThat(hover.children()).containsExactly(
                new CssNode.Rule(HOVER + " .icon", List.of(new CssNode.Declaration("fill: red"))));
    }

    /**
     * Verifies that declarations directly inside an at-rule nested in a rule are
     * wrapped in a rule with the enclosing selector.
     */
    @Test
    @Tag("unit")
    void testAtRuleInsideRuleWrapsDeclarations() {
        // Act
        List<CssNode> nodes = CssTreeParser.parse("&:hover { @media (min-width:  600px) { color: red; } }");

        // Assert
        CssNode.Rule hover = (CssNode.Rule) nodes.get(0);
        assertThat(hover.children()).containsExactly(new CssNode.AtRule("media", "(min-width: 600px)",
                List.of(new CssNode.Rule(HOVER, List.of(new CssNode.Declaration("color: red"))))));
        assertThat(((CssNode.AtRule) hover.children().get(0)).text()).isEqualTo("@media (min-width: 600px)");
    }

    @Test
    @Tag("unit")
    void testBlocklessAtRule() {
        assertThat(CssTreeParser.parse("@import url(theme.css);"))
                .containsExactly(new CssNode.AtRule("import", "url(theme.css)", List.of()));
    }

    @Test
    @Tag("unit")
    void testLineCommentsBecomeBlockComments() {
        List<CssNode> nodes = CssTreeParser.parse("// note\ncolor: red;");

        assertThat(nodes).containsExactly(
                new CssNode.Comment("/* note*/"),
                new CssNode.Declaration("color: red"));
    }

    @Test
    @Tag("unit")
    void testUrlIsNotMistakenForComment() {
        assertThat(CssTreeParser.parse("background: url(http://cdn.test/a.png);"))
                .containsExactly(new CssNode.Declaration("background: url(http://cdn.test/a.png)"));
    }

    @Test
    @Tag("unit")
    void testSemicolonInsideStringDoesNotSplit() {
        assertThat(CssTreeParser.parse("content: \"a;b\";"))
                .containsExactly(new CssNode.Declaration("content: \"a;b\""));
    }

    /**
     * Verifies that a trailing statement without a colon and without a semicolon is dropped.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStatementWithoutColonIsDropped() {
        assertThat(CssTreeParser.parse("color: red;\n__SC_EXPR_0__"))
                .containsExactly(new CssNode.Declaration("color: red"));
    }
}
