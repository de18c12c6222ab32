package org.stylecast.lowering.ir;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.frontend.css.CssTreeParser;
import org.stylecast.lowering.frontend.template.StyledTemplate;
import org.stylecast.lowering.frontend.template.TemplateScanner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CssIrBuilder}. Each test scans a template body,
 * parses the resulting CSS and builds the rule list from it.
 */
public class CssIrBuilderTest {

    private static final Placeholders PLACEHOLDERS = new Placeholders(Placeholders.DEFAULT_PREFIX);

    private static List<CssRule> build(String body, boolean recover) {
        StyledTemplate template = new TemplateScanner(PLACEHOLDERS).scan(body, SourceLocation.UNKNOWN, new WarningCollector());
        return new CssIrBuilder(PLACEHOLDERS, recover)
                .build(CssTreeParser.parse(template.rawCss()), template.slots(), template.rawCss());
    }

    /**
     * Verifies that values are split into static text and slot references.
     */
    @Test
    @Tag("unit")
    void testSplitsValuesIntoTextAndSlots() {
        // Act
        List<CssRule> rules = build("color: ${p => p.$c};\nmargin: 0 ${gap}px;\n&:hover { color: blue; }", true);

        // Assert
        assertThat(rules).hasSize(2);
        CssRule root = rules.get(0);
        assertThat(root.selector()).isEqualTo("&");
        assertThat(root.atRuleStack()).isEmpty();
        assertThat(root.declarations().get(0).value())
                .isEqualTo(new CssValue.Interpolated(List.of(new CssValue.SlotRef(0))));
        assertThat(root.declarations().get(1).value()).isEqualTo(new CssValue.Interpolated(List.of(
                new CssValue.Text("0 "), new CssValue.SlotRef(1), new CssValue.Text("px"))));
        CssRule hover = rules.get(1);
        assertThat(hover.selector()).isEqualTo("&:hover");
        assertThat(hover.declarations().get(0).property()).isEqualTo("color");
        assertThat(hover.declarations().get(0).value()).isEqualTo(new CssValue.Static("blue"));
    }

    /**
     * Verifies that rules with the same selector and at-rule stack are merged.
     */
    @Test
    @Tag("unit")
    void testMergesRulesWithSameSelectorAndAtRules() {
        // Act
        List<CssRule> rules = build(
                "&:hover { color: red; }\nmargin: 0;\n&:hover { opacity: 1; }\n@media (max-width: 600px) { &:hover { opacity: 0; } }",
                true);

        // Assert
        assertThat(rules).extracting(CssRule::selector).containsExactly("&:hover", "&", "&:hover");
        assertThat(rules.get(0).declarations()).extracting(CssDeclaration::property).containsExactly("color", "opacity");
        assertThat(rules.get(2).atRuleStack()).containsExactly("@media (max-width: 600px)");
    }

    @Test
    @Tag("unit")
    void testImportantIsStrippedFromValue() {
        CssDeclaration declaration = build("color: red !important;", true).get(0).declarations().get(0);

        assertThat(declaration.important()).isTrue();
        assertThat(declaration.value()).isEqualTo(new CssValue.Static("red"));
        assertThat(declaration.rawValue()).isEqualTo("red !important");
    }

    /**
     * Verifies that a leading block comment and a trailing line comment attach to the right declaration.
     */
    @Test
    @Tag("unit")
    void testAttachesComments() {
        // Act
        List<CssDeclaration> declarations = build("/* brand */\ncolor: red; // keep in sync\nmargin: 0;", true)
                .get(0).declarations();

        // Assert
        assertThat(declarations.get(0).leadingComment()).isEqualTo("brand");
        assertThat(declarations.get(0).trailingLineComment()).isEqualTo("keep in sync");
        assertThat(declarations.get(1).leadingComment()).isNull();
        assertThat(declarations.get(1).trailingLineComment()).isNull();
    }

    /**
     * Verifies that a comment opening a nested block leads the block's first declaration
     * and does not trail the declaration before the block.
     */
    @Test
    @Tag("unit")
    void testCommentsStayInsideNestedBlocks() {
        // Act
        List<CssRule> rules = build("color: red;\n&:hover {\n  // hover color\n  color: blue;\n}\n/* after */\nmargin: 0;", true);

        // Assert
        CssRule root = rules.get(0);
        assertThat(root.declarations().get(0).trailingLineComment()).isNull();
        assertThat(root.declarations().get(1).property()).isEqualTo("margin");
        assertThat(root.declarations().get(1).leadingComment()).isEqualTo("after");
        CssDeclaration hover = rules.get(1).declarations().get(0);
        assertThat(hover.leadingComment()).isEqualTo("hover color");
        assertThat(hover.trailingLineComment()).isNull();
    }

    @Test
    @Tag("unit")
    void testCommentBodyDropsDelimiters() {
        assertThat(CssIrBuilder.commentBody("/* hover color*/")).isEqualTo("hover color");
        assertThat(CssIrBuilder.commentBody("/**/")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testLeadingPlaceholderBecomesStandaloneBlock() {
        List<CssDeclaration> declarations = build("${truncate}\ncolor: red;", true).get(0).declarations();

        assertThat(declarations).hasSize(2);
        assertThat(declarations.get(0).isStandaloneBlock()).isTrue();
        assertThat(declarations.get(0).value().slotIds()).containsExactly(0);
        assertThat(declarations.get(1).property()).isEqualTo("color");
    }

    /**
     * Verifies that a trailing interpolation the parser dropped is recovered onto the root rule,
     * and only when recovery is enabled.
     */
    @Test
    @Tag("unit")
    void testRecoversDroppedPlaceholder() {
        // Act
        List<CssRule> recovered = build("color: red;\n${truncate}", true);
        List<CssRule> dropped = build("color: red;\n${truncate}", false);

        // Assert
        assertThat(recovered.get(0).declarations()).hasSize(2);
        assertThat(recovered.get(0).declarations().get(1).isStandaloneBlock()).isTrue();
        assertThat(dropped.get(0).declarations()).hasSize(1);
    }
}
