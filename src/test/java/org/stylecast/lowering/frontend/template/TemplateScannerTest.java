package org.stylecast.lowering.frontend.template;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.ir.Placeholders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link TemplateScanner}.
 */
public class TemplateScannerTest {

    private TemplateScanner scanner;
    private WarningCollector warnings;

    @BeforeEach
    void setUp() {
        scanner = new TemplateScanner(new Placeholders(Placeholders.DEFAULT_PREFIX));
        warnings = new WarningCollector();
    }

    /**
     * Verifies that interpolations are replaced by indexed placeholders and parsed into slots.
     */
    @Test
    @Tag("unit")
    void testReplacesInterpolationsWithPlaceholders() {
        // Act
        StyledTemplate template = scanner.scan("color: ${p => p.$c};\nmargin: ${space};", new SourceLocation(1, 1), warnings);

        // Assert
        assertThat(template.rawCss()).isEqualTo("color: __SC_EXPR_0__;\nmargin: __SC_EXPR_1__;");
        assertThat(template.slots()).hasSize(2);
        assertThat(template.slots().get(0).expression()).isInstanceOf(JsNode.ArrowFunction.class);
        assertThat(template.slots().get(1).expression()).isEqualTo(new JsNode.Identifier("space"));
        assertThat(template.slots().get(1).location()).isEqualTo(new SourceLocation(2, 11));
        assertThat(warnings.getWarnings()).isEmpty();
    }

    /**
     * Verifies that an unparseable interpolation keeps its slot and is reported as a parse error.
     */
    @Test
    @Tag("unit")
    void testUnparseableInterpolationIsReported() {
        // Act
        StyledTemplate template = scanner.scan("color: ${ a = }", new SourceLocation(3, 10), warnings);

        // Assert
        assertThat(template.slots().get(0).expression()).isNull();
        assertThat(template.slots().get(0).source()).isEqualTo("a =");
        assertThat(warnings.getWarnings()).hasSize(1);
        assertThat(warnings.getWarnings().get(0).category()).isEqualTo(WarningCategory.PARSE_ERROR);
        assertThat(warnings.getWarnings().get(0).location()).isEqualTo(new SourceLocation(3, 19));
    }

    @Test
    @Tag("unit")
    void testUnterminatedInterpolationThrows() {
        assertThatThrownBy(() -> scanner.scan("color: ${p => p.c", SourceLocation.UNKNOWN, warnings))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
