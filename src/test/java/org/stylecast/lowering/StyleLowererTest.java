package org.stylecast.lowering;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.adapter.ConfiguredStyleAdapter;
import org.stylecast.lowering.api.LoweredFile;
import org.stylecast.lowering.api.LoweringException;
import org.stylecast.lowering.config.LoweringOptions;
import org.stylecast.lowering.diagnostics.Warning;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.frontend.template.FileScope;
import org.stylecast.lowering.lower.LoweredComponent;
import org.stylecast.lowering.lower.VariantApplication;
import org.stylecast.lowering.style.ImportSpec;
import org.stylecast.lowering.style.StyleValue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the {@link StyleLowerer}: source text in, lowered components out.
 * The adapter is the configured one with the bundled defaults.
 */
public class StyleLowererTest {

    private StyleLowerer lowerer;

    @BeforeEach
    void setUp() {
        ConfiguredStyleAdapter adapter = ConfiguredStyleAdapter.fromConfig(ConfigFactory.defaultReference());
        lowerer = new StyleLowerer(LoweringOptions.defaults(), adapter);
    }

    /**
     * Verifies that a boolean ternary on a prop becomes two buckets applied as one ternary.
     */
    @Test
    @Tag("unit")
    void testBooleanTernaryIsLoweredToVariantBuckets() {
        // Arrange
        String body = "\n  padding: 4px;\n  color: ${p => p.$primary ? \"white\" : \"black\"};\n";

        // Act
        LoweredComponent button = lowerer.lowerTemplate("Button", body, FileScope.empty(), new WarningCollector());

        // Assert
        assertThat(button.bailed()).isFalse();
        assertThat(button.styleKey()).isEqualTo("button");
        assertThat(button.styleObj()).containsEntry("paddingTop", new StyleValue.Str("4px"));
        assertThat(button.bucket("$primary")).containsEntry("color", new StyleValue.Str("white"));
        assertThat(button.bucket("!$primary")).containsEntry("color", new StyleValue.Str("black"));
        assertThat(button.variantApplications()).containsExactly(
                new VariantApplication.Ternary("$primary", "buttonPrimary", "buttonNotPrimary"));
    }

    @Test
    @Tag("unit")
    void testGuardedBlockIsLoweredToTruthyBucket() {
        LoweredComponent icon = lowerer.lowerTemplate("Icon",
                "display: block;\n${p => p.$upsideDown && \"transform: rotate(180deg);\"}", FileScope.empty(),
                new WarningCollector());

        assertThat(icon.bucket("$upsideDown")).containsEntry("transform", new StyleValue.Str("rotate(180deg)"));
        assertThat(icon.variantStyleKeys()).containsEntry("$upsideDown", "iconUpsideDown");
        assertThat(icon.variantApplications()).containsExactly(
                new VariantApplication.Guarded("$upsideDown", "iconUpsideDown"));
    }

    @Test
    @Tag("unit")
    void testShorthandsExpandToStringLonghands() {
        LoweredComponent box = lowerer.lowerTemplate("Box", "flex: 1 0 auto; opacity: 0.5;", FileScope.empty(),
                new WarningCollector());

        assertThat(box.styleObj())
                .containsEntry("flexGrow", new StyleValue.Str("1"))
                .containsEntry("flexShrink", new StyleValue.Str("0"))
                .containsEntry("flexBasis", new StyleValue.Str("auto"))
                .containsEntry("opacity", new StyleValue.Num("0.5"));
    }

    /**
     * Verifies that theme access resolves through the adapter and records its import.
     */
    @Test
    @Tag("unit")
    void testThemeAccessResolvesThroughAdapter() {
        // Act
        LoweredComponent title = lowerer.lowerTemplate("Title",
                "color: ${props => props.theme.colors.primary};", FileScope.empty(), new WarningCollector());

        // Assert
        ImportSpec tokens = new ImportSpec("./tokens.stylex", "themeVars");
        assertThat(title.styleObj()).containsEntry("color", new StyleValue.Expr("themeVars.primary", List.of(tokens)));
        assertThat(title.imports()).containsExactly(tokens);
    }

    @Test
    @Tag("unit")
    void testPropValueBecomesStyleFunction() {
        LoweredComponent box = lowerer.lowerTemplate("Box", "&:hover { width: ${p => p.$width}; }", FileScope.empty(),
                new WarningCollector());

        assertThat(box.styleFnSpecs()).hasSize(1);
        assertThat(box.styleFnSpecs().get(0).paramName()).isEqualTo("width");
        assertThat(box.styleFnSpecs().get(0).properties()).containsExactly("width");
        assertThat(box.styleFnSpecs().get(0).scope()).containsExactly(":hover");
    }

    @Test
    @Tag("unit")
    void testImportantSurvivesDynamicDeclarations() {
        LoweredComponent box = lowerer.lowerTemplate("Box",
                "color: ${p => p.$a ? \"red\" : \"blue\"} !important;\nwidth: ${p => p.$w} !important;\nmargin: 0 !important;",
                FileScope.empty(), new WarningCollector());

        assertThat(box.bucket("$a")).containsEntry("color", new StyleValue.Str("red !important"));
        assertThat(box.bucket("!$a")).containsEntry("color", new StyleValue.Str("blue !important"));
        assertThat(box.styleFnSpecs()).hasSize(1);
        assertThat(box.styleFnSpecs().get(0).important()).isTrue();
        assertThat(box.styleObj()).containsEntry("marginTop", new StyleValue.Str("0 !important"));
    }

    /**
     * Verifies that an interpolation that does not parse bails its component with a single warning.
     */
    @Test
    @Tag("unit")
    void testUnparseableInterpolationIsReportedOnce() {
        // Arrange
        WarningCollector warnings = new WarningCollector();

        // Act
        LoweredComponent box = lowerer.lowerTemplate("Box", "color: ${p => p.$a +};", FileScope.empty(), warnings);

        // Assert
        assertThat(box.bailed()).isTrue();
        assertThat(warnings.getWarnings()).hasSize(1);
        assertThat(warnings.getWarnings().get(0).category()).isEqualTo(WarningCategory.PARSE_ERROR);
        assertThat(warnings.getWarnings().get(0).message()).isEqualTo("Interpolation could not be parsed: p => p.$a +");
    }

    /**
     * Verifies that components of one file are lowered independently and their warnings
     * are collected for the file.
     */
    @Test
    @Tag("unit")
    void testBailIsIsolatedToOneComponent() throws LoweringException {
        // Arrange
        String source = String.join("\n",
                "import styled from 'styled-components';",
                "const Card = styled.div`",
                "  padding: 8px;",
                "  & .title { font-weight: bold; }",
                "`;",
                "const Label = styled.span`",
                "  color: gray;",
                "`;");

        // Act
        LoweredFile file = lowerer.lowerFile(source, "Card.tsx");

        // Assert
        assertThat(file.fileName()).isEqualTo("Card.tsx");
        assertThat(file.components()).extracting(LoweredComponent::name).containsExactly("Card", "Label");
        assertThat(file.bailedCount()).isEqualTo(1);
        LoweredComponent card = file.components().get(0);
        assertThat(card.bailed()).isTrue();
        assertThat(card.target()).isEqualTo("div");
        LoweredComponent label = file.components().get(1);
        assertThat(label.bailed()).isFalse();
        assertThat(label.styleObj()).containsEntry("color", new StyleValue.Str("gray"));

        assertThat(file.warnings()).hasSize(1);
        Warning warning = file.warnings().get(0);
        assertThat(warning.category()).isEqualTo(WarningCategory.UNSUPPORTED_SELECTOR);
        assertThat(warning.context()).containsEntry("component", "Card");
    }

    /**
     * Verifies that a lowerer built from configuration uses the configured theme object.
     */
    @Test
    @Tag("unit")
    void testFromConfigUsesAdapterSettings() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "stylecast.adapter.theme { object = tokens, import-source = \"./theme.stylex\" }\n"
                        + "stylecast.lowering.theme-key = palette")
                .withFallback(ConfigFactory.defaultReference());

        // Act
        LoweredComponent title = StyleLowerer.fromConfig(config).lowerTemplate("Title",
                "color: ${p => p.palette.colors.primary};", FileScope.empty(), new WarningCollector());

        // Assert
        assertThat(title.styleObj()).containsEntry("color",
                new StyleValue.Expr("tokens.primary", List.of(new ImportSpec("./theme.stylex", "tokens"))));
    }

    @Test
    @Tag("unit")
    void testFromConfigFile(@TempDir Path tempDir) throws IOException, LoweringException {
        Path file = tempDir.resolve("stylecast.conf");
        Files.writeString(file, "stylecast.adapter.theme.object = palette\n", StandardCharsets.UTF_8);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        try {
            LoweredFile lowered = StyleLowerer.fromConfigFile(file.toFile()).lowerFile(
                    "const Title = styled.h1`color: ${p => p.theme.colors.primary};`;", "Title.tsx");

            assertThat(lowered.components().get(0).styleObj().get("color"))
                    .isEqualTo(new StyleValue.Expr("palette.primary", List.of(new ImportSpec("./tokens.stylex", "palette"))));
        } finally {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        }
    }

    @Test
    @Tag("unit")
    void testFileWithoutComponents() throws LoweringException {
        LoweredFile file = lowerer.lowerFile("export const answer = 42;", "answer.ts");

        assertThat(file.components()).isEmpty();
        assertThat(file.warnings()).isEmpty();
    }
}
