package org.stylecast.lowering.adapter;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.style.ImportSpec;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link ConfiguredStyleAdapter}.
 */
public class ConfiguredStyleAdapterTest {

    private static ConfiguredStyleAdapter adapter(String overrides) {
        Config config = ConfigFactory.parseString(overrides).withFallback(ConfigFactory.defaultReference());
        return ConfiguredStyleAdapter.fromConfig(config);
    }

    /**
     * Verifies that theme paths resolve to a member of the theme object named by the last segment.
     */
    @Test
    @Tag("unit")
    void testThemePathResolvesToLastSegment() {
        // Arrange
        ConfiguredStyleAdapter adapter = adapter("stylecast.adapter.theme.collection-roots = [colors]");

        // Act
        Resolution token = adapter.resolveValue(ValueRequest.theme("colors.primary")).orElseThrow();
        Resolution collection = adapter.resolveValue(ValueRequest.theme("colors")).orElseThrow();

        // Assert
        ImportSpec tokens = new ImportSpec("./tokens.stylex", "themeVars");
        assertThat(token).isEqualTo(new Resolution("themeVars.primary", List.of(tokens)));
        assertThat(collection).isEqualTo(new Resolution("themeVars", List.of(tokens)));
        assertThat(adapter.resolveValue(ValueRequest.theme(""))).isEmpty();
    }

    @Test
    @Tag("unit")
    void testThemeKeyThatIsNoIdentifierIsQuoted() {
        Resolution resolution = adapter("").resolveValue(ValueRequest.theme("space.2xl")).orElseThrow();

        assertThat(resolution.expr()).isEqualTo("themeVars[\"2xl\"]");
    }

    @Test
    @Tag("unit")
    void testCssVariables() {
        Resolution resolution = adapter("").resolveValue(ValueRequest.cssVariable("--color-primary", null)).orElseThrow();

        assertThat(resolution).isEqualTo(new Resolution("vars.colorPrimary",
                List.of(new ImportSpec("./css-variables.stylex", "vars"))));
        assertThat(adapter("stylecast.adapter.css-variables.enabled = false")
                .resolveValue(ValueRequest.cssVariable("--color-primary", null))).isEmpty();
    }

    /**
     * Verifies that configured helper calls with one string argument resolve, and other calls do not.
     */
    @Test
    @Tag("unit")
    void testConfiguredCalls() {
        // Arrange
        ConfiguredStyleAdapter adapter = adapter(
                "stylecast.adapter.calls.color { object = colors, import-source = \"./colors.stylex\" }");
        ImportSpec colors = new ImportSpec("./colors.stylex", "colors");

        // Act
        Resolution resolved = adapter.resolveCall(
                new CallRequest("color", "color", List.of(new JsNode.StringLiteral("primary")))).orElseThrow();

        // Assert
        assertThat(resolved).isEqualTo(new Resolution("colors.primary", List.of(colors)));
        assertThat(adapter.resolveCall(new CallRequest("color", "color",
                List.of(new JsNode.Identifier("name"))))).isEmpty();
        assertThat(adapter.resolveCall(new CallRequest("space", "space",
                List.of(new JsNode.StringLiteral("sm"))))).isEmpty();
    }
}
