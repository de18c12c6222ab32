package org.stylecast.lowering.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link LoweringOptions}.
 */
public class LoweringOptionsTest {

    @Test
    @Tag("unit")
    void testDefaultsComeFromReferenceConf() {
        LoweringOptions options = LoweringOptions.defaults();

        assertThat(options.placeholderPrefix()).isEqualTo("__SC_EXPR_");
        assertThat(options.recoverDroppedPlaceholders()).isTrue();
        assertThat(options.themeKey()).isEqualTo("theme");
        assertThat(options.placeholders().placeholder(3)).isEqualTo("__SC_EXPR_3__");
    }

    @Test
    @Tag("unit")
    void testFromConfigReadsOverrides() {
        LoweringOptions options = LoweringOptions.fromConfig(ConfigFactory.parseString(
                "stylecast.lowering { placeholder-prefix = \"__X_\", recover-dropped-placeholders = false, theme-key = t }"));

        assertThat(options).isEqualTo(new LoweringOptions("__X_", false, "t"));
    }

    @Test
    @Tag("unit")
    void testBlankValuesAreRejected() {
        assertThatThrownBy(() -> new LoweringOptions(" ", true, "theme"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("placeholder-prefix");
        assertThatThrownBy(() -> new LoweringOptions("__SC_EXPR_", true, ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("theme-key");
    }
}
