package org.stylecast.lowering.css;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PropertyNamesTest {

    @Test
    @Tag("unit")
    void testKebabCaseBecomesCamelCase() {
        assertThat(PropertyNames.normalize("background-color")).isEqualTo("backgroundColor");
        assertThat(PropertyNames.normalize("  z-index ")).isEqualTo("zIndex");
        assertThat(PropertyNames.normalize("color")).isEqualTo("color");
    }

    @Test
    @Tag("unit")
    void testVendorPrefixes() {
        assertThat(PropertyNames.normalize("-webkit-line-clamp")).isEqualTo("webkitLineClamp");
        assertThat(PropertyNames.normalize("-moz-appearance")).isEqualTo("mozAppearance");
        assertThat(PropertyNames.normalize("-ms-overflow-style")).isEqualTo("msOverflowStyle");
    }

    @Test
    @Tag("unit")
    void testCustomPropertiesAreKept() {
        assertThat(PropertyNames.normalize("--brand-color")).isEqualTo("--brand-color");
    }
}
