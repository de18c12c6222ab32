package org.stylecast.lowering.condition;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StyleKeyNaming}. Suffixes are part of the emitted style keys,
 * so they must be readable and deterministic.
 */
public class StyleKeyNamingTest {

    @Test
    @Tag("unit")
    void testBooleanPropSuffixes() {
        assertThat(StyleKeyNaming.toSuffixFromProp("$primary")).isEqualTo("Primary");
        assertThat(StyleKeyNaming.toSuffixFromProp("$isActive")).isEqualTo("Active");
        assertThat(StyleKeyNaming.toSuffixFromProp("!$primary")).isEqualTo("NotPrimary");
        assertThat(StyleKeyNaming.toSuffixFromProp("config.enabled")).isEqualTo("ConfigEnabled");
    }

    @Test
    @Tag("unit")
    void testComparisonSuffixes() {
        assertThat(StyleKeyNaming.toSuffixFromProp("$size === \"large\"")).isEqualTo("SizeLarge");
        assertThat(StyleKeyNaming.toSuffixFromProp("$size !== 'small'")).isEqualTo("SizeNotSmall");
        assertThat(StyleKeyNaming.toSuffixFromProp("user.role === Role.admin")).isEqualTo("UserRoleAdmin");
    }

    @Test
    @Tag("unit")
    void testCompositeConditions() {
        assertThat(StyleKeyNaming.toSuffixFromProp("$a && $b")).isEqualTo("AB");
        assertThat(StyleKeyNaming.toSuffixFromProp("$a || $b")).isEqualTo("AOrB");
        assertThat(StyleKeyNaming.suffix(new Condition.And(List.of(
                new Condition.Not(new Condition.Prop("$open")), new Condition.Prop("$compact")))))
                .isEqualTo("NotOpenCompact");
    }

    /**
     * Verifies the fallback for conditions that have no readable name.
     */
    @Test
    @Tag("unit")
    void testUnnamedConditionsFallBack() {
        assertThat(StyleKeyNaming.toSuffixFromProp("compute($a)")).isEqualTo(StyleKeyNaming.COND_TRUTHY);
        assertThat(StyleKeyNaming.toSuffixFromProp("$a && compute($b)")).isEqualTo(StyleKeyNaming.COND_TRUTHY);
        assertThat(StyleKeyNaming.toSuffixFromProp("$")).isEqualTo("Variant");
    }

    @Test
    @Tag("unit")
    void testCssVariableSuffix() {
        assertThat(StyleKeyNaming.toSuffixFromProp("--brand-color")).isEqualTo("BrandColor");
    }

    @Test
    @Tag("unit")
    void testStyleKey() {
        assertThat(StyleKeyNaming.styleKey("PrimaryButton")).isEqualTo("primaryButton");
        assertThat(StyleKeyNaming.styleKey("")).isEqualTo("root");
    }

    @Test
    @Tag("unit")
    void testSuffixIsDeterministic() {
        String first = StyleKeyNaming.toSuffixFromProp("$variant === \"ghost\"");
        String second = StyleKeyNaming.toSuffixFromProp("$variant === \"ghost\"");

        assertThat(first).isEqualTo(second).isEqualTo("VariantGhost");
    }
}
