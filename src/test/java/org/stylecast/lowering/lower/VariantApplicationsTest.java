package org.stylecast.lowering.lower;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stylecast.lowering.style.StyleValue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link VariantApplications#merge}.
 */
public class VariantApplicationsTest {

    private static final Map<String, StyleValue> COLOR = Map.of("color", new StyleValue.Str("red"));
    private static final Map<String, StyleValue> OPACITY = Map.of("opacity", new StyleValue.Num("0"));

    @Test
    @Tag("unit")
    void testAdjacentComplementsMergeIntoTernary() {
        List<VariantApplication> result = VariantApplications.merge(
                List.of("!$on", "$on"),
                Map.of("$on", COLOR, "!$on", COLOR),
                Map.of("$on", "boxOn", "!$on", "boxNotOn"));

        assertThat(result).containsExactly(new VariantApplication.Ternary("$on", "boxOn", "boxNotOn"));
    }

    /**
     * Verifies that a separator between two complementary buckets keeps them apart.
     */
    @Test
    @Tag("unit")
    void testSeparatorPreventsMerge() {
        // Act
        List<VariantApplication> result = VariantApplications.merge(
                Arrays.asList("$on", null, "!$on"),
                Map.of("$on", COLOR, "!$on", COLOR),
                Map.of("$on", "boxOn", "!$on", "boxNotOn"));

        // Assert
        assertThat(result).containsExactly(
                new VariantApplication.Guarded("$on", "boxOn"),
                new VariantApplication.Guarded("!$on", "boxNotOn"));
    }

    @Test
    @Tag("unit")
    void testComplementsWithoutSharedPropertyStayGuarded() {
        List<VariantApplication> result = VariantApplications.merge(
                List.of("$on", "!$on"),
                Map.of("$on", COLOR, "!$on", OPACITY),
                Map.of("$on", "boxOn", "!$on", "boxNotOn"));

        assertThat(result).containsExactly(
                new VariantApplication.Guarded("$on", "boxOn"),
                new VariantApplication.Guarded("!$on", "boxNotOn"));
    }

    @Test
    @Tag("unit")
    void testUnrelatedConditionsStayGuardedInOrder() {
        List<VariantApplication> result = VariantApplications.merge(
                Arrays.asList(null, "$a", "$b"),
                Map.of("$a", COLOR, "$b", COLOR),
                Map.of("$a", "boxA", "$b", "boxB"));

        assertThat(result).containsExactly(
                new VariantApplication.Guarded("$a", "boxA"),
                new VariantApplication.Guarded("$b", "boxB"));
    }
}
