package org.stylecast.lowering.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stylecast.lowering.api.LoweredFile;
import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.diagnostics.Warning;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.lower.CompoundVariant;
import org.stylecast.lowering.lower.LoweredComponent;
import org.stylecast.lowering.lower.StyleFnSpec;
import org.stylecast.lowering.lower.VariantApplication;
import org.stylecast.lowering.style.ImportSpec;
import org.stylecast.lowering.style.StyleValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LoweredResultWriter}.
 */
public class LoweredResultWriterTest {

    private final LoweredResultWriter writer = new LoweredResultWriter();

    private static LoweredComponent button() {
        ImportSpec tokens = new ImportSpec("./tokens.stylex", "themeVars");
        Map<String, StyleValue> color = new LinkedHashMap<>();
        color.put("default", StyleValue.NULL);
        color.put(":hover", new StyleValue.Str("blue"));
        Map<String, StyleValue> styleObj = new LinkedHashMap<>();
        styleObj.put("opacity", new StyleValue.Num("0.5"));
        styleObj.put("color", new StyleValue.Nested(color));
        styleObj.put("borderColor", new StyleValue.Expr("themeVars.primary", List.of(tokens)));

        Map<String, Map<String, StyleValue>> buckets = new LinkedHashMap<>();
        buckets.put("$primary", Map.of("color", new StyleValue.Str("white")));
        buckets.put("!$primary", Map.of("color", new StyleValue.Str("black")));
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("$primary", "buttonPrimary");
        keys.put("!$primary", "buttonNotPrimary");

        return new LoweredComponent("Button", "button", "button", styleObj, buckets, keys,
                List.of(new VariantApplication.Ternary("$primary", "buttonPrimary", "buttonNotPrimary"),
                        new VariantApplication.Guarded("$on", "buttonOn")),
                List.of(new CompoundVariant("$a", "$b", "buttonA", "buttonBTrue", "buttonBFalse")),
                List.of(new StyleFnSpec("buttonSize", "size", "$size", List.of("width", "height"), List.of(), new StyleValue.Str("1rem"), false)),
                List.of(new StyleValue.Expr("truncate", List.of())),
                Map.of("opacity", "faded"),
                List.of(tokens),
                List.of(),
                false);
    }

    /**
     * Verifies the JSON layout of a lowered component, including every kind of style value.
     */
    @Test
    @Tag("unit")
    void testComponentJson() {
        // Act
        JsonNode json = writer.component(button());

        // Assert
        assertThat(json.get("name").asText()).isEqualTo("Button");
        assertThat(json.get("target").asText()).isEqualTo("button");
        assertThat(json.get("bailed").asBoolean()).isFalse();
        JsonNode styleObj = json.get("styleObj");
        assertThat(styleObj.get("opacity").isNumber()).isTrue();
        assertThat(styleObj.get("opacity").decimalValue()).isEqualByComparingTo("0.5");
        assertThat(styleObj.get("color").get("default").isNull()).isTrue();
        assertThat(styleObj.get("color").get(":hover").asText()).isEqualTo("blue");
        assertThat(styleObj.get("borderColor").get("expr").asText()).isEqualTo("themeVars.primary");
        assertThat(styleObj.get("borderColor").get("imports").get(0).get("name").asText()).isEqualTo("themeVars");

        assertThat(json.get("variantBuckets").get("!$primary").get("color").asText()).isEqualTo("black");
        assertThat(json.get("variantStyleKeys").get("$primary").asText()).isEqualTo("buttonPrimary");
        JsonNode applications = json.get("variantApplications");
        assertThat(applications.get(0).get("kind").asText()).isEqualTo("ternary");
        assertThat(applications.get(0).get("falseKey").asText()).isEqualTo("buttonNotPrimary");
        assertThat(applications.get(1).get("kind").asText()).isEqualTo("guarded");
        assertThat(applications.get(1).get("styleKey").asText()).isEqualTo("buttonOn");
        assertThat(json.get("compoundVariants").get(0).get("innerFalseKey").asText()).isEqualTo("buttonBFalse");

        JsonNode fn = json.get("styleFnSpecs").get(0);
        assertThat(fn.get("paramName").asText()).isEqualTo("size");
        assertThat(fn.get("properties")).hasSize(2);
        assertThat(fn.get("scope")).isEmpty();
        assertThat(fn.get("fallback").asText()).isEqualTo("1rem");
        assertThat(fn.has("important")).isFalse();
        assertThat(json.get("mixins").get(0).get("expr").asText()).isEqualTo("truncate");
        assertThat(json.get("mixins").get(0).has("imports")).isFalse();
        assertThat(json.get("comments").get("opacity").asText()).isEqualTo("faded");
        assertThat(json.get("imports").get(0).get("source").asText()).isEqualTo("./tokens.stylex");
    }

    @Test
    @Tag("unit")
    void testFileJsonWithWarnings() throws Exception {
        Warning warning = new Warning(WarningCategory.UNPARSEABLE_EXPRESSION.defaultSeverity(),
                WarningCategory.UNPARSEABLE_EXPRESSION, "cannot parse", new SourceLocation(3, 7), Map.of("component", "Button"));
        LoweredFile file = new LoweredFile("Button.tsx", List.of(button()), List.of(warning));

        JsonNode json = new ObjectMapper().readTree(writer.write(file));

        assertThat(json.get("file").asText()).isEqualTo("Button.tsx");
        assertThat(json.get("components")).hasSize(1);
        JsonNode written = json.get("warnings").get(0);
        assertThat(written.get("severity").asText()).isEqualTo("error");
        assertThat(written.get("category").asText()).isEqualTo("unparseable-expression");
        assertThat(written.get("line").asInt()).isEqualTo(3);
        assertThat(written.get("column").asInt()).isEqualTo(7);
        assertThat(written.get("context").get("component").asText()).isEqualTo("Button");
    }

    @Test
    @Tag("unit")
    void testTargetOmittedForTemplates() {
        LoweredComponent base = button();
        LoweredComponent template = new LoweredComponent("Mixin", null, "mixin", Map.of(), Map.of(), Map.of(),
                List.of(), List.of(), List.of(), List.of(), Map.of(), List.of(), List.of(), true);

        assertThat(writer.component(template).has("target")).isFalse();
        assertThat(writer.component(template).get("bailed").asBoolean()).isTrue();
        assertThat(writer.component(base).has("target")).isTrue();
    }
}
