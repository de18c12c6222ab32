package org.stylecast.lowering.lower;

import org.stylecast.lowering.diagnostics.Warning;
import org.stylecast.lowering.style.ImportSpec;
import org.stylecast.lowering.style.StyleValue;

import java.util.List;
import java.util.Map;

/**
 * The lowered form of one styled component, handed to the code generator.
 * For a bailed component all variant data is empty and the emitter keeps the original source.
 *
 * @param name                The component name.
 * @param target              The styled target ({@code button}, {@code Link}), or null if unknown.
 * @param styleKey            Key of the base style.
 * @param styleObj            The base style, including nested pseudo and at-rule maps.
 * @param variantBuckets      Conditional fragments by "when" string.
 * @param variantStyleKeys    Generated style keys by "when" string.
 * @param variantApplications The order in which buckets are applied.
 * @param compoundVariants    Two-prop nested ternaries.
 * @param styleFnSpecs        Runtime style functions.
 * @param mixins              Expressions spread into the base style ({@code css} helpers, calls).
 * @param comments            Comments attached to style properties.
 * @param imports             Imports required by expressions in this component.
 * @param warnings            Warnings reported while lowering this component.
 * @param bailed              Whether the component could not be lowered.
 */
public record LoweredComponent(
        String name,
        String target,
        String styleKey,
        Map<String, StyleValue> styleObj,
        Map<String, Map<String, StyleValue>> variantBuckets,
        Map<String, String> variantStyleKeys,
        List<VariantApplication> variantApplications,
        List<CompoundVariant> compoundVariants,
        List<StyleFnSpec> styleFnSpecs,
        List<StyleValue.Expr> mixins,
        Map<String, String> comments,
        List<ImportSpec> imports,
        List<Warning> warnings,
        boolean bailed
) {
    public LoweredComponent {
        variantApplications = List.copyOf(variantApplications);
        compoundVariants = List.copyOf(compoundVariants);
        styleFnSpecs = List.copyOf(styleFnSpecs);
        mixins = List.copyOf(mixins);
        imports = List.copyOf(imports);
        warnings = List.copyOf(warnings);
    }

    /**
     * @param when A "when" string.
     * @return The bucket for the condition, or null.
     */
    public Map<String, StyleValue> bucket(String when) {
        return variantBuckets.get(when);
    }
}
