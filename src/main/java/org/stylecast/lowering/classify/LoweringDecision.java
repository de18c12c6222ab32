package org.stylecast.lowering.classify;

import org.stylecast.lowering.condition.Condition;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.style.ImportSpec;
import org.stylecast.lowering.style.StyleValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How one slot is lowered. Exactly one variant applies per decision.
 */
public sealed interface LoweringDecision {

    /** The slot is replaced by a static expression. */
    record Convert(String expr, List<ImportSpec> imports) implements LoweringDecision {
        public Convert {
            imports = List.copyOf(imports);
        }
    }

    /** A single fragment gated on a boolean prop. */
    record Variant(String propName, Map<String, StyleValue> style) implements LoweringDecision {
        public Variant {
            style = copy(style);
        }
    }

    /** Fragments gated on conditions. */
    record SplitVariants(List<Branch> branches) implements LoweringDecision {
        public SplitVariants {
            branches = List.copyOf(branches);
        }
    }

    /**
     * One branch of {@link SplitVariants}.
     *
     * @param nameHint {@code truthy}, {@code falsy}, {@code default}, {@code match} or a literal hint.
     * @param when     The condition under which the branch applies.
     * @param style    The fragment, possibly empty.
     */
    record Branch(String nameHint, Condition when, Map<String, StyleValue> style) {
        public Branch {
            style = copy(style);
        }
    }

    /** {@code outer ? A : inner ? B : C} over two different props. */
    record SplitMultiPropVariants(
            String outerProp,
            String innerProp,
            Map<String, StyleValue> outerTruthy,
            Map<String, StyleValue> innerTruthy,
            Map<String, StyleValue> innerFalsy
    ) implements LoweringDecision {
        public SplitMultiPropVariants {
            outerTruthy = copy(outerTruthy);
            innerTruthy = copy(innerTruthy);
            innerFalsy = copy(innerFalsy);
        }
    }

    /** A style function parameterized at runtime; {@code fallback} may be null. */
    record DynamicStyleFunction(String paramName, StyleValue fallback, String originalPropName) implements LoweringDecision {}

    /** An explicit refusal; {@code reason} is used verbatim in the warning. */
    record Bail(String reason, WarningCategory category) implements LoweringDecision {
        public Bail(String reason) {
            this(reason, WarningCategory.DYNAMIC_CSS);
        }
    }

    private static Map<String, StyleValue> copy(Map<String, StyleValue> style) {
        return java.util.Collections.unmodifiableMap(new LinkedHashMap<>(style));
    }
}
