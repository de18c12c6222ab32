package org.stylecast.lowering.lower;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.condition.StyleKeyNaming;
import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.style.ImportSpec;
import org.stylecast.lowering.style.StyleValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The mutable lowering state of one styled component. Created when the component's
 * template is first seen, filled declaration by declaration and turned into a read-only
 * {@link LoweredComponent} by {@link #finish()}.
 * <p>
 * A declaration goes from open to bailed at most once and never back. Once bailed, no new
 * variant buckets are created and {@link #finish()} drops all variant data; static writes to
 * the base style are still accepted.
 */
public class StyledDecl {

    private static final Logger LOG = LoggerFactory.getLogger(StyledDecl.class);

    private enum State { OPEN, BAILED }

    private final String name;
    private final String target;
    private final String styleKey;
    private final Map<String, StyleValue> styleObj = new LinkedHashMap<>();
    private final Map<String, Map<String, StyleValue>> variantBuckets = new LinkedHashMap<>();
    private final Map<String, String> variantStyleKeys = new LinkedHashMap<>();
    private final Set<String> usedKeys = new HashSet<>();
    private final List<String> variantOrder = new ArrayList<>();
    private final Set<String> compoundWhens = new HashSet<>();
    private final List<CompoundVariant> compoundVariants = new ArrayList<>();
    private final List<StyleFnSpec> styleFnSpecs = new ArrayList<>();
    private final List<StyleValue.Expr> mixins = new ArrayList<>();
    private final Map<String, String> comments = new LinkedHashMap<>();
    private final Set<ImportSpec> imports = new LinkedHashSet<>();
    private final WarningCollector warnings = new WarningCollector();
    private State state = State.OPEN;

    /**
     * @param name   The component name.
     * @param target The styled target, or null.
     */
    public StyledDecl(String name, String target) {
        this.name = name;
        this.target = target;
        this.styleKey = StyleKeyNaming.styleKey(name);
        usedKeys.add(styleKey);
    }

    public String name() {
        return name;
    }

    public String styleKey() {
        return styleKey;
    }

    /**
     * @return The live base style map.
     */
    public Map<String, StyleValue> styleObj() {
        return styleObj;
    }

    public WarningCollector warnings() {
        return warnings;
    }

    public boolean isBailed() {
        return state == State.BAILED;
    }

    /**
     * Marks the component as bailed.
     * @param reason Why, for the log.
     */
    public void bail(String reason) {
        if (state == State.OPEN) {
            LOG.warn("Component {} bailed: {}", name, reason);
            state = State.BAILED;
        } else {
            LOG.debug("Component {} already bailed, further reason: {}", name, reason);
        }
    }

    /**
     * Returns the bucket for a condition, creating it on first use. The order of first use
     * is recorded for {@link VariantApplications#merge}.
     *
     * @param when   The "when" string.
     * @param suffix The preferred key suffix.
     * @return The bucket, or empty once bailed.
     */
    public Optional<Map<String, StyleValue>> bucket(String when, String suffix) {
        Optional<Map<String, StyleValue>> bucket = bucketWithoutOrder(when, suffix);
        if (bucket.isPresent() && !compoundWhens.contains(when) && !variantOrder.contains(when)) {
            variantOrder.add(when);
        }
        return bucket;
    }

    /**
     * Returns a bucket of a compound variant. Compound buckets are applied through
     * their {@link CompoundVariant} and take no part in the application order.
     */
    public Optional<Map<String, StyleValue>> compoundBucket(String when, String suffix) {
        Optional<Map<String, StyleValue>> bucket = bucketWithoutOrder(when, suffix);
        if (bucket.isPresent() && !variantOrder.contains(when)) {
            compoundWhens.add(when);
        }
        return bucket;
    }

    private Optional<Map<String, StyleValue>> bucketWithoutOrder(String when, String suffix) {
        if (isBailed()) {
            return Optional.empty();
        }
        Map<String, StyleValue> bucket = variantBuckets.get(when);
        if (bucket == null) {
            bucket = new LinkedHashMap<>();
            variantBuckets.put(when, bucket);
            variantStyleKeys.put(when, allocateKey(suffix));
        }
        return Optional.of(bucket);
    }

    /**
     * @param when A "when" string with a bucket.
     * @return Its style key, or null.
     */
    public String keyOf(String when) {
        return variantStyleKeys.get(when);
    }

    /**
     * Separates the buckets used so far from the ones used next, so that they are never
     * merged into one ternary.
     */
    public void markBoundary() {
        if (!variantOrder.isEmpty() && variantOrder.get(variantOrder.size() - 1) != null) {
            variantOrder.add(null);
        }
    }

    /**
     * Records a compound variant once per prop pair.
     */
    public void addCompoundVariant(CompoundVariant compound) {
        if (isBailed()) return;
        for (CompoundVariant existing : compoundVariants) {
            if (existing.outerProp().equals(compound.outerProp()) && existing.innerProp().equals(compound.innerProp())) {
                return;
            }
        }
        compoundVariants.add(compound);
    }

    /**
     * Adds a style function, or adds the property to an existing function for the same
     * parameter, prop, scope and {@code !important} flag.
     */
    public void addStyleFunction(String paramName, String originalPropName, String property,
                                 List<String> scope, StyleValue fallback, boolean important) {
        if (isBailed()) return;
        for (int i = 0; i < styleFnSpecs.size(); i++) {
            StyleFnSpec spec = styleFnSpecs.get(i);
            if (spec.paramName().equals(paramName) && spec.originalPropName().equals(originalPropName)
                    && spec.scope().equals(scope) && spec.important() == important) {
                if (!spec.properties().contains(property)) {
                    List<String> properties = new ArrayList<>(spec.properties());
                    properties.add(property);
                    styleFnSpecs.set(i, new StyleFnSpec(spec.styleKey(), paramName, originalPropName, properties,
                            scope, spec.fallback() != null ? spec.fallback() : fallback, important));
                }
                return;
            }
        }
        String key = allocateKey(StyleKeyNaming.toSuffixFromProp(paramName));
        styleFnSpecs.add(new StyleFnSpec(key, paramName, originalPropName, List.of(property), scope, fallback, important));
    }

    public void addMixin(StyleValue.Expr mixin) {
        mixins.add(mixin);
        addImports(mixin.imports());
    }

    public void addImports(Collection<ImportSpec> specs) {
        imports.addAll(specs);
    }

    /**
     * Attaches a comment to a style property; comments on the same property accumulate.
     */
    public void addComment(String property, String comment) {
        comments.merge(property, comment, (a, b) -> a + "\n" + b);
    }

    private String allocateKey(String suffix) {
        String base = styleKey + suffix;
        String key = base;
        int n = 2;
        while (usedKeys.contains(key)) {
            key = base + n++;
        }
        usedKeys.add(key);
        return key;
    }

    /**
     * Deep read-only copy; nested pseudo and at-rule maps are copied as well.
     */
    private static Map<String, StyleValue> frozen(Map<String, StyleValue> style) {
        Map<String, StyleValue> copy = new LinkedHashMap<>();
        style.forEach((key, value) -> copy.put(key,
                value instanceof StyleValue.Nested nested ? new StyleValue.Nested(frozen(nested.entries())) : value));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * @return The read-only result; variant data is empty if the component bailed.
     */
    public LoweredComponent finish() {
        boolean bailed = isBailed();
        Map<String, Map<String, StyleValue>> buckets = new LinkedHashMap<>();
        if (!bailed) {
            variantBuckets.forEach((when, bucket) -> buckets.put(when, frozen(bucket)));
        }
        List<String> order = new ArrayList<>(variantOrder);
        return new LoweredComponent(
                name,
                target,
                styleKey,
                frozen(styleObj),
                Collections.unmodifiableMap(buckets),
                bailed ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variantStyleKeys)),
                bailed ? List.of() : VariantApplications.merge(order, variantBuckets, variantStyleKeys),
                bailed ? List.of() : compoundVariants,
                bailed ? List.of() : styleFnSpecs,
                mixins,
                Collections.unmodifiableMap(comments),
                new ArrayList<>(imports),
                warnings.getWarnings(),
                bailed);
    }
}
