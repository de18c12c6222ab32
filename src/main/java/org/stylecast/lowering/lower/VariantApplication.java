package org.stylecast.lowering.lower;

/**
 * How the emitter applies variant buckets, in style order.
 */
public sealed interface VariantApplication {

    /** {@code when && styles.styleKey}. */
    record Guarded(String when, String styleKey) implements VariantApplication {}

    /** {@code when ? styles.trueKey : styles.falseKey}. */
    record Ternary(String when, String trueKey, String falseKey) implements VariantApplication {}
}
