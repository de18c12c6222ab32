package org.stylecast.lowering.lower;

/**
 * The buckets of {@code outer ? A : inner ? B : C}: {@code outer ? styles[outerKey]
 * : inner ? styles[innerTrueKey] : styles[innerFalseKey]}.
 */
public record CompoundVariant(
        String outerProp,
        String innerProp,
        String outerKey,
        String innerTrueKey,
        String innerFalseKey
) {
}
