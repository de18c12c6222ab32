package org.stylecast.lowering.lower;

import org.stylecast.lowering.condition.Conditions;
import org.stylecast.lowering.style.StyleValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds the ordered variant applications of a component.
 */
public final class VariantApplications {

    private VariantApplications() {}

    /**
     * Turns bucket order into applications. Two buckets are merged into one ternary only if
     * they are adjacent in {@code order}, their conditions are exact negations of each other
     * and they set at least one common property. A null entry in {@code order} separates
     * buckets that must not be merged.
     *
     * @param order   "when" strings in order of first use, with null separators.
     * @param buckets Bucket contents by "when" string.
     * @param keys    Style keys by "when" string.
     * @return The applications.
     */
    public static List<VariantApplication> merge(List<String> order, Map<String, Map<String, StyleValue>> buckets,
                                                 Map<String, String> keys) {
        List<VariantApplication> result = new ArrayList<>();
        int i = 0;
        while (i < order.size()) {
            String when = order.get(i);
            if (when == null) {
                i++;
                continue;
            }
            String next = i + 1 < order.size() ? order.get(i + 1) : null;
            if (next != null && Conditions.isComplementary(when, next) && shareProperty(buckets.get(when), buckets.get(next))) {
                String positive = Conditions.isNegation(next, when) ? when : next;
                String negative = positive.equals(when) ? next : when;
                result.add(new VariantApplication.Ternary(positive, keys.get(positive), keys.get(negative)));
                i += 2;
            } else {
                result.add(new VariantApplication.Guarded(when, keys.get(when)));
                i++;
            }
        }
        return result;
    }

    private static boolean shareProperty(Map<String, StyleValue> a, Map<String, StyleValue> b) {
        if (a == null || b == null) {
            return false;
        }
        return !Collections.disjoint(a.keySet(), b.keySet());
    }
}
