package org.stylecast.lowering.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * The value of a declaration: either plain text or text interleaved with slots.
 */
public sealed interface CssValue {

    record Static(String text) implements CssValue {}

    /** A value with at least one slot reference; adjacent text parts are coalesced. */
    record Interpolated(List<Part> parts) implements CssValue {
        public Interpolated {
            parts = List.copyOf(parts);
            if (parts.stream().noneMatch(p -> p instanceof SlotRef)) {
                throw new IllegalArgumentException("An interpolated value needs at least one slot");
            }
        }

        /**
         * @return {@code true} if the value consists of exactly one slot and nothing else.
         */
        public boolean isSingleSlot() {
            return parts.size() == 1;
        }
    }

    sealed interface Part permits Text, SlotRef {}

    record Text(String text) implements Part {}

    record SlotRef(int slotId) implements Part {}

    /**
     * Builds a value from parts, coalescing adjacent text.
     * @param parts The parts in order.
     * @return A {@link Static} value if no slot is referenced, otherwise {@link Interpolated}.
     */
    static CssValue of(List<Part> parts) {
        List<Part> coalesced = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        boolean hasSlot = false;
        for (Part part : parts) {
            if (part instanceof Text t) {
                text.append(t.text());
            } else {
                if (text.length() > 0) {
                    coalesced.add(new Text(text.toString()));
                    text.setLength(0);
                }
                coalesced.add(part);
                hasSlot = true;
            }
        }
        if (!hasSlot) {
            return new Static(text.toString());
        }
        if (text.length() > 0) {
            coalesced.add(new Text(text.toString()));
        }
        return new Interpolated(coalesced);
    }

    /**
     * @return Ids of all referenced slots in order.
     */
    default List<Integer> slotIds() {
        List<Integer> ids = new ArrayList<>();
        if (this instanceof Interpolated i) {
            for (Part part : i.parts()) {
                if (part instanceof SlotRef ref) ids.add(ref.slotId());
            }
        }
        return ids;
    }
}
