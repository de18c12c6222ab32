package org.stylecast.lowering.frontend.template;

import org.stylecast.lowering.ir.Slot;

import java.util.List;

/**
 * A template body split into CSS text with placeholders and the slots they stand for.
 *
 * @param rawCss The CSS text with every interpolation replaced by its placeholder.
 * @param slots  The slots in source order.
 */
public record StyledTemplate(String rawCss, List<Slot> slots) {
    public StyledTemplate {
        slots = List.copyOf(slots);
    }
}
