package org.stylecast.lowering.ir;

/**
 * A declaration of the IR.
 *
 * @param property            The property as written, empty for a standalone block slot.
 * @param value               The parsed value.
 * @param important           Whether {@code !important} was present.
 * @param rawValue            The value text as written (including {@code !important}).
 * @param leadingComment      Comment preceding the declaration, or null.
 * @param trailingLineComment Comment on the same line after the declaration, or null.
 */
public record CssDeclaration(
        String property,
        CssValue value,
        boolean important,
        String rawValue,
        String leadingComment,
        String trailingLineComment
) {

    /**
     * Creates a standalone block declaration for one slot.
     * @param slot The slot.
     * @return The declaration.
     */
    public static CssDeclaration standalone(Slot slot) {
        return new CssDeclaration("", new CssValue.Interpolated(java.util.List.of(new CssValue.SlotRef(slot.id()))),
                false, slot.placeholder(), null, null);
    }

    /**
     * @return {@code true} if this declaration stands for a slot expanding to a whole block.
     */
    public boolean isStandaloneBlock() {
        return property.isEmpty();
    }

    public CssDeclaration withLeadingComment(String comment) {
        return new CssDeclaration(property, value, important, rawValue, comment, trailingLineComment);
    }

    public CssDeclaration withTrailingLineComment(String comment) {
        return new CssDeclaration(property, value, important, rawValue, leadingComment, comment);
    }
}
