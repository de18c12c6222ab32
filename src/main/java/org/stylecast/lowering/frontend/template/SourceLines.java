package org.stylecast.lowering.frontend.template;

import org.stylecast.lowering.api.SourceLocation;

/**
 * Offset to line/column conversion.
 */
final class SourceLines {

    private SourceLines() {}

    /**
     * @param text   The text.
     * @param offset An offset into the text.
     * @param origin Location of the text's first character.
     * @return The location of the offset.
     */
    static SourceLocation locate(String text, int offset, SourceLocation origin) {
        int line = origin.line();
        int column = origin.column();
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new SourceLocation(line, column);
    }
}
