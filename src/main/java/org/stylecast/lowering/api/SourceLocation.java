package org.stylecast.lowering.api;

/**
 * A position inside a source file.
 *
 * @param line   1-based line number.
 * @param column 1-based column number.
 */
public record SourceLocation(int line, int column) {

    /** Location used when nothing better is known. */
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
