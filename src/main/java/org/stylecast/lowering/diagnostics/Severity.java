package org.stylecast.lowering.diagnostics;

/**
 * Severity of a lowering {@link Warning}.
 */
public enum Severity {
    /** The component was not (fully) lowered but the input was understood. */
    WARNING,
    /** The engine received input it could not make sense of. */
    ERROR;

    /**
     * @return The lower-case id used in serialized output.
     */
    public String id() {
        return name().toLowerCase();
    }
}
