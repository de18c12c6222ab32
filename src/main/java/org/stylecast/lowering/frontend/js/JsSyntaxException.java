package org.stylecast.lowering.frontend.js;

/**
 * Signals source outside the supported expression subset. Internal to the
 * frontend: {@link JsParser#tryParse(String)} turns it into an empty result.
 */
public class JsSyntaxException extends RuntimeException {

    private final int offset;

    /**
     * @param message Description of the problem.
     * @param offset  Offset in the parsed source where the problem was detected.
     */
    public JsSyntaxException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
