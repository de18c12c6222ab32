package org.stylecast.lowering.frontend.js;

/**
 * A single token produced by the {@link JsLexer}.
 *
 * @param type   The token type.
 * @param text   The exact source text.
 * @param value  The processed value (unescaped string, template parts), or null.
 * @param offset Offset of the first character within the lexed source.
 */
public record JsToken(JsTokenType type, String text, Object value, int offset) {
}
