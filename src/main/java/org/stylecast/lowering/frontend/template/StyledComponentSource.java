package org.stylecast.lowering.frontend.template;

import org.stylecast.lowering.api.SourceLocation;

/**
 * A styled component declaration found in a file.
 *
 * @param name     The component binding, e.g. {@code Button}.
 * @param target   The styled tag or component, e.g. {@code button} or {@code Link}.
 * @param body     The template body between the backticks.
 * @param location Location of the first body character.
 */
public record StyledComponentSource(String name, String target, String body, SourceLocation location) {
}
