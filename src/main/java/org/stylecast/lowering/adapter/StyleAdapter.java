package org.stylecast.lowering.adapter;

import java.util.Optional;

/**
 * The boundary through which the engine asks for external policy: how theme paths,
 * CSS variables and helper calls translate into static expressions.
 * <p>
 * An empty result means "does not apply" and is never treated as an error.
 */
public interface StyleAdapter {

    /**
     * Resolves a theme path or CSS variable.
     * @param request The request.
     * @return The resolution, or empty to decline.
     */
    Optional<Resolution> resolveValue(ValueRequest request);

    /**
     * Resolves a helper call.
     * @param request The request.
     * @return The resolution, or empty to decline.
     */
    Optional<Resolution> resolveCall(CallRequest request);
}
