package org.stylecast.lowering.diagnostics;

import org.stylecast.lowering.api.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single lowering warning. Warnings are data: they are collected, never thrown.
 *
 * @param severity The severity.
 * @param category The category.
 * @param message  Human-readable message, for bails the decision's reason verbatim.
 * @param location Where the problem occurred, {@link SourceLocation#UNKNOWN} if not known.
 * @param context  Additional key/value context (component, property, selector).
 */
public record Warning(
        Severity severity,
        WarningCategory category,
        String message,
        SourceLocation location,
        Map<String, String> context
) {
    public Warning {
        location = location == null ? SourceLocation.UNKNOWN : location;
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public String toString() {
        return String.format("[%s] %s %s: %s", severity, category.id(), location, message);
    }
}
