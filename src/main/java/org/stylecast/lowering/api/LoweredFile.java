package org.stylecast.lowering.api;

import org.stylecast.lowering.diagnostics.Warning;
import org.stylecast.lowering.lower.LoweredComponent;

import java.util.List;

/**
 * The result of lowering one source file.
 *
 * @param fileName   The logical file name.
 * @param components The lowered components in source order.
 * @param warnings   All warnings collected for the file, in the order they were reported.
 */
public record LoweredFile(String fileName, List<LoweredComponent> components, List<Warning> warnings) {

    public LoweredFile {
        components = List.copyOf(components);
        warnings = List.copyOf(warnings);
    }

    /**
     * @return The number of components that fell back to their unlowered form.
     */
    public long bailedCount() {
        return components.stream().filter(LoweredComponent::bailed).count();
    }
}
