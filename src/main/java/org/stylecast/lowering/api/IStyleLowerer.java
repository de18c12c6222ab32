package org.stylecast.lowering.api;

import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.frontend.template.FileScope;
import org.stylecast.lowering.lower.LoweredComponent;

/**
 * Interface for the lowering engine. Turns runtime CSS-in-JS templates into
 * statically enumerable style representations.
 */
public interface IStyleLowerer {

    /**
     * Lowers every styled component found in a source file.
     *
     * @param source   The complete source text.
     * @param fileName The logical file name, used in warnings and logs.
     * @return The lowered components together with all collected warnings.
     * @throws LoweringException if the file cannot be scanned.
     */
    LoweredFile lowerFile(String source, String fileName) throws LoweringException;

    /**
     * Lowers a single template body (the text between the backticks).
     *
     * @param componentName The name of the styled component.
     * @param templateBody  The raw template literal body including {@code ${...}} interpolations.
     * @param scope         File-level facts (keyframes, css helpers, components).
     * @param warnings      Collector receiving the warnings of this component.
     * @return The lowered component.
     */
    LoweredComponent lowerTemplate(String componentName, String templateBody, FileScope scope, WarningCollector warnings);
}
