package org.stylecast.lowering.diagnostics;

import org.stylecast.lowering.api.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Append-only collector for the warnings of one file.
 * <p>
 * Decouples warning reporting from the lowering logic, so that a bail in one
 * component never interrupts the processing of its siblings.
 */
public class WarningCollector {

    private final List<Warning> warnings = new ArrayList<>();

    /**
     * Reports a warning with the default severity of its category.
     *
     * @param category The category.
     * @param message  The message.
     * @param location The location, may be null.
     * @param context  Extra context, may be null.
     * @return The recorded warning.
     */
    public Warning report(WarningCategory category, String message, SourceLocation location, Map<String, String> context) {
        Warning warning = new Warning(category.defaultSeverity(), category, message, location, context);
        warnings.add(warning);
        return warning;
    }

    /**
     * Adds an already constructed warning.
     * @param warning The warning.
     */
    public void add(Warning warning) {
        warnings.add(warning);
    }

    /**
     * Adds all given warnings in order.
     * @param others The warnings.
     */
    public void addAll(List<Warning> others) {
        warnings.addAll(others);
    }

    /**
     * @return {@code true} if at least one warning has severity {@link Severity#ERROR}.
     */
    public boolean hasErrors() {
        return warnings.stream().anyMatch(w -> w.severity() == Severity.ERROR);
    }

    /**
     * @return An unmodifiable view of all warnings.
     */
    public List<Warning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * @return All warnings formatted one per line.
     */
    public String summary() {
        return warnings.stream()
                .map(Warning::toString)
                .collect(Collectors.joining("\n"));
    }
}
