package org.stylecast.lowering.diagnostics;

/**
 * The closed set of warning categories. The ids are stable and used in serialized output.
 */
public enum WarningCategory {
    /** An interpolation matched none of the supported patterns. */
    DYNAMIC_CSS("dynamic-css", Severity.WARNING),
    /** The adapter returned an expression that does not parse. */
    UNPARSEABLE_EXPRESSION("unparseable-expression", Severity.ERROR),
    /** Conditional branches resolve to different CSS properties. */
    HETEROGENEOUS_BRANCHES("heterogeneous-branches", Severity.WARNING),
    /** A component reference used as a selector. */
    COMPONENT_SELECTOR("component-selector", Severity.WARNING),
    /** A selector without a static equivalent. */
    UNSUPPORTED_SELECTOR("unsupported-selector", Severity.WARNING),
    /** The source of an interpolation could not be parsed. */
    PARSE_ERROR("parse-error", Severity.WARNING);

    private final String id;
    private final Severity defaultSeverity;

    WarningCategory(String id, Severity defaultSeverity) {
        this.id = id;
        this.defaultSeverity = defaultSeverity;
    }

    public String id() {
        return id;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
