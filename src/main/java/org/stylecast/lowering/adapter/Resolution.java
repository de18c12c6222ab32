package org.stylecast.lowering.adapter;

import org.stylecast.lowering.style.ImportSpec;

import java.util.List;

/**
 * An adapter answer: an expression to emit and the imports it needs.
 *
 * @param expr    Expression source.
 * @param imports Required imports.
 */
public record Resolution(String expr, List<ImportSpec> imports) {
    public Resolution {
        imports = List.copyOf(imports);
    }
}
