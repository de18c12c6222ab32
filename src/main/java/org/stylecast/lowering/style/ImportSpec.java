package org.stylecast.lowering.style;

/**
 * A named import an expression depends on: {@code import { name } from "source"}.
 *
 * @param source The module specifier.
 * @param name   The imported binding.
 */
public record ImportSpec(String source, String name) {
}
