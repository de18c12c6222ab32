package org.stylecast.lowering.adapter;

/**
 * A value the adapter is asked to resolve.
 *
 * @param kind     What is being resolved.
 * @param path     The theme path ({@code colors.primary}) or variable name ({@code --color-primary}).
 * @param fallback The fallback given in {@code var(--x, fallback)}, or null.
 */
public record ValueRequest(Kind kind, String path, String fallback) {

    public enum Kind {
        THEME,
        CSS_VARIABLE
    }

    public static ValueRequest theme(String path) {
        return new ValueRequest(Kind.THEME, path, null);
    }

    public static ValueRequest cssVariable(String name, String fallback) {
        return new ValueRequest(Kind.CSS_VARIABLE, name, fallback);
    }
}
