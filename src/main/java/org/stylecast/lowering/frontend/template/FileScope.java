package org.stylecast.lowering.frontend.template;

import java.util.Map;
import java.util.Set;

/**
 * File-level facts the classifier consults.
 *
 * @param keyframes      Names bound to {@code keyframes} templates.
 * @param cssHelpers     {@code css} templates by name.
 * @param components     Names of styled components declared in the file.
 * @param ternaryHelpers Ternary-returning helpers by name.
 */
public record FileScope(
        Set<String> keyframes,
        Map<String, CssHelper> cssHelpers,
        Set<String> components,
        Map<String, TernaryHelper> ternaryHelpers
) {
    public FileScope {
        keyframes = Set.copyOf(keyframes);
        cssHelpers = Map.copyOf(cssHelpers);
        components = Set.copyOf(components);
        ternaryHelpers = Map.copyOf(ternaryHelpers);
    }

    public static FileScope empty() {
        return new FileScope(Set.of(), Map.of(), Set.of(), Map.of());
    }

    public boolean isKeyframes(String name) {
        return keyframes.contains(name);
    }

    public boolean isComponent(String name) {
        return components.contains(name);
    }

    public boolean isCssHelper(String name) {
        return cssHelpers.containsKey(name);
    }
}
