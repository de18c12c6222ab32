package org.stylecast.lowering.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.stylecast.lowering.ir.Placeholders;

/**
 * Options of the lowering engine.
 *
 * @param placeholderPrefix          Prefix of slot placeholders.
 * @param recoverDroppedPlaceholders Whether the IR builder runs its recovery pass.
 * @param themeKey                   The props member holding the theme.
 */
public record LoweringOptions(String placeholderPrefix, boolean recoverDroppedPlaceholders, String themeKey) {

    private static final String PATH = "stylecast.lowering";

    public LoweringOptions {
        if (placeholderPrefix == null || placeholderPrefix.isBlank()) {
            throw new IllegalArgumentException("placeholder-prefix must not be empty");
        }
        if (themeKey == null || themeKey.isBlank()) {
            throw new IllegalArgumentException("theme-key must not be empty");
        }
    }

    /**
     * Reads the options from {@code stylecast.lowering}.
     * @param config The root config.
     * @return The options.
     */
    public static LoweringOptions fromConfig(Config config) {
        Config lowering = config.getConfig(PATH);
        return new LoweringOptions(
                lowering.getString("placeholder-prefix"),
                lowering.getBoolean("recover-dropped-placeholders"),
                lowering.getString("theme-key"));
    }

    /**
     * @return The options defined in {@code reference.conf}.
     */
    public static LoweringOptions defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @return Placeholder naming for these options.
     */
    public Placeholders placeholders() {
        return new Placeholders(placeholderPrefix);
    }
}
