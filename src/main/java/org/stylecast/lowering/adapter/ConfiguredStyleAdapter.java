package org.stylecast.lowering.adapter;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.css.PropertyNames;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsPrinter;
import org.stylecast.lowering.style.ImportSpec;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A {@link StyleAdapter} driven by the {@code stylecast.adapter} configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * adapter {
 *   theme { object = "themeVars", import-source = "./tokens.stylex", collection-roots = ["colors"] }
 *   css-variables { enabled = true, object = "vars", import-source = "./css-variables.stylex" }
 *   calls { color { object = "colors", import-source = "./colors.stylex" } }
 * }
 * </pre>
 */
public class ConfiguredStyleAdapter implements StyleAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(ConfiguredStyleAdapter.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final String themeObject;
    private final String themeImportSource;
    private final Set<String> collectionRoots;
    private final boolean cssVariablesEnabled;
    private final String cssVariablesObject;
    private final String cssVariablesImportSource;
    private final Map<String, ImportSpec> calls = new HashMap<>();

    /**
     * @param adapterConfig The {@code stylecast.adapter} sub-tree.
     */
    public ConfiguredStyleAdapter(Config adapterConfig) {
        Config theme = adapterConfig.getConfig("theme");
        this.themeObject = theme.getString("object");
        this.themeImportSource = theme.getString("import-source");
        this.collectionRoots = new HashSet<>(theme.getStringList("collection-roots"));

        Config cssVariables = adapterConfig.getConfig("css-variables");
        this.cssVariablesEnabled = cssVariables.getBoolean("enabled");
        this.cssVariablesObject = cssVariables.getString("object");
        this.cssVariablesImportSource = cssVariables.getString("import-source");

        if (adapterConfig.hasPath("calls")) {
            Config callsConfig = adapterConfig.getConfig("calls");
            for (Map.Entry<String, ConfigValue> entry : callsConfig.root().entrySet()) {
                Config call = callsConfig.getConfig(entry.getKey());
                calls.put(entry.getKey(), new ImportSpec(call.getString("import-source"), call.getString("object")));
            }
        }
        LOG.debug("Adapter configured: theme object '{}', {} call helper(s)", themeObject, calls.size());
    }

    /**
     * Creates the adapter from a full application config.
     * @param config The root config holding {@code stylecast.adapter}.
     * @return The adapter.
     */
    public static ConfiguredStyleAdapter fromConfig(Config config) {
        return new ConfiguredStyleAdapter(config.getConfig("stylecast.adapter"));
    }

    @Override
    public Optional<Resolution> resolveValue(ValueRequest request) {
        switch (request.kind()) {
            case THEME:
                return resolveTheme(request.path());
            case CSS_VARIABLE:
                return resolveCssVariable(request.path());
            default:
                return Optional.empty();
        }
    }

    private Optional<Resolution> resolveTheme(String path) {
        String[] segments = path.split("\\.");
        if (segments.length == 0 || segments[0].isEmpty()) {
            return Optional.empty();
        }
        ImportSpec themeImport = new ImportSpec(themeImportSource, themeObject);
        if (segments.length == 1 && collectionRoots.contains(segments[0])) {
            return Optional.of(new Resolution(themeObject, List.of(themeImport)));
        }
        String last = segments[segments.length - 1];
        return Optional.of(new Resolution(member(themeObject, last), List.of(themeImport)));
    }

    private Optional<Resolution> resolveCssVariable(String name) {
        if (!cssVariablesEnabled || !name.startsWith("--") || name.length() <= 2) {
            return Optional.empty();
        }
        String key = PropertyNames.kebabToCamel(name.substring(2));
        return Optional.of(new Resolution(member(cssVariablesObject, key),
                List.of(new ImportSpec(cssVariablesImportSource, cssVariablesObject))));
    }

    @Override
    public Optional<Resolution> resolveCall(CallRequest request) {
        ImportSpec target = calls.get(request.calleeName());
        if (target == null || request.arguments().size() != 1
                || !(request.arguments().get(0) instanceof JsNode.StringLiteral literal)) {
            return Optional.empty();
        }
        return Optional.of(new Resolution(member(target.name(), literal.value()), List.of(target)));
    }

    private static String member(String object, String key) {
        return IDENTIFIER.matcher(key).matches() ? object + "." + key : object + "[" + JsPrinter.quote(key) + "]";
    }
}
