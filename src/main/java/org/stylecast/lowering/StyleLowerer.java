package org.stylecast.lowering;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.adapter.ConfiguredStyleAdapter;
import org.stylecast.lowering.adapter.StyleAdapter;
import org.stylecast.lowering.api.IStyleLowerer;
import org.stylecast.lowering.api.LoweredFile;
import org.stylecast.lowering.api.LoweringException;
import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.classify.DynamicExpressionClassifier;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.classify.MatcherRegistry;
import org.stylecast.lowering.config.ConfigLoader;
import org.stylecast.lowering.config.LoggingConfigurator;
import org.stylecast.lowering.config.LoweringOptions;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.frontend.css.CssNode;
import org.stylecast.lowering.frontend.css.CssTreeParser;
import org.stylecast.lowering.frontend.template.FileScanner;
import org.stylecast.lowering.frontend.template.FileScope;
import org.stylecast.lowering.frontend.template.ScannedFile;
import org.stylecast.lowering.frontend.template.StyledComponentSource;
import org.stylecast.lowering.frontend.template.StyledTemplate;
import org.stylecast.lowering.frontend.template.TemplateScanner;
import org.stylecast.lowering.ir.CssIrBuilder;
import org.stylecast.lowering.ir.CssRule;
import org.stylecast.lowering.ir.Placeholders;
import org.stylecast.lowering.lower.BucketAssembler;
import org.stylecast.lowering.lower.LoweredComponent;
import org.stylecast.lowering.lower.StyledDecl;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The main lowering implementation. Runs the pipeline scan, parse, IR build, classification
 * and bucket assembly for every styled component of a file. Components are lowered
 * independently: a bail in one never affects its siblings. Not thread-safe; use one
 * instance per worker.
 */
public class StyleLowerer implements IStyleLowerer {

    private static final Logger LOG = LoggerFactory.getLogger(StyleLowerer.class);

    private final LoweringOptions options;
    private final StyleAdapter adapter;
    private final MatcherRegistry matchers;
    private final Placeholders placeholders;
    private final TemplateScanner templateScanner;

    /**
     * @param options Lowering options.
     * @param adapter Resolves theme values, CSS variables and helper calls.
     */
    public StyleLowerer(LoweringOptions options, StyleAdapter adapter) {
        this(options, adapter, MatcherRegistry.initializeWithDefaults());
    }

    /**
     * @param options  Lowering options.
     * @param adapter  Resolves theme values, CSS variables and helper calls.
     * @param matchers The expression matchers, in priority order.
     */
    public StyleLowerer(LoweringOptions options, StyleAdapter adapter, MatcherRegistry matchers) {
        this.options = options;
        this.adapter = adapter;
        this.matchers = matchers;
        this.placeholders = options.placeholders();
        this.templateScanner = new TemplateScanner(placeholders);
    }

    /**
     * Creates a lowerer from a loaded configuration: {@code stylecast.lowering} for the options
     * and {@code stylecast.adapter} for a {@link ConfiguredStyleAdapter}.
     * @param config The root configuration.
     * @return The lowerer.
     */
    public static StyleLowerer fromConfig(Config config) {
        return new StyleLowerer(LoweringOptions.fromConfig(config), ConfiguredStyleAdapter.fromConfig(config));
    }

    /**
     * Loads the configuration with {@link ConfigLoader}, applies its logging levels and
     * creates a lowerer from it.
     * @param configFile The configuration file; skipped if missing.
     * @return The lowerer.
     */
    public static StyleLowerer fromConfigFile(File configFile) {
        Config config = ConfigLoader.load(configFile);
        LoggingConfigurator.configure(config);
        return fromConfig(config);
    }

    @Override
    public LoweredFile lowerFile(String source, String fileName) throws LoweringException {
        // Phase 1: find styled components and file-level helpers
        ScannedFile scanned = new FileScanner(templateScanner).scan(source, fileName);

        // Phase 2: lower every component on its own
        WarningCollector warnings = new WarningCollector();
        List<LoweredComponent> components = new ArrayList<>();
        for (StyledComponentSource component : scanned.components()) {
            components.add(lower(component.name(), component.target(), component.body(), component.location(),
                    scanned.scope(), warnings));
        }

        LoweredFile result = new LoweredFile(fileName, components, warnings.getWarnings());
        LOG.info("Lowered {}: {} component(s), {} bailed, {} warning(s)",
                fileName, components.size(), result.bailedCount(), result.warnings().size());
        return result;
    }

    @Override
    public LoweredComponent lowerTemplate(String componentName, String templateBody, FileScope scope, WarningCollector warnings) {
        return lower(componentName, null, templateBody, SourceLocation.UNKNOWN, scope, warnings);
    }

    private LoweredComponent lower(String name, String target, String body, SourceLocation origin,
                                   FileScope scope, WarningCollector fileWarnings) {
        StyledDecl decl = new StyledDecl(name, target);
        StyledTemplate template;
        try {
            template = templateScanner.scan(body, origin, decl.warnings());
        } catch (IllegalArgumentException e) {
            decl.warnings().report(WarningCategory.PARSE_ERROR, e.getMessage(), origin, Map.of("component", name));
            decl.bail(e.getMessage());
            return finish(decl, fileWarnings);
        }

        List<CssNode> tree = CssTreeParser.parse(template.rawCss());
        List<CssRule> rules = new CssIrBuilder(placeholders, options.recoverDroppedPlaceholders())
                .build(tree, template.slots(), template.rawCss());

        MatchContext env = new MatchContext(adapter, scope, options);
        BucketAssembler assembler = new BucketAssembler(decl, new DynamicExpressionClassifier(matchers, env), env,
                placeholders, template.slots());
        for (CssRule rule : rules) {
            assembler.applyRule(rule);
        }
        return finish(decl, fileWarnings);
    }

    private static LoweredComponent finish(StyledDecl decl, WarningCollector fileWarnings) {
        LoweredComponent component = decl.finish();
        fileWarnings.addAll(component.warnings());
        LOG.debug("Component {}: {} base propertie(s), {} bucket(s), {} style function(s){}",
                component.name(), component.styleObj().size(), component.variantBuckets().size(),
                component.styleFnSpecs().size(), component.bailed() ? ", bailed" : "");
        return component;
    }
}
