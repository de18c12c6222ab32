package org.stylecast.lowering.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.adapter.CallRequest;
import org.stylecast.lowering.adapter.Resolution;
import org.stylecast.lowering.adapter.StyleAdapter;
import org.stylecast.lowering.adapter.ValueRequest;
import org.stylecast.lowering.config.LoweringOptions;
import org.stylecast.lowering.frontend.js.JsParser;
import org.stylecast.lowering.frontend.template.FileScope;

import java.util.Optional;

/**
 * Everything a matcher may consult besides the expression and its placement:
 * the adapter, the file scope and the options.
 */
public class MatchContext {

    private static final Logger LOG = LoggerFactory.getLogger(MatchContext.class);

    private final StyleAdapter adapter;
    private final FileScope scope;
    private final LoweringOptions options;

    public MatchContext(StyleAdapter adapter, FileScope scope, LoweringOptions options) {
        this.adapter = adapter;
        this.scope = scope;
        this.options = options;
    }

    public FileScope scope() {
        return scope;
    }

    public String themeKey() {
        return options.themeKey();
    }

    /**
     * Asks the adapter to resolve a value.
     * @param request The request.
     * @return The outcome.
     */
    public AdapterOutcome resolveValue(ValueRequest request) {
        return check(adapter.resolveValue(request));
    }

    /**
     * Asks the adapter to resolve a call.
     * @param request The request.
     * @return The outcome.
     */
    public AdapterOutcome resolveCall(CallRequest request) {
        return check(adapter.resolveCall(request));
    }

    private AdapterOutcome check(Optional<Resolution> resolution) {
        if (resolution.isEmpty()) {
            return new AdapterOutcome.Declined();
        }
        String expr = resolution.get().expr();
        if (expr == null || JsParser.tryParse(expr).isEmpty()) {
            LOG.debug("Adapter returned unparseable expression '{}'", expr);
            return new AdapterOutcome.Rejected(String.valueOf(expr));
        }
        return new AdapterOutcome.Resolved(resolution.get());
    }
}
