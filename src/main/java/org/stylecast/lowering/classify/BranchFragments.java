package org.stylecast.lowering.classify;

import org.stylecast.lowering.adapter.ValueRequest;
import org.stylecast.lowering.css.DeclarationBlockParser;
import org.stylecast.lowering.css.PropertyNames;
import org.stylecast.lowering.css.ShorthandTable;
import org.stylecast.lowering.css.StyleFragments;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsPrinter;
import org.stylecast.lowering.frontend.template.CssHelper;
import org.stylecast.lowering.style.StyleValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts the branches of conditional interpolations into style fragments.
 */
public final class BranchFragments {

    /** Reason used when a conditional block holds more than flat declarations. */
    public static final String UNSUPPORTED_BLOCK = "conditional CSS block contains unsupported content";

    private BranchFragments() {}

    /**
     * @param branch  The branch expression.
     * @param binding The props binding of the interpolation.
     * @param context Where the slot sits.
     * @param env     Adapter and scope.
     * @return The fragment, a failure, or no match.
     */
    public static BranchFragment of(JsNode branch, ArrowBinding binding, DynamicContext context, MatchContext env) {
        if (isEmptyBranch(branch)) {
            return new BranchFragment.Fragment(Map.of());
        }
        if (context.isStandaloneBlock()) {
            return blockFragment(branch, env);
        }
        if (context.isPropertyValue() && context.fullValue()) {
            return valueFragment(branch, binding, context.property(), env);
        }
        return new BranchFragment.NoMatch();
    }

    /**
     * @param branch A branch expression.
     * @return {@code true} for branches that contribute no style: null, undefined, false and "".
     */
    public static boolean isEmptyBranch(JsNode branch) {
        return branch instanceof JsNode.NullLiteral
                || (branch instanceof JsNode.Identifier id && "undefined".equals(id.name()))
                || (branch instanceof JsNode.BooleanLiteral b && !b.value())
                || (branch instanceof JsNode.StringLiteral s && s.value().isBlank())
                || (branch instanceof JsNode.TemplateLiteral t && t.isStatic() && t.quasis().get(0).isBlank());
    }

    /**
     * @param node An expression.
     * @return The text of a string literal or static template, if it is one.
     */
    public static Optional<String> staticText(JsNode node) {
        if (node instanceof JsNode.StringLiteral s) {
            return Optional.of(s.value());
        }
        if (node instanceof JsNode.TemplateLiteral t && t.isStatic()) {
            return Optional.of(t.quasis().get(0));
        }
        if (node instanceof JsNode.TaggedTemplate tagged
                && tagged.tag() instanceof JsNode.Identifier tag && "css".equals(tag.name())
                && tagged.quasi().isStatic()) {
            return Optional.of(tagged.quasi().quasis().get(0));
        }
        return Optional.empty();
    }

    private static BranchFragment blockFragment(JsNode branch, MatchContext env) {
        if (branch instanceof JsNode.Identifier id && env.scope().isCssHelper(id.name())) {
            CssHelper helper = env.scope().cssHelpers().get(id.name());
            return helper.isStatic()
                    ? new BranchFragment.Fragment(helper.staticStyle())
                    : new BranchFragment.NoMatch();
        }
        Optional<String> text = staticText(branch);
        if (text.isEmpty()) {
            return new BranchFragment.NoMatch();
        }
        return DeclarationBlockParser.parse(text.get())
                .<BranchFragment>map(BranchFragment.Fragment::new)
                .orElseGet(() -> new BranchFragment.Failed(new LoweringDecision.Bail(UNSUPPORTED_BLOCK)));
    }

    private static BranchFragment valueFragment(JsNode branch, ArrowBinding binding, String property, MatchContext env) {
        Optional<String> text = staticText(branch);
        if (text.isPresent()) {
            StyleValue value = ShorthandTable.isShorthand(property)
                    ? new StyleValue.Str(text.get().trim())
                    : StyleFragments.literal(text.get());
            return new BranchFragment.Fragment(StyleFragments.forValue(property, value));
        }
        if (branch instanceof JsNode.NumberLiteral n) {
            return new BranchFragment.Fragment(StyleFragments.forValue(property, new StyleValue.Num(n.raw())));
        }
        Optional<List<String>> path = binding.propPath(branch);
        if (path.isPresent()) {
            return themeFragment(path.get(), property, env);
        }
        if (isStaticReference(branch)) {
            return new BranchFragment.Fragment(single(property, StyleValue.expr(JsPrinter.print(branch))));
        }
        return new BranchFragment.NoMatch();
    }

    private static BranchFragment themeFragment(List<String> path, String property, MatchContext env) {
        if (path.size() < 2 || !path.get(0).equals(env.themeKey())) {
            return new BranchFragment.NoMatch();
        }
        AdapterOutcome outcome = env.resolveValue(ValueRequest.theme(String.join(".", path.subList(1, path.size()))));
        if (outcome instanceof AdapterOutcome.Resolved r) {
            return new BranchFragment.Fragment(single(property,
                    new StyleValue.Expr(r.resolution().expr(), r.resolution().imports())));
        }
        if (outcome instanceof AdapterOutcome.Rejected rejected) {
            return new BranchFragment.Failed(unparseable(rejected));
        }
        return new BranchFragment.NoMatch();
    }

    /**
     * @param rejected A rejected adapter answer.
     * @return The bail reporting it.
     */
    public static LoweringDecision.Bail unparseable(AdapterOutcome.Rejected rejected) {
        return new LoweringDecision.Bail("adapter returned an unparseable expression: " + rejected.expr(),
                WarningCategory.UNPARSEABLE_EXPRESSION);
    }

    /**
     * @param node An expression.
     * @return {@code true} for identifiers and member chains that are not props reads.
     */
    public static boolean isStaticReference(JsNode node) {
        if (node instanceof JsNode.Identifier id) {
            return !"undefined".equals(id.name());
        }
        if (node instanceof JsNode.MemberExpr m) {
            return (m.computed() == null || isLiteral(m.computed())) && isStaticReference(m.object());
        }
        return false;
    }

    private static boolean isLiteral(JsNode node) {
        return node instanceof JsNode.StringLiteral || node instanceof JsNode.NumberLiteral;
    }

    private static Map<String, StyleValue> single(String property, StyleValue value) {
        Map<String, StyleValue> fragment = new LinkedHashMap<>();
        fragment.put(PropertyNames.normalize(property), value);
        return fragment;
    }
}
