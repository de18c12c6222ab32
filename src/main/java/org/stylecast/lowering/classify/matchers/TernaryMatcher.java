package org.stylecast.lowering.classify.matchers;

import org.stylecast.lowering.classify.ArrowBinding;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.IExpressionMatcher;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.condition.Condition;
import org.stylecast.lowering.condition.Conditions;
import org.stylecast.lowering.css.PropertyNames;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsPrinter;
import org.stylecast.lowering.style.StyleValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conditional expressions. Recognized shapes, tried in this order:
 * <ul>
 *     <li>{@code p.a === "x" ? A : p.a === "y" ? B : C}: an equality chain on one prop,
 *     lowered to a {@code default} branch under the negated condition plus one branch per case;</li>
 *     <li>{@code p.a ? A : p.b ? B : C}: a compound variant over two props;</li>
 *     <li>{@code p.a ? A : B} and {@code !p.a ? A : B}: a {@code truthy}/{@code falsy} pair;</li>
 *     <li>any other test, kept as a structured or opaque condition.</li>
 * </ul>
 */
public class TernaryMatcher implements IExpressionMatcher {

    private static final String HETEROGENEOUS_PROPERTY = "background";

    @Override
    public Optional<LoweringDecision> match(JsNode expression, DynamicContext context, MatchContext env) {
        if (!context.isStandaloneBlock() && !(context.isPropertyValue() && context.fullValue())) {
            return Optional.empty();
        }
        ArrowBinding binding = ArrowBinding.of(expression);
        if (!(binding.body() instanceof JsNode.ConditionalExpr conditional)) {
            return Optional.empty();
        }
        List<Case> cases = equalityChain(conditional, binding);
        if (!cases.isEmpty()) {
            return equality(cases, binding, context, env);
        }
        Optional<LoweringDecision> multiProp = multiProp(conditional, binding, context, env);
        if (multiProp.isPresent()) {
            return multiProp;
        }
        Condition condition = Conditions.fromExpression(conditional.test(), binding::propName)
                .orElseGet(() -> new Condition.Opaque(binding.strip(conditional.test())));
        Optional<CollectedBranches> collected = CollectedBranches.collect(
                List.of(conditional.consequent(), conditional.alternate()), binding, context, env);
        if (collected.isEmpty()) {
            return Optional.empty();
        }
        if (collected.get().failed()) {
            return Optional.of(collected.get().bail());
        }
        List<Map<String, StyleValue>> styles = collected.get().styles();
        Optional<LoweringDecision> heterogeneous = checkHeterogeneous(context, styles);
        if (heterogeneous.isPresent()) {
            return heterogeneous;
        }
        return Optional.of(new LoweringDecision.SplitVariants(List.of(
                new LoweringDecision.Branch("truthy", condition, styles.get(0)),
                new LoweringDecision.Branch("falsy", Condition.negate(condition), styles.get(1)))));
    }

    private record Case(Condition.Compare compare, String hint, JsNode branch) {}

    private static List<Case> equalityChain(JsNode.ConditionalExpr conditional, ArrowBinding binding) {
        List<Case> cases = new ArrayList<>();
        JsNode node = conditional;
        String lhs = null;
        while (node instanceof JsNode.ConditionalExpr c && c.test() instanceof JsNode.BinaryExpr test) {
            Optional<Condition> condition = Conditions.fromExpression(test, binding::propName);
            if (condition.isEmpty() || !(condition.get() instanceof Condition.Compare compare)
                    || compare.isNegated() || !compare.literalRhs()) {
                break;
            }
            if (lhs != null && !lhs.equals(compare.lhs())) {
                break;
            }
            lhs = compare.lhs();
            cases.add(new Case(compare, hint(test, binding), c.consequent()));
            node = c.alternate();
        }
        if (!cases.isEmpty()) {
            cases.add(new Case(null, "default", node));
        }
        return cases;
    }

    private static String hint(JsNode.BinaryExpr test, ArrowBinding binding) {
        JsNode literal = binding.propName(test.left()).isPresent() ? test.right() : test.left();
        return literal instanceof JsNode.StringLiteral s ? s.value() : JsPrinter.print(literal);
    }

    private static Optional<LoweringDecision> equality(List<Case> cases, ArrowBinding binding,
                                                       DynamicContext context, MatchContext env) {
        List<JsNode> branches = new ArrayList<>();
        cases.forEach(c -> branches.add(c.branch()));
        Optional<CollectedBranches> collected = CollectedBranches.collect(branches, binding, context, env);
        if (collected.isEmpty()) {
            return Optional.empty();
        }
        if (collected.get().failed()) {
            return Optional.of(collected.get().bail());
        }
        List<Map<String, StyleValue>> styles = collected.get().styles();
        Optional<LoweringDecision> heterogeneous = checkHeterogeneous(context, styles);
        if (heterogeneous.isPresent()) {
            return heterogeneous;
        }
        int defaultIndex = cases.size() - 1;
        List<LoweringDecision.Branch> result = new ArrayList<>();
        if (defaultIndex == 1) {
            Condition.Compare compare = cases.get(0).compare();
            result.add(new LoweringDecision.Branch("default", Condition.negate(compare), styles.get(defaultIndex)));
            result.add(new LoweringDecision.Branch("match", compare, styles.get(0)));
            return Optional.of(new LoweringDecision.SplitVariants(result));
        }
        List<Condition> compares = new ArrayList<>();
        for (int i = 0; i < defaultIndex; i++) {
            compares.add(cases.get(i).compare());
        }
        result.add(new LoweringDecision.Branch("default", Condition.negate(new Condition.Or(compares)), styles.get(defaultIndex)));
        for (int i = 0; i < defaultIndex; i++) {
            result.add(new LoweringDecision.Branch(cases.get(i).hint(), cases.get(i).compare(), styles.get(i)));
        }
        return Optional.of(new LoweringDecision.SplitVariants(result));
    }

    private static Optional<LoweringDecision> multiProp(JsNode.ConditionalExpr outer, ArrowBinding binding,
                                                        DynamicContext context, MatchContext env) {
        if (!(outer.alternate() instanceof JsNode.ConditionalExpr inner)
                || outer.consequent() instanceof JsNode.ConditionalExpr
                || inner.consequent() instanceof JsNode.ConditionalExpr
                || inner.alternate() instanceof JsNode.ConditionalExpr) {
            return Optional.empty();
        }
        Optional<String> outerProp = binding.propName(outer.test());
        Optional<String> innerProp = binding.propName(inner.test());
        if (outerProp.isEmpty() || innerProp.isEmpty() || outerProp.get().equals(innerProp.get())) {
            return Optional.empty();
        }
        Optional<CollectedBranches> collected = CollectedBranches.collect(
                List.of(outer.consequent(), inner.consequent(), inner.alternate()), binding, context, env);
        if (collected.isEmpty()) {
            return Optional.empty();
        }
        if (collected.get().failed()) {
            return Optional.of(collected.get().bail());
        }
        List<Map<String, StyleValue>> styles = collected.get().styles();
        return Optional.of(new LoweringDecision.SplitMultiPropVariants(
                outerProp.get(), innerProp.get(), styles.get(0), styles.get(1), styles.get(2)));
    }

    private static Optional<LoweringDecision> checkHeterogeneous(DynamicContext context, List<Map<String, StyleValue>> styles) {
        if (!context.isPropertyValue() || !HETEROGENEOUS_PROPERTY.equals(PropertyNames.normalize(context.property()))) {
            return Optional.empty();
        }
        Map<String, StyleValue> reference = null;
        for (Map<String, StyleValue> style : styles) {
            if (style.isEmpty()) continue;
            if (reference == null) {
                reference = style;
            } else if (!reference.keySet().equals(style.keySet())) {
                return Optional.of(new LoweringDecision.Bail(
                        "conditional background branches resolve to different properties "
                                + reference.keySet() + " and " + style.keySet(),
                        WarningCategory.HETEROGENEOUS_BRANCHES));
            }
        }
        return Optional.empty();
    }
}
