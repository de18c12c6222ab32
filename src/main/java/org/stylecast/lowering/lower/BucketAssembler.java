package org.stylecast.lowering.lower;

import org.stylecast.lowering.adapter.ValueRequest;
import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.classify.AdapterOutcome;
import org.stylecast.lowering.classify.BranchFragments;
import org.stylecast.lowering.classify.DynamicContext;
import org.stylecast.lowering.classify.DynamicExpressionClassifier;
import org.stylecast.lowering.classify.LoweringDecision;
import org.stylecast.lowering.classify.MatchContext;
import org.stylecast.lowering.condition.Condition;
import org.stylecast.lowering.condition.StyleKeyNaming;
import org.stylecast.lowering.css.PropertyNames;
import org.stylecast.lowering.css.ShorthandTable;
import org.stylecast.lowering.css.StyleFragments;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsParser;
import org.stylecast.lowering.ir.CssDeclaration;
import org.stylecast.lowering.ir.CssRule;
import org.stylecast.lowering.ir.CssValue;
import org.stylecast.lowering.ir.Placeholders;
import org.stylecast.lowering.ir.Slot;
import org.stylecast.lowering.style.ImportSpec;
import org.stylecast.lowering.style.StyleValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the declarations of a component's rules, in source order, to its {@link StyledDecl}.
 * Static declarations go to the base style; each slot is classified and its decision applied.
 */
public class BucketAssembler {

    private static final Pattern PSEUDO_SELECTOR = Pattern.compile("^&((?:::?[\\w-]+(?:\\([^)]*\\))?)+)$");
    private static final Pattern CSS_VARIABLE = Pattern.compile("^var\\(\\s*(--[\\w-]+)\\s*(?:,\\s*(.+))?\\)$");
    private static final Set<String> NESTABLE_AT_RULES = Set.of("@media", "@supports", "@container");
    private static final Set<String> GENERIC_HINTS = Set.of("truthy", "falsy", "default", "match");
    private static final String ROOT_SELECTOR = "&";

    private final StyledDecl decl;
    private final DynamicExpressionClassifier classifier;
    private final MatchContext env;
    private final Placeholders placeholders;
    private final Map<Integer, Slot> slots = new HashMap<>();

    /**
     * @param decl         The component being assembled.
     * @param classifier   Classifies slot expressions.
     * @param env          Adapter access for static values.
     * @param placeholders Placeholder naming of the template.
     * @param slots        The template's slots.
     */
    public BucketAssembler(StyledDecl decl, DynamicExpressionClassifier classifier, MatchContext env,
                           Placeholders placeholders, List<Slot> slots) {
        this.decl = decl;
        this.classifier = classifier;
        this.env = env;
        this.placeholders = placeholders;
        for (Slot slot : slots) {
            this.slots.put(slot.id(), slot);
        }
    }

    /** Nesting paths a rule writes to; several for selector lists such as {@code &:hover, &:focus}. */
    private record Scope(List<List<String>> paths) {
        boolean isBase() {
            return paths.size() == 1 && paths.get(0).isEmpty();
        }
    }

    /**
     * Applies all declarations of a rule. A rule whose selector or at-rules have no static
     * form bails the component and contributes nothing.
     * @param rule The rule.
     */
    public void applyRule(CssRule rule) {
        if (rule.declarations().isEmpty()) {
            return;
        }
        Optional<Scope> scope = resolveScope(rule);
        if (scope.isEmpty()) {
            return;
        }
        for (CssDeclaration declaration : rule.declarations()) {
            applyDeclaration(rule, scope.get(), declaration);
        }
    }

    /**
     * Applies a decision for a declaration holding exactly one slot.
     * @param rule        The enclosing rule.
     * @param declaration The declaration.
     * @param decision    The classified decision for its slot.
     */
    public void apply(CssRule rule, CssDeclaration declaration, LoweringDecision decision) {
        resolveScope(rule).ifPresent(scope -> applyDecision(rule, scope, declaration, decision, slotOf(declaration)));
    }

    private void applyDeclaration(CssRule rule, Scope scope, CssDeclaration declaration) {
        CssValue value = declaration.value();
        if (value instanceof CssValue.Static s) {
            applyStatic(rule, scope, declaration, s.text());
            return;
        }
        CssValue.Interpolated interpolated = (CssValue.Interpolated) value;
        if (declaration.isStandaloneBlock() || interpolated.isSingleSlot()) {
            Slot slot = slotOf(declaration);
            DynamicContext context = DynamicContext.declaration(declaration.property(), rule.selector(), rule.atRuleStack(), true);
            applyDecision(rule, scope, declaration, classifier.classify(slot.expression(), context), slot);
            return;
        }
        applyComposite(rule, scope, declaration, interpolated);
    }

    private Slot slotOf(CssDeclaration declaration) {
        List<Integer> ids = declaration.value().slotIds();
        return ids.isEmpty() ? null : slots.get(ids.get(0));
    }

    // --- static declarations ---

    private void applyStatic(CssRule rule, Scope scope, CssDeclaration declaration, String text) {
        Map<String, StyleValue> fragment;
        Matcher variable = CSS_VARIABLE.matcher(text.trim());
        Optional<StyleValue> resolved = Optional.empty();
        if (variable.matches()) {
            AdapterOutcome outcome = env.resolveValue(ValueRequest.cssVariable(variable.group(1), variable.group(2)));
            if (outcome instanceof AdapterOutcome.Rejected rejected) {
                reportBail(rule, declaration, BranchFragments.unparseable(rejected), SourceLocation.UNKNOWN);
                return;
            }
            if (outcome instanceof AdapterOutcome.Resolved r) {
                resolved = Optional.of(withImportant(
                        new StyleValue.Expr(r.resolution().expr(), r.resolution().imports()), declaration.important()));
            }
        }
        if (resolved.isPresent()) {
            fragment = new LinkedHashMap<>();
            fragment.put(PropertyNames.normalize(declaration.property()), resolved.get());
        } else {
            fragment = StyleFragments.fromDeclaration(declaration.property(), text, declaration.important());
        }
        writeBase(scope, fragment);
        attachComments(declaration, fragment);
        decl.markBoundary();
    }

    private void attachComments(CssDeclaration declaration, Map<String, StyleValue> fragment) {
        if (fragment.isEmpty()) return;
        String property = fragment.keySet().iterator().next();
        if (declaration.leadingComment() != null) {
            decl.addComment(property, declaration.leadingComment());
        }
        if (declaration.trailingLineComment() != null) {
            decl.addComment(property, declaration.trailingLineComment());
        }
    }

    // --- single slot declarations ---

    private void applyDecision(CssRule rule, Scope scope, CssDeclaration declaration, LoweringDecision decision, Slot slot) {
        SourceLocation location = slot == null ? SourceLocation.UNKNOWN : slot.location();
        if (decision instanceof LoweringDecision.Bail bail) {
            reportBail(rule, declaration, bail, location);
        } else if (decision instanceof LoweringDecision.Convert convert) {
            applyConvert(rule, scope, declaration, convert, location);
        } else if (decision instanceof LoweringDecision.Variant variant) {
            Condition when = new Condition.Prop(variant.propName());
            writeVariant(scope, when.toSource(), StyleKeyNaming.suffix(when), important(variant.style(), declaration));
        } else if (decision instanceof LoweringDecision.SplitVariants split) {
            for (LoweringDecision.Branch branch : split.branches()) {
                if (branch.style().isEmpty()) continue;
                String suffix = GENERIC_HINTS.contains(branch.nameHint())
                        ? StyleKeyNaming.suffix(branch.when())
                        : hintSuffix(branch.nameHint());
                writeVariant(scope, branch.when().toSource(), suffix, important(branch.style(), declaration));
            }
        } else if (decision instanceof LoweringDecision.SplitMultiPropVariants multi) {
            applyCompound(scope, declaration, multi);
        } else if (decision instanceof LoweringDecision.DynamicStyleFunction fn) {
            String property = PropertyNames.normalize(declaration.property());
            for (List<String> path : scope.paths()) {
                decl.addStyleFunction(fn.paramName(), fn.originalPropName(), property, path, fn.fallback(),
                        declaration.important());
            }
            decl.markBoundary();
        }
    }

    private void applyConvert(CssRule rule, Scope scope, CssDeclaration declaration,
                              LoweringDecision.Convert convert, SourceLocation location) {
        decl.addImports(convert.imports());
        if (declaration.isStandaloneBlock()) {
            if (!scope.isBase()) {
                reportBail(rule, declaration, new LoweringDecision.Bail(
                        "css block interpolation inside a nested selector or at-rule is not supported"), location);
                return;
            }
            decl.addMixin(new StyleValue.Expr(convert.expr(), convert.imports()));
            decl.markBoundary();
            return;
        }
        StyleValue value = convertedValue(convert);
        Map<String, StyleValue> fragment;
        if (value instanceof StyleValue.Str s && ShorthandTable.isShorthand(declaration.property())) {
            fragment = StyleFragments.fromDeclaration(declaration.property(), s.value(), declaration.important());
        } else {
            fragment = new LinkedHashMap<>();
            fragment.put(PropertyNames.normalize(declaration.property()), withImportant(value, declaration.important()));
        }
        writeBase(scope, fragment);
        attachComments(declaration, fragment);
        decl.markBoundary();
    }

    private void applyCompound(Scope scope, CssDeclaration declaration, LoweringDecision.SplitMultiPropVariants multi) {
        if (decl.isBailed()) {
            return;
        }
        Condition outer = new Condition.Prop(multi.outerProp());
        Condition inner = new Condition.Prop(multi.innerProp());
        Condition innerTrue = new Condition.And(List.of(Condition.negate(outer), inner));
        Condition innerFalse = new Condition.And(List.of(Condition.negate(outer), Condition.negate(inner)));
        String innerSuffix = StyleKeyNaming.suffix(inner);

        writeCompound(scope, outer.toSource(), StyleKeyNaming.suffix(outer), important(multi.outerTruthy(), declaration));
        writeCompound(scope, innerTrue.toSource(), innerSuffix + "True", important(multi.innerTruthy(), declaration));
        writeCompound(scope, innerFalse.toSource(), innerSuffix + "False", important(multi.innerFalsy(), declaration));
        decl.addCompoundVariant(new CompoundVariant(multi.outerProp(), multi.innerProp(),
                decl.keyOf(outer.toSource()), decl.keyOf(innerTrue.toSource()), decl.keyOf(innerFalse.toSource())));
    }

    private void writeCompound(Scope scope, String when, String suffix, Map<String, StyleValue> style) {
        decl.compoundBucket(when, suffix).ifPresent(bucket -> writeAll(bucket, scope, style));
    }

    private void writeVariant(Scope scope, String when, String suffix, Map<String, StyleValue> style) {
        decl.bucket(when, suffix).ifPresent(bucket -> writeAll(bucket, scope, style));
    }

    private static String hintSuffix(String hint) {
        String identifier = hint.replaceAll("[^0-9A-Za-z_$]+", " ").trim();
        StringBuilder sb = new StringBuilder();
        for (String word : identifier.split("\\s+")) {
            sb.append(PropertyNames.capitalize(PropertyNames.kebabToCamel(word)));
        }
        return sb.length() == 0 ? StyleKeyNaming.COND_TRUTHY : sb.toString();
    }

    // --- values mixing static text and slots ---

    private void applyComposite(CssRule rule, Scope scope, CssDeclaration declaration, CssValue.Interpolated value) {
        Map<Integer, LoweringDecision.Convert> converts = new HashMap<>();
        StringBuilder text = new StringBuilder();
        for (CssValue.Part part : value.parts()) {
            if (part instanceof CssValue.Text t) {
                text.append(t.text());
                continue;
            }
            Slot slot = slots.get(((CssValue.SlotRef) part).slotId());
            DynamicContext context = DynamicContext.declaration(declaration.property(), rule.selector(), rule.atRuleStack(), false);
            LoweringDecision decision = classifier.classify(slot.expression(), context);
            if (decision instanceof LoweringDecision.Bail bail) {
                reportBail(rule, declaration, bail, slot.location());
                return;
            }
            if (!(decision instanceof LoweringDecision.Convert convert)) {
                reportBail(rule, declaration, new LoweringDecision.Bail(
                        "dynamic value inside a larger value cannot be lowered: " + slot.source()), slot.location());
                return;
            }
            converts.put(slot.id(), convert);
            decl.addImports(convert.imports());
            text.append(slot.placeholder());
        }
        Map<String, String> longhands = ShorthandTable.expand(declaration.property(), text.toString())
                .orElseGet(() -> Map.of(PropertyNames.normalize(declaration.property()), text.toString()));
        Map<String, StyleValue> fragment = new LinkedHashMap<>();
        longhands.forEach((property, longhandText) ->
                fragment.put(property, withImportant(substitute(longhandText, converts), declaration.important())));
        writeBase(scope, fragment);
        attachComments(declaration, fragment);
        decl.markBoundary();
    }

    /**
     * Replaces placeholders with their converted expressions. Text that is exactly one placeholder
     * becomes that value; otherwise literals are inlined and other expressions become template parts.
     */
    private StyleValue substitute(String text, Map<Integer, LoweringDecision.Convert> converts) {
        String trimmed = text.trim();
        OptionalInt exact = placeholders.exactId(trimmed);
        if (exact.isPresent() && converts.containsKey(exact.getAsInt())) {
            return convertedValue(converts.get(exact.getAsInt()));
        }
        StringBuilder template = new StringBuilder();
        List<ImportSpec> imports = new ArrayList<>();
        boolean dynamic = false;
        Matcher m = placeholders.anywhere().matcher(trimmed);
        int last = 0;
        while (m.find()) {
            LoweringDecision.Convert convert = converts.get(Integer.parseInt(m.group(1)));
            if (convert == null) continue;
            template.append(escapeTemplate(trimmed.substring(last, m.start())));
            Optional<String> literal = literalText(convert.expr());
            if (literal.isPresent()) {
                template.append(escapeTemplate(literal.get()));
            } else {
                template.append("${").append(convert.expr()).append('}');
                imports.addAll(convert.imports());
                dynamic = true;
            }
            last = m.end();
        }
        template.append(escapeTemplate(trimmed.substring(last)));
        if (!dynamic) {
            return new StyleValue.Str(unescapeTemplate(template.toString()));
        }
        return new StyleValue.Expr("`" + template + "`", imports);
    }

    private static String escapeTemplate(String text) {
        return text.replace("\\", "\\\\").replace("`", "\\`").replace("${", "\\${");
    }

    private static String unescapeTemplate(String text) {
        return text.replace("\\${", "${").replace("\\`", "`").replace("\\\\", "\\");
    }

    private static Optional<String> literalText(String expr) {
        Optional<JsNode> node = JsParser.tryParse(expr);
        if (node.isEmpty()) return Optional.empty();
        if (node.get() instanceof JsNode.NumberLiteral n) {
            return Optional.of(n.raw());
        }
        if (node.get() instanceof JsNode.TaggedTemplate) {
            return Optional.empty();
        }
        return BranchFragments.staticText(node.get());
    }

    private static StyleValue convertedValue(LoweringDecision.Convert convert) {
        Optional<JsNode> node = JsParser.tryParse(convert.expr());
        if (node.isPresent() && node.get() instanceof JsNode.NumberLiteral n) {
            return new StyleValue.Num(n.raw());
        }
        if (node.isPresent() && !(node.get() instanceof JsNode.TaggedTemplate)) {
            Optional<String> text = BranchFragments.staticText(node.get());
            if (text.isPresent()) {
                return StyleFragments.literal(text.get());
            }
        }
        return new StyleValue.Expr(convert.expr(), convert.imports());
    }

    /**
     * Carries the declaration's {@code !important} onto every value of a conditional fragment.
     */
    private static Map<String, StyleValue> important(Map<String, StyleValue> style, CssDeclaration declaration) {
        if (!declaration.important()) {
            return style;
        }
        Map<String, StyleValue> result = new LinkedHashMap<>();
        style.forEach((property, value) -> result.put(property, withImportant(value, true)));
        return result;
    }

    private static StyleValue withImportant(StyleValue value, boolean important) {
        if (!important) {
            return value;
        }
        if (value instanceof StyleValue.Expr e) {
            return new StyleValue.Expr("`${" + e.source() + "} !important`", e.imports());
        }
        if (value instanceof StyleValue.Num n) {
            return new StyleValue.Str(n.raw() + " !important");
        }
        if (value instanceof StyleValue.Str s) {
            return new StyleValue.Str(s.value() + " !important");
        }
        return value;
    }

    // --- scopes ---

    private Optional<Scope> resolveScope(CssRule rule) {
        List<String> atRules = new ArrayList<>();
        for (String atRule : rule.atRuleStack()) {
            Optional<String> resolved = resolveAtRule(rule, atRule);
            if (resolved.isEmpty()) {
                return Optional.empty();
            }
            atRules.add(resolved.get());
        }
        String selector = rule.selector().trim();
        if (placeholders.containsAny(selector)) {
            reportBail(rule, null, selectorBail(rule, selector), selectorLocation(selector));
            return Optional.empty();
        }
        List<List<String>> paths = new ArrayList<>();
        if (ROOT_SELECTOR.equals(selector)) {
            paths.add(atRules);
            return Optional.of(new Scope(paths));
        }
        for (String part : selector.split(",")) {
            Matcher pseudo = PSEUDO_SELECTOR.matcher(part.trim());
            if (!pseudo.matches()) {
                reportBail(rule, null, new LoweringDecision.Bail(
                        "selector '" + selector + "' has no static equivalent", WarningCategory.UNSUPPORTED_SELECTOR),
                        SourceLocation.UNKNOWN);
                return Optional.empty();
            }
            List<String> path = new ArrayList<>(atRules);
            path.add(pseudo.group(1));
            paths.add(path);
        }
        return Optional.of(new Scope(paths));
    }

    private LoweringDecision.Bail selectorBail(CssRule rule, String selector) {
        Matcher m = placeholders.anywhere().matcher(selector);
        while (m.find()) {
            Slot slot = slots.get(Integer.parseInt(m.group(1)));
            if (slot == null) continue;
            LoweringDecision decision = classifier.classify(slot.expression(),
                    DynamicContext.selector(rule.selector(), rule.atRuleStack()));
            if (decision instanceof LoweringDecision.Bail bail) {
                return bail;
            }
        }
        return new LoweringDecision.Bail("selector '" + selector + "' has no static equivalent",
                WarningCategory.UNSUPPORTED_SELECTOR);
    }

    private SourceLocation selectorLocation(String selector) {
        Matcher m = placeholders.anywhere().matcher(selector);
        if (m.find()) {
            Slot slot = slots.get(Integer.parseInt(m.group(1)));
            if (slot != null) return slot.location();
        }
        return SourceLocation.UNKNOWN;
    }

    private Optional<String> resolveAtRule(CssRule rule, String atRule) {
        StringBuilder resolved = new StringBuilder();
        Matcher m = placeholders.anywhere().matcher(atRule);
        int last = 0;
        while (m.find()) {
            Slot slot = slots.get(Integer.parseInt(m.group(1)));
            if (slot == null) continue;
            LoweringDecision decision = classifier.classify(slot.expression(),
                    DynamicContext.atRuleParams(rule.selector(), rule.atRuleStack()));
            if (decision instanceof LoweringDecision.Bail bail) {
                reportBail(rule, null, bail, slot.location());
                return Optional.empty();
            }
            if (!(decision instanceof LoweringDecision.Convert convert)) {
                reportBail(rule, null, new LoweringDecision.Bail(
                        "dynamic at-rule parameters cannot be lowered: " + slot.source()), slot.location());
                return Optional.empty();
            }
            decl.addImports(convert.imports());
            resolved.append(atRule, last, m.start());
            resolved.append(literalText(convert.expr()).orElse("${" + convert.expr() + "}"));
            last = m.end();
        }
        resolved.append(atRule.substring(last));
        String text = resolved.toString().trim();
        String name = text.split("\\s+", 2)[0];
        if (!NESTABLE_AT_RULES.contains(name)) {
            reportBail(rule, null, new LoweringDecision.Bail(
                    "at-rule '" + name + "' cannot be nested in a style", WarningCategory.UNSUPPORTED_SELECTOR),
                    SourceLocation.UNKNOWN);
            return Optional.empty();
        }
        return Optional.of(text);
    }

    // --- writes ---

    private void writeBase(Scope scope, Map<String, StyleValue> fragment) {
        writeAll(decl.styleObj(), scope, fragment);
    }

    private void writeAll(Map<String, StyleValue> target, Scope scope, Map<String, StyleValue> fragment) {
        for (List<String> path : scope.paths()) {
            fragment.forEach((property, value) -> {
                writeAt(target, property, value, path);
                collectImports(value);
            });
        }
    }

    private void collectImports(StyleValue value) {
        if (value instanceof StyleValue.Expr e) {
            decl.addImports(e.imports());
        } else if (value instanceof StyleValue.Nested n) {
            n.entries().values().forEach(this::collectImports);
        }
    }

    /**
     * Writes {@code value} at {@code map[key][path...]}. Entering a nested level seeds its
     * {@code default} from the value previously held there, or null.
     */
    static void writeAt(Map<String, StyleValue> map, String key, StyleValue value, List<String> path) {
        StyleValue existing = map.get(key);
        if (path.isEmpty()) {
            if (existing instanceof StyleValue.Nested nested) {
                nested.entries().put(StyleValue.DEFAULT_KEY, value);
            } else {
                map.put(key, value);
            }
            return;
        }
        StyleValue.Nested nested;
        if (existing instanceof StyleValue.Nested n) {
            nested = n;
        } else {
            nested = StyleValue.Nested.seededWith(existing == null ? StyleValue.NULL : existing);
            map.put(key, nested);
        }
        writeAt(nested.entries(), path.get(0), value, path.subList(1, path.size()));
    }

    private void reportBail(CssRule rule, CssDeclaration declaration, LoweringDecision.Bail bail, SourceLocation location) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("component", decl.name());
        if (declaration != null && !declaration.property().isEmpty()) {
            context.put("property", declaration.property());
        }
        context.put("selector", rule.selector());
        // unparsed slots were already reported by the template scanner
        if (bail.category() != WarningCategory.PARSE_ERROR) {
            decl.warnings().report(bail.category(), bail.reason(), location, context);
        }
        decl.bail(bail.reason());
    }
}
