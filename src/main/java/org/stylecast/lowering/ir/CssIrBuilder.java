package org.stylecast.lowering.ir;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.frontend.css.CssNode;
import org.stylecast.lowering.frontend.css.CssTreeParser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes a CSS parse tree plus its slots into an ordered list of {@link CssRule}s.
 * <p>
 * The builder runs in two passes. The tree walk attaches comments, splits values
 * into static text and slot references and merges rules with the same
 * (selector, at-rule stack). The recovery pass then scans the raw template text
 * for placeholders the parser dropped and re-adds them as standalone block
 * declarations on the root rule.
 */
public class CssIrBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(CssIrBuilder.class);
    private static final Pattern IMPORTANT = Pattern.compile("!important\\s*$", Pattern.CASE_INSENSITIVE);
    private static final String ROOT_SELECTOR = "&";

    private final Placeholders placeholders;
    private final boolean recoverDroppedPlaceholders;

    // per-build state
    private final Map<String, RuleBuilder> rules = new LinkedHashMap<>();
    private final Deque<String> atRuleStack = new ArrayDeque<>();
    private Map<Integer, Slot> slotsById = new HashMap<>();
    private String rawText = "";
    private int commentCursor = 0;
    private String pendingComment;
    private RuleBuilder lastRule;

    /**
     * @param placeholders               Placeholder naming in use.
     * @param recoverDroppedPlaceholders Whether to run the recovery pass.
     */
    public CssIrBuilder(Placeholders placeholders, boolean recoverDroppedPlaceholders) {
        this.placeholders = placeholders;
        this.recoverDroppedPlaceholders = recoverDroppedPlaceholders;
    }

    /**
     * Builds the IR.
     *
     * @param tree    The parsed CSS tree.
     * @param slots   The template's slots.
     * @param rawText The CSS text the tree was parsed from.
     * @return The rules in order of first appearance.
     */
    public List<CssRule> build(List<CssNode> tree, List<Slot> slots, String rawText) {
        reset(slots, rawText);
        for (CssNode node : tree) {
            visit(node, ROOT_SELECTOR);
        }
        if (recoverDroppedPlaceholders) {
            recoverDroppedSlots();
        }
        List<CssRule> result = new ArrayList<>();
        for (RuleBuilder builder : rules.values()) {
            result.add(new CssRule(builder.selector, builder.atRuleStack, builder.declarations));
        }
        return result;
    }

    private void reset(List<Slot> slots, String text) {
        rules.clear();
        atRuleStack.clear();
        slotsById = new HashMap<>();
        for (Slot slot : slots) {
            slotsById.put(slot.id(), slot);
        }
        rawText = text;
        commentCursor = 0;
        pendingComment = null;
        lastRule = null;
    }

    private void visit(CssNode node, String selector) {
        if (node instanceof CssNode.Comment comment) {
            visitComment(comment.text());
        } else if (node instanceof CssNode.Declaration declaration) {
            addDeclaration(selector, declaration.text());
        } else if (node instanceof CssNode.Rule rule) {
            String resolved = rule.selector().replace(String.valueOf(CssTreeParser.SELECTOR_SENTINEL), "");
            ensureRule(resolved);
            visitBlock(rule.children(), resolved);
        } else if (node instanceof CssNode.AtRule atRule) {
            atRuleStack.addLast(atRule.text());
            visitBlock(atRule.children(), ROOT_SELECTOR);
            atRuleStack.removeLast();
        }
    }

    /**
     * Walks the children of a nested block. Comments inside the block attach only to
     * declarations of that block.
     */
    private void visitBlock(List<CssNode> children, String selector) {
        String outerPending = pendingComment;
        RuleBuilder outerLast = lastRule;
        pendingComment = null;
        lastRule = null;
        for (CssNode child : children) {
            visit(child, selector);
        }
        pendingComment = outerPending;
        lastRule = outerLast;
    }

    private void visitComment(String text) {
        boolean trailing = isConvertedLineComment(text) || isInlineTrailingComment(text);
        String body = commentBody(text);
        if (trailing && lastRule != null && !lastRule.declarations.isEmpty()) {
            int last = lastRule.declarations.size() - 1;
            CssDeclaration previous = lastRule.declarations.get(last);
            lastRule.declarations.set(last, previous.withTrailingLineComment(body));
            return;
        }
        pendingComment = pendingComment == null ? body : pendingComment + "\n" + body;
    }

    /**
     * @param text A block comment including its delimiters.
     * @return The trimmed comment text without {@code /*} and its closer.
     */
    static String commentBody(String text) {
        String body = text;
        if (body.startsWith("/*")) {
            body = body.substring(2);
        }
        if (body.endsWith("*/")) {
            body = body.substring(0, body.length() - 2);
        }
        return body.trim();
    }

    /**
     * The parser turns {@code // text} into a block comment that lacks the space before its closer.
     */
    static boolean isConvertedLineComment(String text) {
        return text.startsWith("/*") && text.endsWith("*/") && !text.endsWith(" */");
    }

    private boolean isInlineTrailingComment(String text) {
        int index = rawText.indexOf(text, commentCursor);
        if (index < 0) return false;
        commentCursor = index + text.length();
        int lineStart = rawText.lastIndexOf('\n', index - 1) + 1;
        return rawText.substring(lineStart, index).trim().endsWith(";");
    }

    private void addDeclaration(String selector, String text) {
        String trimmed = text.trim();

        OptionalInt exact = placeholders.exactId(trimmed);
        if (exact.isPresent() && slotsById.containsKey(exact.getAsInt())) {
            append(selector, CssDeclaration.standalone(slotsById.get(exact.getAsInt())));
            return;
        }

        Matcher leading = placeholders.leading().matcher(trimmed);
        if (leading.matches() && slotsById.containsKey(Integer.parseInt(leading.group(2)))) {
            append(selector, CssDeclaration.standalone(slotsById.get(Integer.parseInt(leading.group(2)))));
            addDeclaration(selector, leading.group(3));
            return;
        }

        int colon = firstUnescapedColon(trimmed);
        if (colon <= 0) {
            LOG.debug("Dropping statement without property: '{}'", trimmed);
            return;
        }
        String property = trimmed.substring(0, colon).trim();
        String rawValue = trimmed.substring(colon + 1).trim();
        if (rawValue.endsWith(";")) {
            rawValue = rawValue.substring(0, rawValue.length() - 1).trim();
        }
        Matcher important = IMPORTANT.matcher(rawValue);
        boolean isImportant = important.find();
        String valueText = isImportant ? rawValue.substring(0, important.start()).trim() : rawValue;

        append(selector, new CssDeclaration(property, parseValue(valueText), isImportant, rawValue, null, null));
    }

    private void append(String selector, CssDeclaration declaration) {
        RuleBuilder rule = ensureRule(selector);
        if (pendingComment != null) {
            declaration = declaration.withLeadingComment(pendingComment);
            pendingComment = null;
        }
        rule.declarations.add(declaration);
        lastRule = rule;
    }

    private CssValue parseValue(String text) {
        List<CssValue.Part> parts = new ArrayList<>();
        Matcher m = placeholders.anywhere().matcher(text);
        int last = 0;
        while (m.find()) {
            int id = Integer.parseInt(m.group(1));
            if (!slotsById.containsKey(id)) continue;
            if (m.start() > last) {
                parts.add(new CssValue.Text(text.substring(last, m.start())));
            }
            parts.add(new CssValue.SlotRef(id));
            last = m.end();
        }
        if (last < text.length()) {
            parts.add(new CssValue.Text(text.substring(last)));
        }
        return CssValue.of(parts);
    }

    private RuleBuilder ensureRule(String selector) {
        List<String> stack = List.copyOf(atRuleStack);
        String key = selector + '\u0000' + String.join("\u0001", stack);
        return rules.computeIfAbsent(key, k -> new RuleBuilder(selector, stack));
    }

    private void recoverDroppedSlots() {
        Set<Integer> represented = new HashSet<>();
        for (RuleBuilder rule : rules.values()) {
            for (CssDeclaration declaration : rule.declarations) {
                represented.addAll(declaration.value().slotIds());
            }
        }
        int depth = 0;
        for (String line : rawText.split("\n", -1)) {
            if (depth == 0) {
                OptionalInt id = placeholders.standaloneLineId(line.trim());
                if (id.isPresent() && slotsById.containsKey(id.getAsInt()) && represented.add(id.getAsInt())) {
                    LOG.debug("Recovered dropped interpolation {}", placeholders.placeholder(id.getAsInt()));
                    atRuleStack.clear();
                    RuleBuilder root = ensureRule(ROOT_SELECTOR);
                    root.declarations.add(CssDeclaration.standalone(slotsById.get(id.getAsInt())));
                }
            }
            for (char c : line.toCharArray()) {
                if (c == '{') depth++;
                else if (c == '}') depth = Math.max(0, depth - 1);
            }
        }
    }

    private static int firstUnescapedColon(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ':' && (i == 0 || text.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }

    private static final class RuleBuilder {
        private final String selector;
        private final List<String> atRuleStack;
        private final List<CssDeclaration> declarations = new ArrayList<>();

        private RuleBuilder(String selector, List<String> atRuleStack) {
            this.selector = selector;
            this.atRuleStack = atRuleStack;
        }
    }
}
