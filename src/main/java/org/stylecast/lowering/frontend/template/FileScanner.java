package org.stylecast.lowering.frontend.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.api.LoweringException;
import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.css.DeclarationBlockParser;
import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsParser;
import org.stylecast.lowering.frontend.js.TemplateLiterals;
import org.stylecast.lowering.style.StyleValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds styled component templates and the file-level bindings they may refer to:
 * <ul>
 *   <li>{@code const X = styled.tag`...`}, {@code styled(Component)`...`} and {@code .attrs(...)} forms,</li>
 *   <li>{@code const x = css`...`} and {@code const x = keyframes`...`},</li>
 *   <li>single-line ternary helpers {@code const f = (v) => v ? "a" : "b"}.</li>
 * </ul>
 */
public class FileScanner {

    private static final Logger LOG = LoggerFactory.getLogger(FileScanner.class);
    private static final Pattern DECLARATION = Pattern.compile(
            "(?:export\\s+)?(?:const|let|var)\\s+([A-Za-z_$][\\w$]*)\\s*(?::[^=\\n]+)?=\\s*");
    private static final Pattern STYLED_TAG = Pattern.compile("\\Gstyled\\.([A-Za-z][\\w]*)");
    private static final Pattern STYLED_CALL = Pattern.compile("\\Gstyled\\s*\\(");
    private static final Pattern CHAIN_CALL = Pattern.compile("\\G\\s*\\.(attrs|withConfig)\\s*(?:<[^>]*>)?\\s*\\(");
    private static final Pattern TYPE_ARGUMENTS = Pattern.compile("\\G\\s*<[^`]*?>\\s*(?=`)");
    private static final Pattern HELPER_TAG = Pattern.compile("\\G(css|keyframes)\\s*(?:<[^>]*>)?\\s*(?=`)");

    private final TemplateScanner templateScanner;

    public FileScanner(TemplateScanner templateScanner) {
        this.templateScanner = templateScanner;
    }

    /**
     * Scans a file.
     * @param source   The file contents.
     * @param fileName The logical file name, for error messages.
     * @return The components and scope.
     * @throws LoweringException if a template literal or call is not terminated.
     */
    public ScannedFile scan(String source, String fileName) throws LoweringException {
        List<StyledComponentSource> components = new ArrayList<>();
        Set<String> keyframes = new HashSet<>();
        Map<String, CssHelper> cssHelpers = new HashMap<>();
        Set<String> componentNames = new HashSet<>();
        Map<String, TernaryHelper> ternaryHelpers = new HashMap<>();

        Matcher declaration = DECLARATION.matcher(source);
        while (declaration.find()) {
            String name = declaration.group(1);
            int pos = declaration.end();

            Matcher helper = HELPER_TAG.matcher(source).region(pos, source.length());
            if (helper.lookingAt()) {
                int backtick = helper.end();
                String body = templateBody(source, backtick, name, fileName);
                if ("keyframes".equals(helper.group(1))) {
                    keyframes.add(name);
                } else {
                    cssHelpers.put(name, new CssHelper(name, staticStyle(body).orElse(null)));
                }
                continue;
            }

            Optional<String> target = styledTarget(source, pos, fileName);
            if (target.isPresent()) {
                int backtick = afterStyledTarget(source, pos, fileName);
                if (backtick < source.length() && source.charAt(backtick) == '`') {
                    String body = templateBody(source, backtick, name, fileName);
                    components.add(new StyledComponentSource(name, target.get(), body,
                            SourceLines.locate(source, backtick + 1, new SourceLocation(1, 1))));
                    componentNames.add(name);
                }
                continue;
            }

            ternaryHelper(name, source, pos).ifPresent(h -> ternaryHelpers.put(name, h));
        }

        LOG.debug("Scanned {}: {} component(s), {} keyframes, {} css helper(s), {} ternary helper(s)",
                fileName, components.size(), keyframes.size(), cssHelpers.size(), ternaryHelpers.size());
        return new ScannedFile(components, new FileScope(keyframes, cssHelpers, componentNames, ternaryHelpers));
    }

    private Optional<String> styledTarget(String source, int pos, String fileName) throws LoweringException {
        Matcher tag = STYLED_TAG.matcher(source).region(pos, source.length());
        if (tag.lookingAt()) {
            return Optional.of(tag.group(1));
        }
        Matcher call = STYLED_CALL.matcher(source).region(pos, source.length());
        if (call.lookingAt()) {
            int close = closingParen(source, call.end() - 1, fileName);
            return Optional.of(source.substring(call.end(), close).trim());
        }
        return Optional.empty();
    }

    /**
     * @return Index of the template's opening backtick, or of whatever follows the styled chain.
     */
    private int afterStyledTarget(String source, int pos, String fileName) throws LoweringException {
        int index;
        Matcher tag = STYLED_TAG.matcher(source).region(pos, source.length());
        if (tag.lookingAt()) {
            index = tag.end();
        } else {
            Matcher call = STYLED_CALL.matcher(source).region(pos, source.length());
            call.lookingAt();
            index = closingParen(source, call.end() - 1, fileName) + 1;
        }
        while (true) {
            Matcher chain = CHAIN_CALL.matcher(source).region(index, source.length());
            if (!chain.lookingAt()) break;
            index = closingParen(source, chain.end() - 1, fileName) + 1;
        }
        Matcher typeArguments = TYPE_ARGUMENTS.matcher(source).region(index, source.length());
        if (typeArguments.lookingAt()) {
            index = typeArguments.end();
        }
        while (index < source.length() && Character.isWhitespace(source.charAt(index))) index++;
        return index;
    }

    private String templateBody(String source, int backtick, String name, String fileName) throws LoweringException {
        int end = TemplateLiterals.findClosingBacktick(source, backtick + 1);
        if (end < 0) {
            SourceLocation at = SourceLines.locate(source, backtick, new SourceLocation(1, 1));
            throw new LoweringException("Unterminated template literal for '" + name + "' in " + fileName + " at " + at);
        }
        return source.substring(backtick + 1, end);
    }

    private Optional<Map<String, StyleValue>> staticStyle(String body) {
        try {
            StyledTemplate template = templateScanner.scan(body, SourceLocation.UNKNOWN, new WarningCollector());
            if (!template.slots().isEmpty()) {
                return Optional.empty();
            }
            return DeclarationBlockParser.parse(template.rawCss());
        } catch (IllegalArgumentException e) {
            LOG.debug("css helper body is not scannable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TernaryHelper> ternaryHelper(String name, String source, int pos) {
        int end = pos;
        while (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != ';') end++;
        Optional<JsNode> parsed = JsParser.tryParse(source.substring(pos, end));
        if (parsed.isEmpty() || !(parsed.get() instanceof JsNode.ArrowFunction arrow) || arrow.params().size() != 1
                || !(arrow.params().get(0) instanceof JsNode.IdentifierParam param)
                || !(arrow.body() instanceof JsNode.ConditionalExpr ternary)
                || !(ternary.test() instanceof JsNode.Identifier test)
                || !test.name().equals(param.name())
                || !isLiteral(ternary.consequent()) || !isLiteral(ternary.alternate())) {
            return Optional.empty();
        }
        return Optional.of(new TernaryHelper(name, ternary.consequent(), ternary.alternate()));
    }

    private static boolean isLiteral(JsNode node) {
        return node instanceof JsNode.StringLiteral
                || node instanceof JsNode.NumberLiteral
                || (node instanceof JsNode.TemplateLiteral t && t.isStatic());
    }

    private static int closingParen(String source, int open, String fileName) throws LoweringException {
        int depth = 0;
        int i = open;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'') {
                int close = source.indexOf(c, i + 1);
                while (close > 0 && source.charAt(close - 1) == '\\') close = source.indexOf(c, close + 1);
                if (close < 0) break;
                i = close + 1;
                continue;
            }
            if (c == '`') {
                int close = TemplateLiterals.findClosingBacktick(source, i + 1);
                if (close < 0) break;
                i = close + 1;
                continue;
            }
            if (c == '(') depth++;
            if (c == ')' && --depth == 0) return i;
            i++;
        }
        throw new LoweringException("Unterminated call in " + fileName + " at " + SourceLines.locate(source, open, new SourceLocation(1, 1)));
    }
}
