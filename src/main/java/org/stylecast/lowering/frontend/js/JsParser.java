package org.stylecast.lowering.frontend.js;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for interpolation expressions. Consumes the tokens of
 * the {@link JsLexer} and produces a {@link JsNode}.
 */
public class JsParser {

    private static final Logger LOG = LoggerFactory.getLogger(JsParser.class);

    private final List<JsToken> tokens;
    private int current = 0;

    /**
     * Constructs a parser over the given source.
     * @param source The expression source.
     * @throws JsSyntaxException if the source cannot be tokenized.
     */
    public JsParser(String source) {
        this.tokens = new JsLexer(source).scanTokens();
    }

    /**
     * Parses a complete expression source.
     * @param source The expression source.
     * @return The expression.
     * @throws JsSyntaxException if the source is not a single supported expression.
     */
    public static JsNode parse(String source) {
        return new JsParser(source).parseExpression();
    }

    /**
     * Parses a complete expression source, reporting failure as an empty result.
     * @param source The expression source.
     * @return The expression, or empty if it does not parse.
     */
    public static Optional<JsNode> tryParse(String source) {
        try {
            return Optional.of(parse(source));
        } catch (JsSyntaxException | IllegalArgumentException e) {
            LOG.debug("Expression '{}' does not parse: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses the token stream as one expression, optionally followed by a semicolon.
     * @return The expression.
     */
    public JsNode parseExpression() {
        JsNode expression = expression();
        match(JsTokenType.SEMICOLON);
        if (!isAtEnd()) {
            throw error("Unexpected '" + peek().text() + "' after expression");
        }
        return expression;
    }

    private JsNode expression() {
        if (check(JsTokenType.IDENTIFIER) && checkNext(JsTokenType.ARROW)) {
            String name = advance().text();
            advance();
            return new JsNode.ArrowFunction(List.of(new JsNode.IdentifierParam(name, null)), arrowBody());
        }
        if (check(JsTokenType.LEFT_PAREN) && isArrowAhead()) {
            List<JsNode.Param> params = parameters();
            consume(JsTokenType.ARROW, "Expected '=>'");
            return new JsNode.ArrowFunction(params, arrowBody());
        }
        return conditional();
    }

    private JsNode arrowBody() {
        if (match(JsTokenType.LEFT_BRACE)) {
            if (!(check(JsTokenType.IDENTIFIER) && "return".equals(peek().text()))) {
                throw error("Only single 'return' block bodies are supported");
            }
            advance();
            JsNode body = expression();
            match(JsTokenType.SEMICOLON);
            consume(JsTokenType.RIGHT_BRACE, "Expected '}' after return statement");
            return body;
        }
        return expression();
    }

    private boolean isArrowAhead() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            JsTokenType type = tokens.get(i).type();
            if (type == JsTokenType.LEFT_PAREN) {
                depth++;
            } else if (type == JsTokenType.RIGHT_PAREN) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).type() == JsTokenType.ARROW;
                }
            } else if (type == JsTokenType.END_OF_FILE) {
                return false;
            }
        }
        return false;
    }

    private List<JsNode.Param> parameters() {
        consume(JsTokenType.LEFT_PAREN, "Expected '('");
        List<JsNode.Param> params = new ArrayList<>();
        while (!check(JsTokenType.RIGHT_PAREN)) {
            params.add(parameter());
            if (!match(JsTokenType.COMMA)) break;
        }
        consume(JsTokenType.RIGHT_PAREN, "Expected ')' after parameters");
        return params;
    }

    private JsNode.Param parameter() {
        if (match(JsTokenType.LEFT_BRACE)) {
            List<JsNode.PatternProperty> properties = new ArrayList<>();
            String rest = null;
            while (!check(JsTokenType.RIGHT_BRACE)) {
                if (match(JsTokenType.SPREAD)) {
                    rest = consume(JsTokenType.IDENTIFIER, "Expected rest name").text();
                } else {
                    String key = consume(JsTokenType.IDENTIFIER, "Expected property name in pattern").text();
                    String local = key;
                    if (match(JsTokenType.COLON)) {
                        local = consume(JsTokenType.IDENTIFIER, "Nested patterns are not supported").text();
                    }
                    JsNode defaultValue = match(JsTokenType.EQUAL) ? conditional() : null;
                    properties.add(new JsNode.PatternProperty(key, local, defaultValue));
                }
                if (!match(JsTokenType.COMMA)) break;
            }
            consume(JsTokenType.RIGHT_BRACE, "Expected '}' after pattern");
            skipTypeAnnotation();
            // `= {}` default for the whole pattern carries no information
            if (match(JsTokenType.EQUAL)) {
                consume(JsTokenType.LEFT_BRACE, "Expected '{}' as pattern default");
                consume(JsTokenType.RIGHT_BRACE, "Expected '{}' as pattern default");
            }
            return new JsNode.ObjectPatternParam(properties, rest);
        }
        String name = consume(JsTokenType.IDENTIFIER, "Expected parameter name").text();
        skipTypeAnnotation();
        JsNode defaultValue = match(JsTokenType.EQUAL) ? conditional() : null;
        return new JsNode.IdentifierParam(name, defaultValue);
    }

    private void skipTypeAnnotation() {
        if (!match(JsTokenType.COLON)) return;
        int depth = 0;
        while (!isAtEnd()) {
            JsTokenType type = peek().type();
            if (depth == 0 && (type == JsTokenType.COMMA || type == JsTokenType.RIGHT_PAREN || type == JsTokenType.EQUAL)) {
                return;
            }
            switch (type) {
                case LEFT_PAREN, LEFT_BRACE, LEFT_BRACKET, LESS -> depth++;
                case RIGHT_PAREN, RIGHT_BRACE, RIGHT_BRACKET, GREATER -> depth--;
                default -> { }
            }
            advance();
        }
    }

    private JsNode conditional() {
        JsNode test = nullish();
        if (match(JsTokenType.QUESTION)) {
            JsNode consequent = expression();
            consume(JsTokenType.COLON, "Expected ':' in conditional expression");
            JsNode alternate = expression();
            return new JsNode.ConditionalExpr(test, consequent, alternate);
        }
        return test;
    }

    private JsNode nullish() {
        JsNode left = or();
        while (match(JsTokenType.NULLISH)) {
            left = new JsNode.LogicalExpr("??", left, or());
        }
        return left;
    }

    private JsNode or() {
        JsNode left = and();
        while (match(JsTokenType.OR_OR)) {
            left = new JsNode.LogicalExpr("||", left, and());
        }
        return left;
    }

    private JsNode and() {
        JsNode left = equality();
        while (match(JsTokenType.AND_AND)) {
            left = new JsNode.LogicalExpr("&&", left, equality());
        }
        return left;
    }

    private JsNode equality() {
        JsNode left = relational();
        while (match(JsTokenType.EQ_EQ_EQ, JsTokenType.BANG_EQ_EQ, JsTokenType.EQ_EQ, JsTokenType.BANG_EQ)) {
            String operator = previous().text();
            left = new JsNode.BinaryExpr(operator, left, relational());
        }
        return left;
    }

    private JsNode relational() {
        JsNode left = additive();
        while (match(JsTokenType.LESS, JsTokenType.LESS_EQ, JsTokenType.GREATER, JsTokenType.GREATER_EQ)) {
            String operator = previous().text();
            left = new JsNode.BinaryExpr(operator, left, additive());
        }
        return left;
    }

    private JsNode additive() {
        JsNode left = multiplicative();
        while (match(JsTokenType.PLUS, JsTokenType.MINUS)) {
            String operator = previous().text();
            left = new JsNode.BinaryExpr(operator, left, multiplicative());
        }
        return left;
    }

    private JsNode multiplicative() {
        JsNode left = unary();
        while (match(JsTokenType.STAR, JsTokenType.SLASH, JsTokenType.PERCENT)) {
            String operator = previous().text();
            left = new JsNode.BinaryExpr(operator, left, unary());
        }
        return left;
    }

    private JsNode unary() {
        if (match(JsTokenType.BANG, JsTokenType.MINUS, JsTokenType.PLUS)) {
            String operator = previous().text();
            return new JsNode.UnaryExpr(operator, unary());
        }
        if (check(JsTokenType.IDENTIFIER) && "typeof".equals(peek().text())) {
            advance();
            return new JsNode.UnaryExpr("typeof", unary());
        }
        return postfix();
    }

    private JsNode postfix() {
        JsNode expression = primary();
        while (true) {
            if (match(JsTokenType.DOT)) {
                String name = consume(JsTokenType.IDENTIFIER, "Expected property name after '.'").text();
                expression = new JsNode.MemberExpr(expression, name, null, false);
            } else if (match(JsTokenType.QUESTION_DOT)) {
                if (match(JsTokenType.LEFT_BRACKET)) {
                    JsNode index = expression();
                    consume(JsTokenType.RIGHT_BRACKET, "Expected ']'");
                    expression = new JsNode.MemberExpr(expression, null, index, true);
                } else {
                    String name = consume(JsTokenType.IDENTIFIER, "Expected property name after '?.'").text();
                    expression = new JsNode.MemberExpr(expression, name, null, true);
                }
            } else if (match(JsTokenType.LEFT_BRACKET)) {
                JsNode index = expression();
                consume(JsTokenType.RIGHT_BRACKET, "Expected ']'");
                expression = new JsNode.MemberExpr(expression, null, index, false);
            } else if (match(JsTokenType.LEFT_PAREN)) {
                List<JsNode> arguments = new ArrayList<>();
                while (!check(JsTokenType.RIGHT_PAREN)) {
                    arguments.add(expression());
                    if (!match(JsTokenType.COMMA)) break;
                }
                consume(JsTokenType.RIGHT_PAREN, "Expected ')' after arguments");
                expression = new JsNode.CallExpr(expression, arguments);
            } else if (match(JsTokenType.TEMPLATE)) {
                expression = new JsNode.TaggedTemplate(expression, template(previous()));
            } else {
                return expression;
            }
        }
    }

    private JsNode primary() {
        if (match(JsTokenType.NUMBER)) return new JsNode.NumberLiteral(previous().text());
        if (match(JsTokenType.STRING)) return new JsNode.StringLiteral((String) previous().value());
        if (match(JsTokenType.TEMPLATE)) return template(previous());
        if (match(JsTokenType.IDENTIFIER)) {
            String name = previous().text();
            switch (name) {
                case "true": return new JsNode.BooleanLiteral(true);
                case "false": return new JsNode.BooleanLiteral(false);
                case "null": return new JsNode.NullLiteral();
                default: return new JsNode.Identifier(name);
            }
        }
        if (match(JsTokenType.LEFT_PAREN)) {
            JsNode inner = expression();
            consume(JsTokenType.RIGHT_PAREN, "Expected ')'");
            return inner;
        }
        throw error("Unexpected token '" + peek().text() + "'");
    }

    private JsNode.TemplateLiteral template(JsToken token) {
        TemplateLiterals.Parts parts = (TemplateLiterals.Parts) token.value();
        List<JsNode> expressions = new ArrayList<>();
        for (String source : parts.expressions()) {
            expressions.add(parse(source));
        }
        return new JsNode.TemplateLiteral(parts.quasis(), expressions);
    }

    // --- token helpers ---

    private boolean match(JsTokenType... types) {
        for (JsTokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(JsTokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(JsTokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type() == type;
    }

    private JsToken advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == JsTokenType.END_OF_FILE;
    }

    private JsToken peek() {
        return tokens.get(current);
    }

    private JsToken previous() {
        return tokens.get(current - 1);
    }

    private JsToken consume(JsTokenType type, String message) {
        if (check(type)) return advance();
        throw error(message + ", got '" + peek().text() + "'");
    }

    private JsSyntaxException error(String message) {
        return new JsSyntaxException(message, peek().offset());
    }
}
