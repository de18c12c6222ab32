package org.stylecast.lowering.frontend.js;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts expression source into a list of {@link JsToken}s.
 * Template literals are kept whole; their interpolations are parsed lazily by the parser.
 */
public class JsLexer {

    private final String source;
    private final List<JsToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new lexer.
     * @param source The expression source.
     */
    public JsLexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return The recognized tokens, terminated by {@link JsTokenType#END_OF_FILE}.
     * @throws JsSyntaxException on characters outside the supported subset.
     */
    public List<JsToken> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new JsToken(JsTokenType.END_OF_FILE, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t', '\n':
                break;
            case '(': addToken(JsTokenType.LEFT_PAREN); break;
            case ')': addToken(JsTokenType.RIGHT_PAREN); break;
            case '{': addToken(JsTokenType.LEFT_BRACE); break;
            case '}': addToken(JsTokenType.RIGHT_BRACE); break;
            case '[': addToken(JsTokenType.LEFT_BRACKET); break;
            case ']': addToken(JsTokenType.RIGHT_BRACKET); break;
            case ',': addToken(JsTokenType.COMMA); break;
            case ':': addToken(JsTokenType.COLON); break;
            case ';': addToken(JsTokenType.SEMICOLON); break;
            case '+': addToken(JsTokenType.PLUS); break;
            case '-': addToken(JsTokenType.MINUS); break;
            case '*': addToken(JsTokenType.STAR); break;
            case '%': addToken(JsTokenType.PERCENT); break;
            case '.':
                if (isDigit(peek())) {
                    number();
                } else if (match("..")) {
                    addToken(JsTokenType.SPREAD);
                } else {
                    addToken(JsTokenType.DOT);
                }
                break;
            case '?':
                if (match("?")) {
                    addToken(JsTokenType.NULLISH);
                } else if (peek() == '.' && !isDigit(peekNext())) {
                    advance();
                    addToken(JsTokenType.QUESTION_DOT);
                } else {
                    addToken(JsTokenType.QUESTION);
                }
                break;
            case '=':
                if (match("==")) addToken(JsTokenType.EQ_EQ_EQ);
                else if (match("=")) addToken(JsTokenType.EQ_EQ);
                else if (match(">")) addToken(JsTokenType.ARROW);
                else addToken(JsTokenType.EQUAL);
                break;
            case '!':
                if (match("==")) addToken(JsTokenType.BANG_EQ_EQ);
                else if (match("=")) addToken(JsTokenType.BANG_EQ);
                else addToken(JsTokenType.BANG);
                break;
            case '<': addToken(match("=") ? JsTokenType.LESS_EQ : JsTokenType.LESS); break;
            case '>': addToken(match("=") ? JsTokenType.GREATER_EQ : JsTokenType.GREATER); break;
            case '&':
                if (!match("&")) throw error("Unsupported operator '&'");
                addToken(JsTokenType.AND_AND);
                break;
            case '|':
                if (!match("|")) throw error("Unsupported operator '|'");
                addToken(JsTokenType.OR_OR);
                break;
            case '/':
                if (match("/")) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match("*")) {
                    int end = source.indexOf("*/", current);
                    if (end < 0) throw error("Unterminated comment");
                    current = end + 2;
                } else {
                    addToken(JsTokenType.SLASH);
                }
                break;
            case '"', '\'':
                string(c);
                break;
            case '`':
                template();
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
                break;
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        addToken(JsTokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }
        addToken(JsTokenType.NUMBER);
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') throw error("Unterminated string");
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case 'r': value.append('\r'); break;
                    case 'u':
                        if (current + 4 > source.length()) throw error("Bad unicode escape");
                        value.append((char) Integer.parseInt(source.substring(current, current + 4), 16));
                        current += 4;
                        break;
                    default: value.append(escaped); break;
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(JsTokenType.STRING, value.toString());
    }

    private void template() {
        int end = TemplateLiterals.findClosingBacktick(source, current);
        if (end < 0) throw error("Unterminated template literal");
        TemplateLiterals.Parts parts = TemplateLiterals.split(source.substring(current, end));
        current = end + 1;
        addToken(JsTokenType.TEMPLATE, parts);
    }

    private boolean match(String expected) {
        if (!source.startsWith(expected, current)) return false;
        current += expected.length();
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private void addToken(JsTokenType type) {
        addToken(type, null);
    }

    private void addToken(JsTokenType type, Object value) {
        tokens.add(new JsToken(type, source.substring(start, current), value, start));
    }

    private JsSyntaxException error(String message) {
        return new JsSyntaxException(message, start);
    }
}
