package org.stylecast.lowering.frontend.js;

/**
 * Defines the token types the {@link JsLexer} recognizes.
 */
public enum JsTokenType {
    // Grouping.
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET,

    // Punctuation.
    DOT, QUESTION_DOT, SPREAD, COMMA, COLON, SEMICOLON, QUESTION, ARROW, EQUAL,

    // Operators.
    BANG, AND_AND, OR_OR, NULLISH,
    EQ_EQ, EQ_EQ_EQ, BANG_EQ, BANG_EQ_EQ,
    LESS, LESS_EQ, GREATER, GREATER_EQ,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // Literals.
    /** An identifier or keyword. */
    IDENTIFIER,
    /** A quoted string; the value is the unescaped content. */
    STRING,
    /** A numeric literal; the text is kept raw. */
    NUMBER,
    /** A template literal; the value is a {@link TemplateLiterals.Parts}. */
    TEMPLATE,

    /** Represents the end of the source. */
    END_OF_FILE
}
