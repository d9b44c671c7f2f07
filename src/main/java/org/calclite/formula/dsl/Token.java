package org.calclite.formula.dsl;

/**
 * Represents a token produced by the formula lexer.
 * 
 * @param kind     The token kind
 * @param text     The normalized token text (brackets and quotes stripped)
 * @param position The offset of the token in the source formula
 */
public record Token(TokenKind kind, String text, int position) {

    public enum TokenKind {
        // Literals
        STRING, // 'East' or "East"
        INTEGER, // 42
        REAL, // 3.14
        BOOLEAN, // TRUE, FALSE
        NULL, // NULL

        // References
        FIELD_REF, // [Sales]
        IDENTIFIER, // SUM, DATEADD

        // Arithmetic
        PLUS, // +
        MINUS, // -
        STAR, // *
        SLASH, // /
        PERCENT, // %
        CARET, // ^

        // Comparison
        EQUALS, // = or ==
        NOT_EQUALS, // != or <>
        LESS_THAN, // <
        LESS_THAN_EQ, // <=
        GREATER_THAN, // >
        GREATER_THAN_EQ, // >=

        // Keywords
        IF,
        THEN,
        ELSEIF,
        ELSE,
        END,
        CASE,
        WHEN,
        AND,
        OR,
        NOT,

        // Level of detail scopes
        FIXED,
        INCLUDE,
        EXCLUDE,

        // Delimiters
        LPAREN, // (
        RPAREN, // )
        LBRACE, // {
        RBRACE, // }
        COMMA, // ,
        COLON, // :

        // Special
        EOF, // End of input
        UNKNOWN, // Unrecognized character
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + (text != null && !text.isEmpty() ? "(" + text + ")" : "") + "@" + position;
    }
}
