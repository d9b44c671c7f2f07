package org.calclite.formula.dsl;

import org.calclite.formula.dsl.Token.TokenKind;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Lexer for the calculation language.
 * Converts a formula string into a list of tokens.
 * 
 * Rules are tried in table order at each position and the first match wins,
 * so the order of {@link #RULES} is significant:
 * <ol>
 * <li>containers (strings, field references) come before anything that could
 * match inside them</li>
 * <li>decimal numbers come before integers</li>
 * <li>two-character operators come before their one-character prefixes</li>
 * <li>keywords come before the identifier rule and only match whole words</li>
 * </ol>
 * Characters no rule accepts become {@link TokenKind#UNKNOWN} tokens; the lexer
 * never fails.
 */
public final class FormulaLexer {

    static final ImmutableList<LexRule> RULES = Lists.immutable.of(
            // Containers
            LexRule.token(TokenKind.STRING, "\"(?:[^\"\\\\]|\\\\.|\"\")*\""),
            LexRule.token(TokenKind.STRING, "'(?:[^'\\\\]|\\\\.|'')*'"),
            LexRule.token(TokenKind.FIELD_REF, "\\[(?:[^\\]]|\\]\\])+\\]"),
            LexRule.skip("LINE_COMMENT", "//[^\\n]*"),
            LexRule.skip("BLOCK_COMMENT", "/\\*.*?\\*/"),

            // Numbers
            LexRule.token(TokenKind.REAL, "\\d+\\.\\d+|\\.\\d+"),
            LexRule.token(TokenKind.INTEGER, "\\d+"),

            // Two-character operators
            LexRule.token(TokenKind.LESS_THAN_EQ, "<="),
            LexRule.token(TokenKind.GREATER_THAN_EQ, ">="),
            LexRule.token(TokenKind.NOT_EQUALS, "!=|<>"),
            LexRule.token(TokenKind.EQUALS, "=="),

            // Single-character operators and delimiters
            LexRule.token(TokenKind.PLUS, "\\+"),
            LexRule.token(TokenKind.MINUS, "-"),
            LexRule.token(TokenKind.STAR, "\\*"),
            LexRule.token(TokenKind.SLASH, "/"),
            LexRule.token(TokenKind.PERCENT, "%"),
            LexRule.token(TokenKind.CARET, "\\^"),
            LexRule.token(TokenKind.EQUALS, "="),
            LexRule.token(TokenKind.LESS_THAN, "<"),
            LexRule.token(TokenKind.GREATER_THAN, ">"),
            LexRule.token(TokenKind.LPAREN, "\\("),
            LexRule.token(TokenKind.RPAREN, "\\)"),
            LexRule.token(TokenKind.LBRACE, "\\{"),
            LexRule.token(TokenKind.RBRACE, "\\}"),
            LexRule.token(TokenKind.COMMA, ","),
            LexRule.token(TokenKind.COLON, ":"),

            // Keywords
            LexRule.keyword(TokenKind.IF, "IF"),
            LexRule.keyword(TokenKind.THEN, "THEN"),
            LexRule.keyword(TokenKind.ELSEIF, "ELSEIF"),
            LexRule.keyword(TokenKind.ELSE, "ELSE"),
            LexRule.keyword(TokenKind.END, "END"),
            LexRule.keyword(TokenKind.CASE, "CASE"),
            LexRule.keyword(TokenKind.WHEN, "WHEN"),
            LexRule.keyword(TokenKind.AND, "AND"),
            LexRule.keyword(TokenKind.OR, "OR"),
            LexRule.keyword(TokenKind.NOT, "NOT"),
            LexRule.keyword(TokenKind.FIXED, "FIXED"),
            LexRule.keyword(TokenKind.INCLUDE, "INCLUDE"),
            LexRule.keyword(TokenKind.EXCLUDE, "EXCLUDE"),
            LexRule.keyword(TokenKind.BOOLEAN, "TRUE"),
            LexRule.keyword(TokenKind.BOOLEAN, "FALSE"),
            LexRule.keyword(TokenKind.NULL, "NULL"),

            // Function names and anything else word-like
            LexRule.token(TokenKind.IDENTIFIER, "[A-Za-z_][A-Za-z0-9_]*"));

    private final String input;
    private int position;

    public FormulaLexer(String input) {
        this.input = Objects.requireNonNull(input, "Formula cannot be null");
        this.position = 0;
    }

    /**
     * Tokenizes a formula string.
     * 
     * @param formula The formula text
     * @return Tokens in source order, terminated by a single EOF token
     */
    public static List<Token> tokenize(String formula) {
        return new FormulaLexer(formula).tokenize();
    }

    /**
     * @return The ordered rule table used by every lexer instance
     */
    public static ImmutableList<LexRule> rules() {
        return RULES;
    }

    /**
     * Tokenizes the entire input string.
     * 
     * @return List of tokens
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (position < input.length()) {
            skipWhitespace();
            if (position >= input.length())
                break;

            Token token = nextToken();
            if (token != null) {
                tokens.add(token);
            }
        }

        tokens.add(new Token(TokenKind.EOF, "", input.length()));
        return tokens;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    /**
     * Matches the first applicable rule at the current position.
     * Returns null when the match was a skipped rule (a comment).
     */
    private Token nextToken() {
        int start = position;

        for (LexRule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(input);
            matcher.region(start, input.length());
            matcher.useTransparentBounds(true);
            if (matcher.lookingAt() && matcher.end() > start) {
                position = matcher.end();
                if (rule.isSkipped()) {
                    return null;
                }
                return new Token(rule.kind(), normalize(rule.kind(), matcher.group()), start);
            }
        }

        position++;
        return new Token(TokenKind.UNKNOWN, String.valueOf(input.charAt(start)), start);
    }

    private static String normalize(TokenKind kind, String raw) {
        return switch (kind) {
            case FIELD_REF -> raw.substring(1, raw.length() - 1).replace("]]", "]");
            case STRING -> unescape(raw.substring(1, raw.length() - 1), raw.charAt(0));
            case BOOLEAN, NULL -> raw.toUpperCase(Locale.ROOT);
            default -> raw;
        };
    }

    private static String unescape(String body, char quote) {
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                i++;
                c = body.charAt(i);
                sb.append(switch (c) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> c;
                });
            } else if (c == quote && i + 1 < body.length() && body.charAt(i + 1) == quote) {
                sb.append(quote);
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
