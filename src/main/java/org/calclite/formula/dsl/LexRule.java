package org.calclite.formula.dsl;

import org.calclite.formula.dsl.Token.TokenKind;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One entry of the lexer's ordered rule table.
 * 
 * @param name    Rule name used in diagnostics and tests
 * @param pattern Pattern matched at the current input position
 * @param kind    Kind of the produced token, or null for rules whose match is
 *                discarded (comments)
 */
public record LexRule(String name, Pattern pattern, TokenKind kind) {

    public LexRule {
        Objects.requireNonNull(name, "Rule name cannot be null");
        Objects.requireNonNull(pattern, "Rule pattern cannot be null");
    }

    public static LexRule token(TokenKind kind, String regex) {
        return new LexRule(kind.name(), Pattern.compile(regex), kind);
    }

    public static LexRule keyword(TokenKind kind, String word) {
        return new LexRule(kind.name() + ":" + word,
                Pattern.compile("\\b" + word + "\\b", Pattern.CASE_INSENSITIVE), kind);
    }

    public static LexRule skip(String name, String regex) {
        return new LexRule(name, Pattern.compile(regex, Pattern.DOTALL), null);
    }

    public boolean isSkipped() {
        return kind == null;
    }
}
