package org.calclite.formula.dsl;

import java.util.Objects;

/**
 * A problem found while compiling a formula.
 * Diagnostics are facts for the caller; none of them stops compilation.
 * 
 * @param severity How serious the problem is
 * @param kind     Which stage found it
 * @param message  Human readable description
 * @param position Offset in the formula, or -1 when not tied to a position
 */
public record Diagnostic(Severity severity, Kind kind, String message, int position) {

    public enum Severity {
        ERROR, WARNING, INFO
    }

    public enum Kind {
        /** Character the lexer did not recognize. */
        LEXICAL,
        /** Unexpected or missing token. */
        SYNTAX,
        /** Malformed level of detail expression. */
        SCOPE,
        /** Unknown function or wrong argument count. */
        SEMANTIC
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public static Diagnostic error(Kind kind, String message, int position) {
        return new Diagnostic(Severity.ERROR, kind, message, position);
    }

    public static Diagnostic warning(Kind kind, String message) {
        return new Diagnostic(Severity.WARNING, kind, message, -1);
    }

    public static Diagnostic info(Kind kind, String message) {
        return new Diagnostic(Severity.INFO, kind, message, -1);
    }

    @Override
    public String toString() {
        return severity + " " + kind + (position >= 0 ? " at " + position : "") + ": " + message;
    }
}
