package yul.diagnostics;

import yul.ast.SourceLocation;

import java.util.Collection;

/**
 * One reported problem. {@code location} may be null.
 */
public record Diagnostic(
        Kind kind,
        String message,
        SourceLocation location
) {

    public enum Kind {
        WARNING("Warning"),
        SYNTAX_ERROR("SyntaxError"),
        DECLARATION_ERROR("DeclarationError"),
        TYPE_ERROR("TypeError");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }

        public boolean isError() {
            return this != WARNING;
        }
    }

    public boolean isError() {
        return kind.isError();
    }

    public static boolean containsOnlyWarnings(Collection<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        String s = kind.displayName() + ": " + message;
        if (location != null) s += " --> " + location.sourceName() + ":" + location.start() + ":" + location.end();
        return s;
    }
}
