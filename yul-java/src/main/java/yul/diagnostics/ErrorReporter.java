package yul.diagnostics;

import yul.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Appends diagnostics to a caller-owned list. Entries are never removed or rewritten.
 */
public final class ErrorReporter {
    private final List<Diagnostic> diagnostics;

    public ErrorReporter(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    public void warning(SourceLocation location, String message) {
        report(Diagnostic.Kind.WARNING, location, message);
    }

    public void syntaxError(SourceLocation location, String message) {
        report(Diagnostic.Kind.SYNTAX_ERROR, location, message);
    }

    public void declarationError(SourceLocation location, String message) {
        report(Diagnostic.Kind.DECLARATION_ERROR, location, message);
    }

    public void typeError(SourceLocation location, String message) {
        report(Diagnostic.Kind.TYPE_ERROR, location, message);
    }

    public FatalError fatalSyntaxError(SourceLocation location, String message) {
        syntaxError(location, message);
        throw new FatalError();
    }

    public FatalError fatalDeclarationError(SourceLocation location, String message) {
        declarationError(location, message);
        throw new FatalError();
    }

    public void report(Diagnostic.Kind kind, SourceLocation location, String message) {
        diagnostics.add(new Diagnostic(kind, message, location));
    }

    public int errorCount() {
        int n = 0;
        for (Diagnostic d : diagnostics) {
            if (d.isError()) n++;
        }
        return n;
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
