package yul.sema;

import yul.ast.SourceLocation;
import yul.diagnostics.ErrorReporter;
import yul.dialect.Dialect;
import yul.dialect.ValueKind;

/**
 * Turns a declared type name into the effective type of a slot.
 */
public final class TypeResolver {
    private final Dialect dialect;
    private final ErrorReporter reporter;

    public TypeResolver(Dialect dialect, ErrorReporter reporter) {
        this.dialect = dialect;
        this.reporter = reporter;
    }

    /**
     * Dialect default for a missing annotation, the annotation itself when the dialect knows it.
     * Unknown names are reported and resolve to null so later checks stay quiet.
     */
    public String resolve(String declared, ValueKind kind, SourceLocation at) {
        if (declared == null) return dialect.defaultType(kind).orElse(null);
        if (!dialect.types().contains(declared)) {
            reporter.typeError(at, "\"" + declared + "\" is not a valid type (user defined types are not yet supported).");
            return null;
        }
        return declared;
    }
}
