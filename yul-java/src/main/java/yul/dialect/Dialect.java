package yul.dialect;

import yul.ast.expr.LiteralKind;

import java.util.Optional;
import java.util.Set;

/**
 * Pluggable definition of the builtins and the type system of one IR variant.
 * Implementations are immutable and may be shared between threads.
 */
public interface Dialect {

    /** Builtin with the given name, or empty. Unknown names are not an error here. */
    Optional<BuiltinFunction> builtin(String name);

    /** Type an unannotated slot of the given kind receives, or empty if the dialect is untyped. */
    Optional<String> defaultType(ValueKind kind);

    /** Valid type names. Empty for untyped dialects. */
    Set<String> types();

    default Optional<String> boolType() {
        return defaultType(ValueKind.BOOLEAN_LITERAL);
    }

    default boolean isTyped() {
        return !types().isEmpty();
    }

    /** Names that cannot be used for variables or functions. */
    default boolean reservedIdentifier(String name) {
        return builtin(name).isPresent();
    }

    default boolean validTypeForLiteral(LiteralKind kind, String value, String type) {
        if (kind == LiteralKind.BOOLEAN) return type == null || type.equals(boolType().orElse(null));
        return true;
    }

    /** Explanation for a name that would be a builtin under a different configuration. */
    default Optional<String> unavailableBuiltinMessage(String name) {
        return Optional.empty();
    }
}
