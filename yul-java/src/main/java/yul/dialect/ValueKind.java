package yul.dialect;

import yul.ast.expr.LiteralKind;

/**
 * Kinds of typed slots a dialect may assign a default type to.
 */
public enum ValueKind {
    VARIABLE,          // variables, parameters and return variables
    NUMBER_LITERAL,
    STRING_LITERAL,
    BOOLEAN_LITERAL;

    public static ValueKind of(LiteralKind kind) {
        return switch (kind) {
            case NUMBER -> NUMBER_LITERAL;
            case STRING -> STRING_LITERAL;
            case BOOLEAN -> BOOLEAN_LITERAL;
        };
    }
}
