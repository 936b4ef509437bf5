package yul.ast.expr;

public enum LiteralKind {
    NUMBER,
    STRING,
    BOOLEAN
}
