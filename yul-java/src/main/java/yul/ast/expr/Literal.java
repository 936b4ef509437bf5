package yul.ast.expr;

import yul.ast.DebugData;

/**
 * A literal. Numbers keep their source spelling ("0x1f"), strings hold their decoded bytes one
 * per char (0..255), booleans are "true" or "false". {@code type} is null when untyped.
 */
public record Literal(
        DebugData debugData,
        LiteralKind kind,
        String value,
        String type
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
