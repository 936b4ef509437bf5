package yul.ast.expr;

import yul.ast.DebugData;

public record Identifier(DebugData debugData, String name) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
