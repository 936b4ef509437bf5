package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.expr.Expression;

public record ExpressionStatement(
        DebugData debugData,
        Expression expression
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
