package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.expr.Expression;

public record If(
        DebugData debugData,
        Expression condition,
        Block body
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
