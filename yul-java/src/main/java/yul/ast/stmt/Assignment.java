package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.expr.Expression;
import yul.ast.expr.Identifier;

import java.util.List;

public record Assignment(
        DebugData debugData,
        List<Identifier> variableNames,
        Expression value
) implements Statement {

    public Assignment {
        variableNames = List.copyOf(variableNames);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
