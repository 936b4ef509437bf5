package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.expr.Expression;

import java.util.List;

public record Switch(
        DebugData debugData,
        Expression expression,
        List<Case> cases
) implements Statement {

    public Switch {
        cases = List.copyOf(cases);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }
}
