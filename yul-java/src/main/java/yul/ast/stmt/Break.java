package yul.ast.stmt;

import yul.ast.DebugData;

public record Break(DebugData debugData) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
