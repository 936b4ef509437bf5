package yul.ast.stmt;

import yul.ast.DebugData;

public record Leave(DebugData debugData) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLeave(this);
    }
}
