package yul.ast.stmt;

import yul.ast.DebugData;

public record Continue(DebugData debugData) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}
