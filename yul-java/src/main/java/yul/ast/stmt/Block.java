package yul.ast.stmt;

import yul.ast.DebugData;

import java.util.List;

public record Block(
        DebugData debugData,
        List<Statement> statements
) implements Statement {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
