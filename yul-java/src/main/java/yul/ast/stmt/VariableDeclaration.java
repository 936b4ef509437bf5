package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.TypedName;
import yul.ast.expr.Expression;

import java.util.List;

public record VariableDeclaration(
        DebugData debugData,
        List<TypedName> variables,
        Expression value          // null for "let x"
) implements Statement {

    public VariableDeclaration {
        variables = List.copyOf(variables);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }
}
