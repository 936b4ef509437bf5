package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.TypedName;

import java.util.List;

public record FunctionDefinition(
        DebugData debugData,
        String name,
        List<TypedName> parameters,
        List<TypedName> returnVariables,
        Block body
) implements Statement {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
        returnVariables = List.copyOf(returnVariables);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionDefinition(this);
    }
}
