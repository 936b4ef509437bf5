package yul.ast.expr;

import yul.ast.DebugData;

import java.util.List;

/**
 * A call by name. Whether the name denotes a builtin or a user function is decided during analysis.
 */
public record FunctionCall(
        DebugData debugData,
        Identifier functionName,
        List<Expression> arguments
) implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
