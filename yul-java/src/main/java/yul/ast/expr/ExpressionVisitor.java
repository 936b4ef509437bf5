package yul.ast.expr;

public interface ExpressionVisitor<R> {
    R visitFunctionCall(FunctionCall call);
    R visitIdentifier(Identifier identifier);
    R visitLiteral(Literal literal);
}
