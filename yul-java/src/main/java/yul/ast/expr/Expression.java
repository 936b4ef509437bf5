package yul.ast.expr;

import yul.ast.Node;

public sealed interface Expression extends Node
        permits FunctionCall, Identifier, Literal {

    <R> R accept(ExpressionVisitor<R> visitor);
}
