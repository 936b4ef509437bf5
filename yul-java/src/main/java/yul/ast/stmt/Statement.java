package yul.ast.stmt;

import yul.ast.Node;

public sealed interface Statement extends Node
        permits Block, VariableDeclaration, Assignment, ExpressionStatement,
        If, Switch, ForLoop, Break, Continue, Leave, FunctionDefinition {

    <R> R accept(StatementVisitor<R> visitor);
}
