package yul.ast.stmt;

/**
 * One method per statement kind; every traversal implements all of them.
 */
public interface StatementVisitor<R> {
    R visitBlock(Block block);
    R visitVariableDeclaration(VariableDeclaration declaration);
    R visitAssignment(Assignment assignment);
    R visitExpressionStatement(ExpressionStatement statement);
    R visitIf(If ifStatement);
    R visitSwitch(Switch switchStatement);
    R visitForLoop(ForLoop forLoop);
    R visitBreak(Break breakStatement);
    R visitContinue(Continue continueStatement);
    R visitLeave(Leave leave);
    R visitFunctionDefinition(FunctionDefinition definition);
}
