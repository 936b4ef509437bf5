package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.expr.Expression;

/**
 * {@code for pre condition post body}. Variables declared in {@code pre} stay visible in the other three parts.
 */
public record ForLoop(
        DebugData debugData,
        Block pre,
        Expression condition,
        Block post,
        Block body
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForLoop(this);
    }
}
