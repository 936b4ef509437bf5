package yul.ast.stmt;

import yul.ast.DebugData;
import yul.ast.Node;
import yul.ast.expr.Literal;

public record Case(
        DebugData debugData,
        Literal value,   // null for "default"
        Block body
) implements Node {

    public boolean isDefault() {
        return value == null;
    }
}
