package yul.ast;

public final class Ast {
    private Ast() {}

    /** Location of any statement, expression, case or typed name, or null when it carries none. */
    public static SourceLocation locationOf(Node node) {
        if (node == null || node.debugData() == null) return null;
        return node.debugData().location();
    }
}
