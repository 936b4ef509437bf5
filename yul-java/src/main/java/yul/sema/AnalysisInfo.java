package yul.sema;

import yul.ast.Node;
import yul.ast.expr.Expression;
import yul.ast.stmt.FunctionDefinition;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Side table filled by the {@link Analyzer}. Keys are node identities: structurally equal
 * nodes at different places in the tree have separate entries.
 */
public final class AnalysisInfo {
    private final Map<Node, Scope> scopes = new IdentityHashMap<>();
    private final Map<FunctionDefinition, FuncSymbol> functions = new IdentityHashMap<>();
    private final Map<Expression, List<String>> expressionTypes = new IdentityHashMap<>();

    /** Scope opened by a block or by a function definition (parameters and return variables). */
    public Scope scopeOf(Node node) {
        return scopes.get(node);
    }

    public FuncSymbol functionOf(FunctionDefinition definition) {
        return functions.get(definition);
    }

    /** Types of the values an expression produces; null if it was not analyzed or could not be resolved. */
    public List<String> typesOf(Expression expression) {
        return expressionTypes.get(expression);
    }

    void recordScope(Node node, Scope scope) {
        scopes.put(node, scope);
    }

    void recordFunction(FunctionDefinition definition, FuncSymbol symbol) {
        functions.put(definition, symbol);
    }

    void recordTypes(Expression expression, List<String> types) {
        expressionTypes.put(expression, types);
    }
}
