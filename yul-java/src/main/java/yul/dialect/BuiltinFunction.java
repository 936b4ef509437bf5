package yul.dialect;

import yul.ast.expr.LiteralKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A dialect-provided function. Parameter and return types are null in untyped dialects.
 * {@code literalArguments} maps argument positions that must be literals to the literal kind they need.
 */
public record BuiltinFunction(
        String name,
        List<String> parameters,
        List<String> returns,
        SideEffects sideEffects,
        boolean terminates,
        Map<Integer, LiteralKind> literalArguments
) {

    public BuiltinFunction {
        // null entries are allowed, so no List.copyOf here
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        returns = Collections.unmodifiableList(new ArrayList<>(returns));
        literalArguments = Map.copyOf(literalArguments);
    }

    public static BuiltinFunction untyped(String name, int parameterCount, int returnCount) {
        return new BuiltinFunction(
                name,
                Collections.nCopies(parameterCount, null),
                Collections.nCopies(returnCount, null),
                SideEffects.worst(),
                false,
                Map.of());
    }

    public LiteralKind literalArgument(int index) {
        return literalArguments.get(index);
    }

    public BuiltinFunction withSignature(List<String> parameters, List<String> returns) {
        return new BuiltinFunction(name, parameters, returns, sideEffects, terminates, literalArguments);
    }

    public BuiltinFunction renamed(String newName) {
        return new BuiltinFunction(newName, parameters, returns, sideEffects, terminates, literalArguments);
    }
}
