package yul.dialect;

import java.util.List;

/**
 * Selects a dialect by its configuration name.
 */
public final class Dialects {
    public static final String EVM = "evm";
    public static final String EVM_TYPED = "evm-typed";

    private Dialects() {}

    public static List<String> names() {
        return List.of(EVM, EVM_TYPED);
    }

    public static Dialect forName(String name, EvmVersion version) {
        return switch (name) {
            case EVM -> EvmDialect.strictAssemblyForEvmObjects(version);
            case EVM_TYPED -> EvmDialectTyped.instance(version);
            default -> throw new IllegalArgumentException(
                    "Unknown dialect: " + name + " (expected one of " + String.join(", ", names()) + ")");
        };
    }
}
