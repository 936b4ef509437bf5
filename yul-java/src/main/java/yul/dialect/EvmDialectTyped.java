package yul.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * EVM dialect with the types {@code u256} and {@code bool}.
 *
 * <p>All instruction slots are {@code u256} except the comparisons, which return {@code bool}.
 * {@code and}, {@code or}, {@code xor} and {@code not} become boolean operations; the bitwise
 * versions are available as {@code bitand}, {@code bitor}, {@code bitxor} and {@code bitnot}.
 * {@code iszero} is replaced by {@code not}. Conversions are explicit through
 * {@code bool_to_u256} and {@code u256_to_bool}.
 */
public final class EvmDialectTyped extends EvmDialect {
    public static final String U256 = "u256";
    public static final String BOOL = "bool";

    private static final Map<EvmVersion, EvmDialectTyped> INSTANCES = new ConcurrentHashMap<>();

    private EvmDialectTyped(EvmVersion evmVersion) {
        super(evmVersion, true);

        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            BuiltinFunction f = e.getValue();
            e.setValue(f.withSignature(
                    Collections.nCopies(f.parameters().size(), U256),
                    Collections.nCopies(f.returns().size(), U256)));
        }

        for (String cmp : List.of("lt", "gt", "slt", "sgt", "eq")) {
            retype(cmp, List.of(U256, U256), List.of(BOOL));
        }

        copy("not", "bitnot");
        copy("and", "bitand");
        copy("or", "bitor");
        copy("xor", "bitxor");

        copy("iszero", "not");
        retype("not", List.of(BOOL), List.of(BOOL));
        functions.remove("iszero");

        retype("and", List.of(BOOL, BOOL), List.of(BOOL));
        retype("or", List.of(BOOL, BOOL), List.of(BOOL));
        retype("xor", List.of(BOOL, BOOL), List.of(BOOL));

        copy("pop", "popbool");
        retype("popbool", List.of(BOOL), List.of());

        functions.put("bool_to_u256", new BuiltinFunction(
                "bool_to_u256", List.of(BOOL), List.of(U256), SideEffects.PURE, false, Map.of()));
        functions.put("u256_to_bool", new BuiltinFunction(
                "u256_to_bool", List.of(U256), List.of(BOOL), SideEffects.PURE, false, Map.of()));
    }

    public static EvmDialectTyped instance(EvmVersion version) {
        return INSTANCES.computeIfAbsent(version, EvmDialectTyped::new);
    }

    @Override
    public Optional<String> defaultType(ValueKind kind) {
        return Optional.of(kind == ValueKind.BOOLEAN_LITERAL ? BOOL : U256);
    }

    @Override
    public Set<String> types() {
        return Set.of(U256, BOOL);
    }

    private void copy(String from, String to) {
        functions.put(to, functions.get(from).renamed(to));
    }

    private void retype(String name, List<String> parameters, List<String> returns) {
        functions.put(name, functions.get(name).withSignature(new ArrayList<>(parameters), new ArrayList<>(returns)));
    }

    @Override
    public String toString() {
        return "evm-typed(" + evmVersion.id() + ")";
    }
}
