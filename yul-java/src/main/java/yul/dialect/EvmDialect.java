package yul.dialect;

import yul.ast.expr.LiteralKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static yul.dialect.SideEffects.LOGS;
import static yul.dialect.SideEffects.PURE;
import static yul.dialect.SideEffects.READS_MEMORY;
import static yul.dialect.SideEffects.READS_STATE;
import static yul.dialect.SideEffects.READS_STORAGE;
import static yul.dialect.SideEffects.WORLD;
import static yul.dialect.SideEffects.WRITES_MEMORY;
import static yul.dialect.SideEffects.WRITES_STORAGE;

/**
 * Untyped dialect exposing the EVM instructions of one {@link EvmVersion} as builtins.
 * Stack and jump instructions are not part of it. Every instruction name is reserved,
 * including the ones the selected version does not have.
 */
public class EvmDialect implements Dialect {

    private record Instruction(
            String name,
            int args,
            int returns,
            SideEffects effects,
            boolean terminates,
            EvmVersion since,   // null: available from the start
            EvmVersion until    // null: still available
    ) {
        boolean availableIn(EvmVersion v) {
            return (since == null || v.atLeast(since)) && (until == null || !v.atLeast(until));
        }
    }

    private static final List<Instruction> INSTRUCTIONS = List.of(
            op("stop", 0, 0, WORLD, true),
            op("add", 2, 1, PURE),
            op("sub", 2, 1, PURE),
            op("mul", 2, 1, PURE),
            op("div", 2, 1, PURE),
            op("sdiv", 2, 1, PURE),
            op("mod", 2, 1, PURE),
            op("smod", 2, 1, PURE),
            op("exp", 2, 1, PURE),
            op("not", 1, 1, PURE),
            op("lt", 2, 1, PURE),
            op("gt", 2, 1, PURE),
            op("slt", 2, 1, PURE),
            op("sgt", 2, 1, PURE),
            op("eq", 2, 1, PURE),
            op("iszero", 1, 1, PURE),
            op("and", 2, 1, PURE),
            op("or", 2, 1, PURE),
            op("xor", 2, 1, PURE),
            op("byte", 2, 1, PURE),
            since("shl", 2, 1, PURE, EvmVersion.CONSTANTINOPLE),
            since("shr", 2, 1, PURE, EvmVersion.CONSTANTINOPLE),
            since("sar", 2, 1, PURE, EvmVersion.CONSTANTINOPLE),
            op("addmod", 3, 1, PURE),
            op("mulmod", 3, 1, PURE),
            op("signextend", 2, 1, PURE),
            op("keccak256", 2, 1, READS_MEMORY),
            op("pop", 1, 0, PURE),
            op("mload", 1, 1, READS_MEMORY),
            op("mstore", 2, 0, WRITES_MEMORY),
            op("mstore8", 2, 0, WRITES_MEMORY),
            since("mcopy", 3, 0, WRITES_MEMORY, EvmVersion.CANCUN),
            op("sload", 1, 1, READS_STORAGE),
            op("sstore", 2, 0, WRITES_STORAGE),
            since("tload", 1, 1, READS_STORAGE, EvmVersion.CANCUN),
            since("tstore", 2, 0, WRITES_STORAGE, EvmVersion.CANCUN),
            op("msize", 0, 1, READS_MEMORY),
            op("gas", 0, 1, READS_STATE),
            op("address", 0, 1, PURE),
            op("balance", 1, 1, READS_STATE),
            since("selfbalance", 0, 1, READS_STATE, EvmVersion.ISTANBUL),
            op("caller", 0, 1, PURE),
            op("callvalue", 0, 1, PURE),
            op("calldataload", 1, 1, PURE),
            op("calldatasize", 0, 1, PURE),
            op("calldatacopy", 3, 0, WRITES_MEMORY),
            op("codesize", 0, 1, PURE),
            op("codecopy", 3, 0, WRITES_MEMORY),
            op("extcodesize", 1, 1, READS_STATE),
            op("extcodecopy", 4, 0, WRITES_MEMORY),
            since("returndatasize", 0, 1, READS_STATE, EvmVersion.BYZANTIUM),
            since("returndatacopy", 3, 0, WRITES_MEMORY, EvmVersion.BYZANTIUM),
            since("extcodehash", 1, 1, READS_STATE, EvmVersion.CONSTANTINOPLE),
            op("create", 3, 1, WORLD),
            since("create2", 4, 1, WORLD, EvmVersion.CONSTANTINOPLE),
            op("call", 7, 1, WORLD),
            op("callcode", 7, 1, WORLD),
            op("delegatecall", 6, 1, WORLD),
            since("staticcall", 6, 1, WORLD, EvmVersion.BYZANTIUM),
            op("return", 2, 0, WORLD, true),
            since("revert", 2, 0, WORLD, true, EvmVersion.BYZANTIUM),
            op("selfdestruct", 1, 0, WORLD, true),
            op("invalid", 0, 0, WORLD, true),
            op("log0", 2, 0, LOGS),
            op("log1", 3, 0, LOGS),
            op("log2", 4, 0, LOGS),
            op("log3", 5, 0, LOGS),
            op("log4", 6, 0, LOGS),
            since("chainid", 0, 1, PURE, EvmVersion.ISTANBUL),
            since("basefee", 0, 1, PURE, EvmVersion.LONDON),
            since("blobbasefee", 0, 1, PURE, EvmVersion.CANCUN),
            op("origin", 0, 1, PURE),
            op("gasprice", 0, 1, PURE),
            op("blockhash", 1, 1, READS_STATE),
            since("blobhash", 1, 1, PURE, EvmVersion.CANCUN),
            op("coinbase", 0, 1, PURE),
            op("timestamp", 0, 1, PURE),
            op("number", 0, 1, PURE),
            new Instruction("difficulty", 0, 1, PURE, false, null, EvmVersion.PARIS),
            since("prevrandao", 0, 1, PURE, EvmVersion.PARIS),
            op("gaslimit", 0, 1, PURE)
    );

    private static final Map<EvmVersion, EvmDialect> PLAIN = new ConcurrentHashMap<>();
    private static final Map<EvmVersion, EvmDialect> WITH_OBJECTS = new ConcurrentHashMap<>();

    protected final EvmVersion evmVersion;
    protected final boolean objectAccess;
    protected final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private final Map<String, Instruction> instructionsByName = new LinkedHashMap<>();

    protected EvmDialect(EvmVersion evmVersion, boolean objectAccess) {
        this.evmVersion = evmVersion;
        this.objectAccess = objectAccess;

        for (Instruction in : INSTRUCTIONS) {
            instructionsByName.put(in.name(), in);
            if (!in.availableIn(evmVersion)) continue;
            functions.put(in.name(), new BuiltinFunction(
                    in.name(),
                    Collections.nCopies(in.args(), null),
                    Collections.nCopies(in.returns(), null),
                    in.effects(),
                    in.terminates(),
                    Map.of()));
        }

        if (objectAccess) {
            addLiteralBuiltin("datasize", 1, 1, PURE, Map.of(0, LiteralKind.STRING));
            addLiteralBuiltin("dataoffset", 1, 1, PURE, Map.of(0, LiteralKind.STRING));
            addLiteralBuiltin("datacopy", 3, 0, WRITES_MEMORY, Map.of());
            addLiteralBuiltin("setimmutable", 3, 0, WRITES_MEMORY, Map.of(1, LiteralKind.STRING));
            addLiteralBuiltin("loadimmutable", 1, 1, PURE, Map.of(0, LiteralKind.STRING));
            addLiteralBuiltin("linkersymbol", 1, 1, PURE, Map.of(0, LiteralKind.STRING));
            addLiteralBuiltin("memoryguard", 1, 1, PURE, Map.of(0, LiteralKind.NUMBER));
        }
    }

    /** Plain strict-assembly dialect without the object access builtins. */
    public static EvmDialect strictAssemblyForEvm(EvmVersion version) {
        return PLAIN.computeIfAbsent(version, v -> new EvmDialect(v, false));
    }

    /** Dialect for code inside Yul objects: adds datasize, dataoffset, datacopy and friends. */
    public static EvmDialect strictAssemblyForEvmObjects(EvmVersion version) {
        return WITH_OBJECTS.computeIfAbsent(version, v -> new EvmDialect(v, true));
    }

    public EvmVersion evmVersion() {
        return evmVersion;
    }

    public boolean providesObjectAccess() {
        return objectAccess;
    }

    /** Builtins of this dialect in declaration order. */
    public Map<String, BuiltinFunction> builtins() {
        return Collections.unmodifiableMap(functions);
    }

    @Override
    public Optional<BuiltinFunction> builtin(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    @Override
    public Optional<String> defaultType(ValueKind kind) {
        return Optional.empty();
    }

    @Override
    public Set<String> types() {
        return Set.of();
    }

    @Override
    public boolean reservedIdentifier(String name) {
        return functions.containsKey(name) || instructionsByName.containsKey(name) || name.startsWith("verbatim_");
    }

    @Override
    public Optional<String> unavailableBuiltinMessage(String name) {
        Instruction in = instructionsByName.get(name);
        if (in == null || functions.containsKey(name)) return Optional.empty();
        if (in.since() != null && !evmVersion.atLeast(in.since())) {
            return Optional.of("The \"" + name + "\" instruction is only available for "
                    + in.since().displayName() + "-compatible VMs (you are currently compiling for \""
                    + evmVersion.id() + "\").");
        }
        if (in.until() != null && evmVersion.atLeast(in.until())) {
            return Optional.of("The \"" + name + "\" instruction is not available for "
                    + in.until().displayName() + "-compatible VMs or later (you are currently compiling for \""
                    + evmVersion.id() + "\").");
        }
        // removed by a subclass, e.g. "iszero" in the typed dialect
        return Optional.empty();
    }

    private void addLiteralBuiltin(String name, int args, int returns, SideEffects effects,
                                   Map<Integer, LiteralKind> literalArguments) {
        functions.put(name, new BuiltinFunction(
                name,
                Collections.nCopies(args, null),
                Collections.nCopies(returns, null),
                effects,
                false,
                literalArguments));
    }

    private static Instruction op(String name, int args, int returns, SideEffects effects) {
        return new Instruction(name, args, returns, effects, false, null, null);
    }

    private static Instruction op(String name, int args, int returns, SideEffects effects, boolean terminates) {
        return new Instruction(name, args, returns, effects, terminates, null, null);
    }

    private static Instruction since(String name, int args, int returns, SideEffects effects, EvmVersion since) {
        return new Instruction(name, args, returns, effects, false, since, null);
    }

    private static Instruction since(String name, int args, int returns, SideEffects effects,
                                     boolean terminates, EvmVersion since) {
        return new Instruction(name, args, returns, effects, terminates, since, null);
    }

    @Override
    public String toString() {
        return "evm(" + evmVersion.id() + (objectAccess ? ", objects" : "") + ")";
    }
}
