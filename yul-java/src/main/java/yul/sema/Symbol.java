package yul.sema;

public sealed interface Symbol permits VarSymbol, FuncSymbol {
    String name();
}
