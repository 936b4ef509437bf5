package yul.sema;

/** A variable, parameter or return variable. {@code type} is null in untyped dialects. */
public record VarSymbol(String name, String type) implements Symbol {}
