package yul.ast;

/**
 * A declared variable, parameter or return variable. {@code type} is null in untyped dialects.
 */
public record TypedName(
        DebugData debugData,
        String name,
        String type
) implements Node {}
