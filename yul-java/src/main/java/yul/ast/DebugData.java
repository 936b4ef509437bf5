package yul.ast;

/**
 * Provenance attached to a node. Nodes without provenance hold {@code null} instead of an instance.
 */
public record DebugData(SourceLocation location) {

    public DebugData {
        if (location == null) throw new IllegalArgumentException("debug data needs a location");
    }

    public static DebugData of(CharStream source, int start, int end) {
        return new DebugData(new SourceLocation(source, start, end));
    }
}
