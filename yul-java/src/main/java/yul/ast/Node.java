package yul.ast;

public interface Node {
    DebugData debugData(); // null when the node has no provenance
}
