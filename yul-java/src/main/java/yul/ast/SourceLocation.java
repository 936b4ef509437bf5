package yul.ast;

public record SourceLocation(CharStream source, int start, int end) {

    public String sourceName() {
        return source == null ? "" : source.name();
    }

    @Override
    public String toString() {
        return sourceName() + "[" + start + "," + end + ")";
    }
}
