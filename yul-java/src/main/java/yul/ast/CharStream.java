package yul.ast;

/**
 * A named source text. Provenance annotations refer to these by index.
 */
public record CharStream(String name, String source) {

    public CharStream {
        if (name == null) name = "";
        if (source == null) source = "";
    }
}
