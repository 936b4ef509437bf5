package yul.diagnostics;

/**
 * Aborts the current parse after the cause has been reported. Never escapes {@code Parser.parse}.
 */
public final class FatalError extends RuntimeException {

    public FatalError() {
        super(null, null, false, false);
    }
}
