package yul.lexer;

public final class LexerException extends RuntimeException {
    private final int offset;

    public LexerException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
