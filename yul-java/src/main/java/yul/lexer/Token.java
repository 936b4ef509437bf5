package yul.lexer;

/**
 * A scanned token. {@code start}/{@code end} are UTF-8 byte offsets into the scanned text; {@code docComment}
 * is the text of the doc comments ({@code ///} or {@code /** *}{@code /}) directly before it, or null.
 * For string literals the lexeme is the decoded value.
 */
public record Token(
        TokenType type,
        String lexeme,
        int line,
        int column,
        int start,
        int end,
        String docComment
) {
    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
