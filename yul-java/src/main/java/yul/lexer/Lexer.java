package yul.lexer;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    // UTF-8 byte offset of pos, used for token and error offsets
    private int bytePos = 0;
    private int line = 1;
    private int col = 1;

    // doc comment text waiting for the next token
    private StringBuilder pendingDoc = null;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("let", TokenType.LET),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("if", TokenType.IF),
            Map.entry("switch", TokenType.SWITCH),
            Map.entry("case", TokenType.CASE),
            Map.entry("default", TokenType.DEFAULT),
            Map.entry("for", TokenType.FOR),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("leave", TokenType.LEAVE),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int start = bytePos;
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol, start);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol, start);
                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol, start);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol, start);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol, start);

                case ':' -> {
                    boolean assign = match('=');
                    add(assign ? TokenType.ASSIGN : TokenType.COLON, assign ? ":=" : ":", startLine, startCol, start);
                }

                case '-' -> {
                    if (match('>')) add(TokenType.ARROW, "->", startLine, startCol, start);
                    else error("Unexpected '-'", start);
                }

                case '/' -> {
                    if (match('/')) lineComment();
                    else if (match('*')) blockComment(start);
                    else error("Unexpected '/'", start);
                }

                case '"', '\'' -> stringLiteral(c, startLine, startCol, start);

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol, start);
                    else if (isIdentifierStart(c)) identifier(c, startLine, startCol, start);
                    else error("Unexpected character: " + c, start);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col, bytePos, bytePos, takeDoc()));
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(char first, int line, int col, int start) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        if (first == '0' && peek() == 'x') {
            sb.append(advance());
            if (!isHexDigit(peek())) error("Hex number without digits", start);
            while (!isAtEnd() && isHexDigit(peek())) {
                sb.append(advance());
            }
        } else {
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        if (!isAtEnd() && isIdentifierPart(peek())) {
            error("Identifier-start is not allowed at end of a number", start);
        }
        add(TokenType.NUMBER, sb.toString(), line, col, start);
    }

    private void identifier(char first, int line, int col, int start) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        if (text.equals("hex") && (peek() == '"' || peek() == '\'')) {
            hexStringLiteral(advance(), line, col, start);
            return;
        }
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, line, col, start);
    }

    private void stringLiteral(char quote, int line, int col, int start) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') error("Unterminated string", start);
            if (c == '\\') {
                escape(sb, start);
            } else if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                appendUtf8(sb, Character.toCodePoint(c, advance()));
            } else {
                appendUtf8(sb, c);
            }
        }

        if (isAtEnd()) error("Unterminated string", start);

        advance(); // closing quote
        add(TokenType.STRING_LITERAL, sb.toString(), line, col, start);
    }

    private void hexStringLiteral(char quote, int line, int col, int start) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char hi = advance();
            if (isAtEnd() || peek() == quote) error("Odd number of digits in hex string", start);
            char lo = advance();
            if (!isHexDigit(hi) || !isHexDigit(lo)) error("Invalid character in hex string", start);
            sb.append((char) Integer.parseInt("" + hi + lo, 16));
        }
        if (isAtEnd()) error("Unterminated hex string", start);
        advance();
        add(TokenType.STRING_LITERAL, sb.toString(), line, col, start);
    }

    private void escape(StringBuilder sb, int start) {
        if (isAtEnd()) error("Unterminated string", start);
        char c = advance();
        switch (c) {
            case '\\' -> sb.append('\\');
            case '"' -> sb.append('"');
            case '\'' -> sb.append('\'');
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case '0' -> sb.append('\0');
            case 'x' -> sb.append((char) Integer.parseInt(hexDigits(2, start), 16));
            case 'u' -> appendUtf8(sb, Integer.parseInt(hexDigits(4, start), 16));
            default -> error("Invalid escape sequence: \\" + c, start);
        }
    }

    private String hexDigits(int count, int start) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (isAtEnd() || !isHexDigit(peek())) error("Invalid escape sequence", start);
            sb.append(advance());
        }
        return sb.toString();
    }

    // literal values are byte strings: one char per UTF-8 byte.
    // A lone surrogate code unit is encoded as three bytes like any other BMP code point.
    private static void appendUtf8(StringBuilder sb, int codePoint) {
        if (codePoint < 0x80) {
            sb.append((char) codePoint);
        } else if (codePoint < 0x800) {
            sb.append((char) (0xC0 | codePoint >> 6));
            sb.append((char) (0x80 | codePoint & 0x3F));
        } else if (codePoint < 0x10000) {
            sb.append((char) (0xE0 | codePoint >> 12));
            sb.append((char) (0x80 | codePoint >> 6 & 0x3F));
            sb.append((char) (0x80 | codePoint & 0x3F));
        } else {
            sb.append((char) (0xF0 | codePoint >> 18));
            sb.append((char) (0x80 | codePoint >> 12 & 0x3F));
            sb.append((char) (0x80 | codePoint >> 6 & 0x3F));
            sb.append((char) (0x80 | codePoint & 0x3F));
        }
    }

    private void lineComment() {
        boolean doc = peek() == '/' && peekNext() != '/';
        if (doc) advance();
        int from = pos;
        while (!isAtEnd() && peek() != '\n') advance();
        if (doc) appendDoc(source.substring(from, pos));
    }

    private void blockComment(int start) {
        boolean doc = peek() == '*' && peekNext() != '/';
        if (doc) advance();
        int from = pos;
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            if (advance() == '\n') {
                line++;
                col = 1;
            }
        }
        if (isAtEnd()) error("Unterminated comment", start);
        int to = pos;
        advance();
        advance();
        if (doc) appendDoc(source.substring(from, to));
    }

    private void appendDoc(String text) {
        if (pendingDoc == null) pendingDoc = new StringBuilder();
        else pendingDoc.append('\n');
        pendingDoc.append(text.trim());
    }

    private String takeDoc() {
        if (pendingDoc == null) return null;
        String doc = pendingDoc.toString();
        pendingDoc = null;
        return doc;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> advance();
                case '\n' -> {
                    advance();
                    line++;
                    col = 1;
                }
                default -> { return; }
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        bytePos += utf8Length(c);
        col++;
        return c;
    }

    // bytes taken by the char just consumed; a surrogate pair counts four on its high half
    private int utf8Length(char c) {
        if (c < 0x80) return 1;
        if (c < 0x800) return 2;
        if (Character.isHighSurrogate(c) && pos < source.length() && Character.isLowSurrogate(source.charAt(pos))) {
            return 4;
        }
        if (Character.isLowSurrogate(c) && pos >= 2 && Character.isHighSurrogate(source.charAt(pos - 2))) {
            return 0;
        }
        return 3;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '.';
    }

    private void add(TokenType type, String lexeme, int line, int col, int start) {
        tokens.add(new Token(type, lexeme, line, col, start, bytePos, takeDoc()));
    }

    private void error(String message, int offset) {
        throw new LexerException("[" + line + ":" + col + "] " + message, offset);
    }
}
