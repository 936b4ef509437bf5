package yul.lexer;

public enum TokenType {

    // literals
    IDENTIFIER("identifier"),
    NUMBER("number"),
    STRING_LITERAL("string literal"),

    // keywords
    LET("'let'"),
    FUNCTION("'function'"),
    IF("'if'"),
    SWITCH("'switch'"),
    CASE("'case'"),
    DEFAULT("'default'"),
    FOR("'for'"),
    BREAK("'break'"),
    CONTINUE("'continue'"),
    LEAVE("'leave'"),
    TRUE("'true'"),
    FALSE("'false'"),

    // symbols
    LBRACE("'{'"), RBRACE("'}'"),
    LPAREN("'('"), RPAREN("')'"),
    COMMA("','"),
    COLON("':'"),
    ASSIGN("':='"),
    ARROW("'->'"),

    EOF("end of source");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
