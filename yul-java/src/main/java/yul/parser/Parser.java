package yul.parser;

import yul.ast.CharStream;
import yul.ast.DebugData;
import yul.ast.SourceLocation;
import yul.ast.TypedName;
import yul.ast.expr.Expression;
import yul.ast.expr.FunctionCall;
import yul.ast.expr.Identifier;
import yul.ast.expr.Literal;
import yul.ast.expr.LiteralKind;
import yul.ast.stmt.Assignment;
import yul.ast.stmt.Block;
import yul.ast.stmt.Break;
import yul.ast.stmt.Case;
import yul.ast.stmt.Continue;
import yul.ast.stmt.ExpressionStatement;
import yul.ast.stmt.ForLoop;
import yul.ast.stmt.FunctionDefinition;
import yul.ast.stmt.If;
import yul.ast.stmt.Leave;
import yul.ast.stmt.Statement;
import yul.ast.stmt.Switch;
import yul.ast.stmt.VariableDeclaration;
import yul.diagnostics.ErrorReporter;
import yul.diagnostics.FatalError;
import yul.dialect.Dialect;
import yul.dialect.ValueKind;
import yul.lexer.Lexer;
import yul.lexer.LexerException;
import yul.lexer.Token;
import yul.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for Yul source text.
 *
 * <p>Unannotated literals and typed names receive the dialect's default type while parsing,
 * so the resulting tree carries effective types.
 *
 * <p>Provenance comes from {@code /// @src <index>:<start>:<end>} doc comments. Such a comment
 * is attached to exactly the statement, block or case that starts right after it; nodes without
 * one of their own get no debug data. {@code -1:-1:-1} explicitly marks an unknown location.
 *
 * <p>A parser instance handles one {@link #parse} call at a time.
 */
public final class Parser {
    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

    /** Name given to text passed to {@link #parse(String)}. */
    public static final String DEFAULT_SOURCE_NAME = "<input>";

    public enum UseSourceLocationFrom {
        /** {@code @src} annotations in doc comments. */
        COMMENTS,
        /** Positions in the parsed text itself; annotations are ignored. */
        SCANNER,
        /** No debug data at all. */
        NONE
    }

    private enum ForLoopComponent { NONE, PRE, POST, BODY }

    private record Context(boolean insideFunction, ForLoopComponent forLoopComponent) {
        static final Context TOP = new Context(false, ForLoopComponent.NONE);

        Context in(ForLoopComponent component) {
            return new Context(insideFunction, component);
        }

        Context functionBody() {
            return new Context(true, ForLoopComponent.NONE);
        }
    }

    private static final Pattern SRC_TAG = Pattern.compile("@src\\b");
    private static final Pattern SRC_ARGS =
            Pattern.compile("\\s+(-?\\d+):(-?\\d+):(-?\\d+)(?:\\s+\"(?:[^\"\\\\]|\\\\.)*\")?(?=\\s|$)");

    private final ErrorReporter reporter;
    private final Dialect dialect;
    private final IntFunction<CharStream> sourceResolver;
    private final UseSourceLocationFrom locationSource;

    private CharStream irSource;
    private List<Token> tokens;
    private int pos = 0;

    public Parser(ErrorReporter reporter, Dialect dialect) {
        this(reporter, dialect, Parser::virtualSource);
    }

    public Parser(ErrorReporter reporter, Dialect dialect, IntFunction<CharStream> sourceResolver) {
        this(reporter, dialect, sourceResolver, UseSourceLocationFrom.COMMENTS);
    }

    public Parser(ErrorReporter reporter, Dialect dialect, IntFunction<CharStream> sourceResolver,
                  UseSourceLocationFrom locationSource) {
        this.reporter = reporter;
        this.dialect = dialect;
        this.sourceResolver = sourceResolver;
        this.locationSource = locationSource;
    }

    /** Resolver used when none is given: "source-0", "source-1", ... without content. */
    public static CharStream virtualSource(int index) {
        return new CharStream("source-" + index, "");
    }

    // ---------- entry ----------
    public Optional<Block> parse(String source) {
        return parse(new CharStream(DEFAULT_SOURCE_NAME, source));
    }

    /**
     * Parses one outer block. Returns empty, with at least one error in the reporter, if this
     * call reported any error. Lexer faults are reported, never thrown.
     */
    public Optional<Block> parse(CharStream source) {
        int errorsBefore = reporter.errorCount();
        irSource = source;
        try {
            tokens = new Lexer(source.source()).tokenize();
            pos = 0;
            Block block = parseBlock(Context.TOP);
            consume(TokenType.EOF);

            if (reporter.errorCount() > errorsBefore) {
                LOGGER.fine(() -> "Parsing " + describeSource() + " failed");
                return Optional.empty();
            }
            LOGGER.fine(() -> "Parsed " + describeSource() + ": " + block.statements().size() + " top-level statements");
            return Optional.of(block);
        } catch (LexerException e) {
            reporter.syntaxError(new SourceLocation(source, e.offset(), e.offset()), e.getMessage());
            LOGGER.fine(() -> "Lexer fault in " + describeSource() + ": " + e.getMessage());
            return Optional.empty();
        } catch (FatalError e) {
            LOGGER.fine(() -> "Parsing " + describeSource() + " aborted");
            return Optional.empty();
        } finally {
            tokens = null;
        }
    }

    // ---------- block / statements ----------
    private Block parseBlock(Context ctx) {
        return parseBlock(ctx, leadingAnnotation());
    }

    private Block parseBlock(Context ctx, DebugData annotation) {
        Token first = consume(TokenType.LBRACE);
        List<Statement> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            stmts.add(parseStatement(ctx));
        }
        consume(TokenType.RBRACE);
        return new Block(debugData(annotation, first), stmts);
    }

    private Statement parseStatement(Context ctx) {
        DebugData annotation = leadingAnnotation();
        Token first = peek();

        return switch (first.type()) {
            case LBRACE -> parseBlock(ctx, annotation);
            case FUNCTION -> parseFunctionDefinition(ctx, annotation);
            case LET -> parseVariableDeclaration(annotation);
            case IF -> {
                advance();
                Expression cond = parseExpression();
                Block body = parseBlock(ctx);
                yield new If(debugData(annotation, first), cond, body);
            }
            case SWITCH -> parseSwitch(ctx, annotation);
            case FOR -> parseForLoop(ctx, annotation);
            case BREAK -> {
                advance();
                requireLoopBody(ctx, first);
                yield new Break(debugData(annotation, first));
            }
            case CONTINUE -> {
                advance();
                requireLoopBody(ctx, first);
                yield new Continue(debugData(annotation, first));
            }
            case LEAVE -> {
                advance();
                if (!ctx.insideFunction()) {
                    reporter.syntaxError(location(first), "Keyword \"leave\" can only be used inside a function.");
                }
                yield new Leave(debugData(annotation, first));
            }
            default -> parseCallOrAssignment(annotation);
        };
    }

    private void requireLoopBody(Context ctx, Token keyword) {
        if (ctx.forLoopComponent() != ForLoopComponent.BODY) {
            reporter.syntaxError(location(keyword),
                    "Keyword \"" + keyword.lexeme() + "\" needs to be inside a for-loop body.");
        }
    }

    private Statement parseCallOrAssignment(DebugData annotation) {
        Token first = peek();

        // assignment: IDENTIFIER (',' IDENTIFIER)* ':=' expr
        if (check(TokenType.IDENTIFIER) && (checkNext(TokenType.COMMA) || checkNext(TokenType.ASSIGN))) {
            List<Identifier> names = new ArrayList<>();
            do {
                names.add(parseAssignmentTarget());
            } while (match(TokenType.COMMA));
            consume(TokenType.ASSIGN);
            Expression value = parseExpression();
            return new Assignment(debugData(annotation, first), names, value);
        }

        Expression e = parseExpression();
        if (check(TokenType.COMMA)) {
            throw fatal(peek(), "Variable name must precede \",\" in multiple assignment.");
        }
        if (check(TokenType.ASSIGN)) {
            throw fatal(peek(), "Variable name must precede \":=\" in assignment.");
        }
        if (!(e instanceof FunctionCall)) {
            throw fatal(first, "Call or assignment expected.");
        }
        return new ExpressionStatement(debugData(annotation, first), e);
    }

    private Identifier parseAssignmentTarget() {
        Token name = consume(TokenType.IDENTIFIER);
        if (dialect.builtin(name.lexeme()).isPresent()) {
            throw fatal(name, "Cannot assign to builtin function \"" + name.lexeme() + "\".");
        }
        return new Identifier(debugData(null, name), name.lexeme());
    }

    private VariableDeclaration parseVariableDeclaration(DebugData annotation) {
        Token first = consume(TokenType.LET);
        List<TypedName> variables = new ArrayList<>();
        do {
            variables.add(parseTypedName("variable declaration"));
        } while (match(TokenType.COMMA));

        Expression value = null;
        if (match(TokenType.ASSIGN)) {
            value = parseExpression();
        }
        return new VariableDeclaration(debugData(annotation, first), variables, value);
    }

    private FunctionDefinition parseFunctionDefinition(Context ctx, DebugData annotation) {
        Token first = consume(TokenType.FUNCTION);
        if (ctx.forLoopComponent() == ForLoopComponent.PRE) {
            reporter.syntaxError(location(first), "Functions cannot be defined inside a for-loop init block.");
        }
        Token name = declaredIdentifier("function definition");

        consume(TokenType.LPAREN);
        List<TypedName> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                params.add(parseTypedName("function parameter list"));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN);

        List<TypedName> returns = new ArrayList<>();
        if (match(TokenType.ARROW)) {
            do {
                returns.add(parseTypedName("function return variable list"));
            } while (match(TokenType.COMMA));
        }

        Block body = parseBlock(ctx.functionBody());
        return new FunctionDefinition(debugData(annotation, first), name.lexeme(), params, returns, body);
    }

    private Switch parseSwitch(Context ctx, DebugData annotation) {
        Token first = consume(TokenType.SWITCH);
        Expression expr = parseExpression();

        List<Case> cases = new ArrayList<>();
        while (check(TokenType.CASE)) {
            cases.add(parseCase(ctx));
        }
        if (check(TokenType.DEFAULT)) {
            cases.add(parseCase(ctx));
        }
        if (check(TokenType.DEFAULT)) throw fatal(peek(), "Only one default case allowed.");
        if (check(TokenType.CASE)) throw fatal(peek(), "Case not allowed after default case.");
        if (cases.isEmpty()) throw fatal(first, "Switch statement without any cases.");

        return new Switch(debugData(annotation, first), expr, cases);
    }

    private Case parseCase(Context ctx) {
        DebugData annotation = leadingAnnotation();
        Token first = advance();

        Literal value = null;
        if (first.type() == TokenType.CASE) {
            if (!isLiteralStart(peek())) throw fatal(peek(), "Literal expected.");
            value = parseLiteral();
        }
        Block body = parseBlock(ctx);
        return new Case(debugData(annotation, first), value, body);
    }

    private ForLoop parseForLoop(Context ctx, DebugData annotation) {
        Token first = consume(TokenType.FOR);
        Block pre = parseBlock(ctx.in(ForLoopComponent.PRE));
        Expression cond = parseExpression();
        Block post = parseBlock(ctx.in(ForLoopComponent.POST));
        Block body = parseBlock(ctx.in(ForLoopComponent.BODY));
        return new ForLoop(debugData(annotation, first), pre, cond, post, body);
    }

    // ---------- names / types ----------
    private TypedName parseTypedName(String context) {
        Token name = declaredIdentifier(context);
        String type;
        if (match(TokenType.COLON)) {
            type = consume(TokenType.IDENTIFIER).lexeme();
        } else {
            type = dialect.defaultType(ValueKind.VARIABLE).orElse(null);
        }
        return new TypedName(debugData(null, name), name.lexeme(), type);
    }

    private Token declaredIdentifier(String context) {
        if (!check(TokenType.IDENTIFIER)) {
            throw reporter.fatalDeclarationError(location(peek()),
                    "Expected identifier in " + context + " but got " + describe(peek()));
        }
        Token name = advance();
        if (dialect.reservedIdentifier(name.lexeme())) {
            reporter.declarationError(location(name),
                    "Cannot use builtin function name \"" + name.lexeme() + "\" as identifier name.");
        }
        return name;
    }

    // ---------- expressions ----------
    private Expression parseExpression() {
        Token first = peek();
        if (isLiteralStart(first)) return parseLiteral();
        if (!check(TokenType.IDENTIFIER)) throw fatal(first, "Literal or identifier expected.");

        advance();
        Identifier name = new Identifier(debugData(null, first), first.lexeme());
        if (match(TokenType.LPAREN)) {
            List<Expression> args = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                do {
                    args.add(parseExpression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN);
            return new FunctionCall(debugData(null, first), name, args);
        }
        if (dialect.builtin(name.name()).isPresent()) {
            throw fatal(first, "Builtin function \"" + name.name() + "\" must be called.");
        }
        return name;
    }

    private Literal parseLiteral() {
        Token t = advance();
        LiteralKind kind = switch (t.type()) {
            case NUMBER -> LiteralKind.NUMBER;
            case STRING_LITERAL -> LiteralKind.STRING;
            case TRUE, FALSE -> LiteralKind.BOOLEAN;
            default -> throw fatal(t, "Literal expected.");
        };
        String type;
        if (match(TokenType.COLON)) {
            type = consume(TokenType.IDENTIFIER).lexeme();
        } else {
            type = dialect.defaultType(ValueKind.of(kind)).orElse(null);
        }
        return new Literal(debugData(null, t), kind, t.lexeme(), type);
    }

    private static boolean isLiteralStart(Token t) {
        return switch (t.type()) {
            case NUMBER, STRING_LITERAL, TRUE, FALSE -> true;
            default -> false;
        };
    }

    // ---------- provenance ----------

    /** Annotation carried by the doc comment in front of the current token, if any. */
    private DebugData leadingAnnotation() {
        Token token = peek();
        if (locationSource != UseSourceLocationFrom.COMMENTS || token.docComment() == null) return null;

        String doc = token.docComment();
        DebugData result = null;
        Matcher tag = SRC_TAG.matcher(doc);
        while (tag.find()) {
            Matcher args = SRC_ARGS.matcher(doc);
            args.region(tag.end(), doc.length());
            if (!args.lookingAt()) {
                reporter.syntaxError(location(token),
                        "Invalid values in source location mapping. Could not parse location specification.");
                continue;
            }
            result = sourceMapping(token, args.group(1), args.group(2), args.group(3));
        }
        return result;
    }

    private DebugData sourceMapping(Token at, String index, String start, String end) {
        long sourceIndex;
        long startOffset;
        long endOffset;
        try {
            sourceIndex = Long.parseLong(index);
            startOffset = Long.parseLong(start);
            endOffset = Long.parseLong(end);
        } catch (NumberFormatException e) {
            reporter.syntaxError(location(at), "Invalid values in source location mapping. Number out of range.");
            return null;
        }
        if (sourceIndex == -1 && startOffset == -1 && endOffset == -1) return null;
        if (sourceIndex < 0 || startOffset < 0 || endOffset < 0
                || sourceIndex > Integer.MAX_VALUE || startOffset > Integer.MAX_VALUE || endOffset > Integer.MAX_VALUE) {
            reporter.syntaxError(location(at), "Invalid values in source location mapping. Number out of range.");
            return null;
        }

        CharStream source = sourceResolver.apply((int) sourceIndex);
        if (source == null) {
            reporter.syntaxError(location(at), "Invalid source mapping. Source index not defined via @use-src.");
            return null;
        }
        return DebugData.of(source, (int) startOffset, (int) endOffset);
    }

    /** Debug data of a node that started at {@code first} and ends at the previous token. */
    private DebugData debugData(DebugData annotation, Token first) {
        return switch (locationSource) {
            case COMMENTS -> annotation;
            case SCANNER -> DebugData.of(irSource, first.start(), previous().end());
            case NONE -> null;
        };
    }

    private SourceLocation location(Token t) {
        return new SourceLocation(irSource, t.start(), t.end());
    }

    private String describeSource() {
        return irSource.name().isEmpty() ? DEFAULT_SOURCE_NAME : irSource.name();
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t) {
        if (check(t)) return advance();
        throw fatal(peek(), "Expected " + t.description() + " but got " + describe(peek()));
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(Math.max(pos - 1, 0)); }

    private FatalError fatal(Token at, String msg) {
        return reporter.fatalSyntaxError(location(at), msg);
    }

    private static String describe(Token t) {
        return switch (t.type()) {
            case IDENTIFIER, NUMBER -> t.type().description() + " '" + t.lexeme() + "'";
            default -> t.type().description();
        };
    }
}
