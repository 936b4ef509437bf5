package yul.printer;

import yul.ast.Ast;
import yul.ast.Node;
import yul.ast.SourceLocation;
import yul.ast.TypedName;
import yul.ast.expr.Expression;
import yul.ast.expr.ExpressionVisitor;
import yul.ast.expr.FunctionCall;
import yul.ast.expr.Identifier;
import yul.ast.expr.Literal;
import yul.ast.stmt.*;
import yul.dialect.Dialect;
import yul.dialect.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a tree back to canonical source text.
 *
 * <p>Without a dialect every type annotation is printed. With one, an annotation is left out
 * exactly when it equals the dialect's default type for that slot. Given source indices,
 * located nodes get a {@code /// @src} line that the parser reads back.
 */
public final class Printer implements StatementVisitor<String>, ExpressionVisitor<String> {

    private static final int MAX_SINGLE_LINE_FOR_HEADER = 60;

    private final Dialect dialect;
    private final Map<String, Integer> sourceIndices;

    public Printer() {
        this(null, Map.of());
    }

    public Printer(Dialect dialect) {
        this(dialect, Map.of());
    }

    public Printer(Dialect dialect, Map<String, Integer> sourceIndices) {
        this.dialect = dialect;
        this.sourceIndices = Map.copyOf(sourceIndices);
    }

    public String print(Block block) {
        return formatBlock(block);
    }

    public String print(Statement statement) {
        return statement.accept(this);
    }

    public String print(Expression expression) {
        return expression.accept(this);
    }

    // ================= statements =================

    @Override
    public String visitBlock(Block block) {
        return formatBlock(block);
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration decl) {
        StringBuilder out = new StringBuilder(annotation(decl));
        out.append("let ");
        out.append(decl.variables().stream().map(this::formatTypedName).collect(Collectors.joining(", ")));
        if (decl.value() != null) {
            out.append(" := ").append(decl.value().accept(this));
        }
        return out.toString();
    }

    @Override
    public String visitAssignment(Assignment assignment) {
        return annotation(assignment)
                + assignment.variableNames().stream().map(this::visitIdentifier).collect(Collectors.joining(", "))
                + " := " + assignment.value().accept(this);
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement stmt) {
        return annotation(stmt) + stmt.expression().accept(this);
    }

    @Override
    public String visitIf(If stmt) {
        return annotation(stmt) + "if " + stmt.condition().accept(this) + " " + formatBlock(stmt.body());
    }

    @Override
    public String visitSwitch(Switch stmt) {
        StringBuilder out = new StringBuilder(annotation(stmt));
        out.append("switch ").append(stmt.expression().accept(this));
        for (Case c : stmt.cases()) {
            out.append('\n').append(annotation(c));
            if (c.isDefault()) out.append("default ");
            else out.append("case ").append(visitLiteral(c.value())).append(' ');
            out.append(formatBlock(c.body()));
        }
        return out.toString();
    }

    @Override
    public String visitForLoop(ForLoop loop) {
        String pre = formatBlock(loop.pre());
        String condition = loop.condition().accept(this);
        String post = formatBlock(loop.post());

        char delim = '\n';
        if (pre.length() + condition.length() + post.length() < MAX_SINGLE_LINE_FOR_HEADER
                && pre.indexOf('\n') < 0 && post.indexOf('\n') < 0) {
            delim = ' ';
        }
        return annotation(loop) + "for " + pre + delim + condition + delim + post + "\n" + formatBlock(loop.body());
    }

    @Override
    public String visitBreak(Break stmt) {
        return annotation(stmt) + "break";
    }

    @Override
    public String visitContinue(Continue stmt) {
        return annotation(stmt) + "continue";
    }

    @Override
    public String visitLeave(Leave stmt) {
        return annotation(stmt) + "leave";
    }

    @Override
    public String visitFunctionDefinition(FunctionDefinition fn) {
        StringBuilder out = new StringBuilder(annotation(fn));
        out.append("function ").append(fn.name()).append('(');
        out.append(fn.parameters().stream().map(this::formatTypedName).collect(Collectors.joining(", ")));
        out.append(')');
        if (!fn.returnVariables().isEmpty()) {
            out.append(" -> ");
            out.append(fn.returnVariables().stream().map(this::formatTypedName).collect(Collectors.joining(", ")));
        }
        return out.append(' ').append(formatBlock(fn.body())).toString();
    }

    // ================= expressions =================

    @Override
    public String visitFunctionCall(FunctionCall call) {
        List<String> args = new ArrayList<>();
        for (Expression a : call.arguments()) args.add(a.accept(this));
        return call.functionName().name() + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitIdentifier(Identifier identifier) {
        return identifier.name();
    }

    @Override
    public String visitLiteral(Literal literal) {
        String text = switch (literal.kind()) {
            case NUMBER -> literal.value();
            case BOOLEAN -> literal.value();
            case STRING -> quote(literal.value());
        };
        return text + typeSuffix(literal.type(), ValueKind.of(literal.kind()));
    }

    // ================= helpers =================

    // the block carries its own annotation, so a block statement is not annotated twice
    private String formatBlock(Block block) {
        String prefix = annotation(block);
        if (block.statements().isEmpty()) return prefix + "{ }";

        List<String> lines = new ArrayList<>();
        for (Statement s : block.statements()) lines.add(s.accept(this));
        String body = String.join("\n", lines).replace("\n", "\n    ");
        return prefix + "{\n    " + body + "\n}";
    }

    private String formatTypedName(TypedName name) {
        return name.name() + typeSuffix(name.type(), ValueKind.VARIABLE);
    }

    private String typeSuffix(String type, ValueKind kind) {
        if (type == null) return "";
        if (dialect != null && dialect.defaultType(kind).map(type::equals).orElse(false)) return "";
        return ":" + type;
    }

    private String annotation(Node node) {
        SourceLocation location = Ast.locationOf(node);
        if (location == null) return "";
        Integer index = sourceIndices.get(location.sourceName());
        if (index == null) return "";
        return "/// @src " + index + ":" + location.start() + ":" + location.end() + "\n";
    }

    private static String quote(String value) {
        StringBuilder out = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7E) out.append(String.format("\\x%02x", (int) c & 0xFF));
                    else out.append(c);
                }
            }
        }
        return out.append('"').toString();
    }
}
