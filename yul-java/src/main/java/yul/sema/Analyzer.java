package yul.sema;

import yul.ast.Ast;
import yul.ast.Node;
import yul.ast.SourceLocation;
import yul.ast.TypedName;
import yul.ast.expr.Expression;
import yul.ast.expr.ExpressionVisitor;
import yul.ast.expr.FunctionCall;
import yul.ast.expr.Identifier;
import yul.ast.expr.Literal;
import yul.ast.expr.LiteralKind;
import yul.ast.stmt.*;
import yul.diagnostics.ErrorReporter;
import yul.dialect.BuiltinFunction;
import yul.dialect.Dialect;
import yul.dialect.ValueKind;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Scope, arity and type checks over a parsed block. Results go to {@link AnalysisInfo},
 * problems to the {@link ErrorReporter}; the tree itself is never changed.
 *
 * <p>Expressions evaluate to the list of types of the values they produce. A null list means
 * the count is unknown because an error was already reported; a null entry means untyped.
 */
public final class Analyzer implements StatementVisitor<Void>, ExpressionVisitor<List<String>> {

    private static final Logger LOGGER = Logger.getLogger(Analyzer.class.getName());

    private final AnalysisInfo info;
    private final ErrorReporter reporter;
    private final Dialect dialect;
    private final TypeResolver typeResolver;
    private final SymbolTable scopes = new SymbolTable();

    // location of the innermost enclosing node that has one
    private SourceLocation currentLocation;

    public Analyzer(AnalysisInfo info, ErrorReporter reporter, Dialect dialect) {
        this.info = info;
        this.reporter = reporter;
        this.dialect = dialect;
        this.typeResolver = new TypeResolver(dialect, reporter);
    }

    /** True iff no error was reported while analyzing this block. Warnings do not count. */
    public boolean analyze(Block block) {
        int errorsBefore = reporter.errorCount();
        currentLocation = null;
        analyzeBlock(block);
        int newErrors = reporter.errorCount() - errorsBefore;
        LOGGER.fine(() -> "Analysis finished with " + newErrors + " error(s)");
        return newErrors == 0;
    }

    // ================= statements =================

    @Override
    public Void visitBlock(Block block) {
        info.recordScope(block, scopes.push(false));
        analyzeStatements(block);
        scopes.pop();
        return null;
    }

    @Override
    public Void visitVariableDeclaration(VariableDeclaration decl) {
        List<String> valueTypes = decl.value() == null ? null : decl.value().accept(this);

        List<String> variableTypes = new ArrayList<>();
        for (TypedName v : decl.variables()) {
            variableTypes.add(typeResolver.resolve(v.type(), ValueKind.VARIABLE, at(v)));
        }

        if (valueTypes != null) {
            if (valueTypes.size() != decl.variables().size()) {
                reporter.declarationError(at(decl), "Variable count mismatch for declaration of \""
                        + joinNames(decl.variables().stream().map(TypedName::name).toList()) + "\": "
                        + decl.variables().size() + " variables and " + valueTypes.size() + " values.");
            } else {
                for (int i = 0; i < valueTypes.size(); i++) {
                    String given = valueTypes.get(i);
                    String expected = variableTypes.get(i);
                    if (given != null && expected != null && !given.equals(expected)) {
                        reporter.typeError(at(decl), "Assigning value of type \"" + given
                                + "\" to variable of type \"" + expected + "\".");
                    }
                }
            }
        }

        for (int i = 0; i < decl.variables().size(); i++) {
            declareVariable(decl.variables().get(i), variableTypes.get(i));
        }
        return null;
    }

    @Override
    public Void visitAssignment(Assignment assignment) {
        List<String> valueTypes = assignment.value().accept(this);

        Set<String> seen = new HashSet<>();
        List<String> targetTypes = new ArrayList<>();
        for (Identifier target : assignment.variableNames()) {
            if (!seen.add(target.name())) {
                reporter.declarationError(at(target), "Variable " + target.name()
                        + " occurs multiple times on the left-hand side of the assignment.");
            }
            Symbol sym = scopes.lookup(target.name());
            if (sym instanceof VarSymbol var) {
                targetTypes.add(var.type());
                info.recordTypes(target, Collections.singletonList(var.type()));
            } else {
                reporter.declarationError(at(target), "Variable not found or variable not lvalue.");
                targetTypes.add(null);
            }
        }

        if (valueTypes == null) return null;
        if (valueTypes.size() != targetTypes.size()) {
            reporter.declarationError(at(assignment), "Variable count mismatch for assignment to \""
                    + joinNames(assignment.variableNames().stream().map(Identifier::name).toList()) + "\": "
                    + targetTypes.size() + " variables and " + valueTypes.size() + " values.");
            return null;
        }
        for (int i = 0; i < valueTypes.size(); i++) {
            String given = valueTypes.get(i);
            String expected = targetTypes.get(i);
            if (given != null && expected != null && !given.equals(expected)) {
                reporter.typeError(at(assignment), "Assigning a value of type \"" + given
                        + "\" to a variable of type \"" + expected + "\".");
            }
        }
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement stmt) {
        List<String> types = stmt.expression().accept(this);
        if (types != null && !types.isEmpty()) {
            int n = types.size();
            reporter.typeError(at(stmt), "Top-level expressions are not supposed to return values (this expression returns "
                    + n + " value" + (n == 1 ? "" : "s") + "). Use ``pop()`` or assign them.");
        }
        return null;
    }

    @Override
    public Void visitIf(If stmt) {
        expectBoolean(stmt.condition());
        analyzeBlock(stmt.body());
        return null;
    }

    @Override
    public Void visitSwitch(Switch stmt) {
        String valueType = expectSingleValue(stmt.expression());

        List<Case> cases = stmt.cases();
        if (cases.isEmpty()) {
            reporter.declarationError(at(stmt), "Switch statement without any cases.");
        } else if (cases.size() == 1 && cases.get(0).isDefault()) {
            reporter.warning(at(stmt), "\"switch\" statement with only a default case.");
        }

        Set<BigInteger> values = new HashSet<>();
        boolean defaultSeen = false;
        for (int i = 0; i < cases.size(); i++) {
            Case c = cases.get(i);
            SourceLocation saved = enter(c);
            if (c.isDefault()) {
                if (defaultSeen) {
                    reporter.declarationError(at(c), "Only one default case allowed.");
                } else if (i != cases.size() - 1) {
                    reporter.declarationError(at(c), "Default case must be the last case.");
                }
                defaultSeen = true;
            } else {
                String caseType = c.value().accept(this).get(0);
                expectType(valueType, caseType, at(c));
                BigInteger value = LiteralValues.valueOf(c.value());
                if (value != null && !values.add(value)) {
                    reporter.declarationError(at(c), "Duplicate case \"" + c.value().value() + "\" defined.");
                }
            }
            analyzeBlock(c.body());
            currentLocation = saved;
        }
        return null;
    }

    @Override
    public Void visitForLoop(ForLoop loop) {
        // the pre block's scope stays open for condition, post and body
        SourceLocation saved = enter(loop.pre());
        info.recordScope(loop.pre(), scopes.push(false));
        analyzeStatements(loop.pre());
        currentLocation = saved;

        expectBoolean(loop.condition());
        analyzeBlock(loop.post());
        analyzeBlock(loop.body());
        scopes.pop();
        return null;
    }

    @Override
    public Void visitBreak(Break stmt) {
        return null;
    }

    @Override
    public Void visitContinue(Continue stmt) {
        return null;
    }

    @Override
    public Void visitLeave(Leave stmt) {
        return null;
    }

    @Override
    public Void visitFunctionDefinition(FunctionDefinition fn) {
        FuncSymbol signature = info.functionOf(fn);
        if (signature == null) signature = signatureOf(fn);

        info.recordScope(fn, scopes.push(true));
        for (int i = 0; i < fn.parameters().size(); i++) {
            declareVariable(fn.parameters().get(i), signature.parameterTypes().get(i));
        }
        for (int i = 0; i < fn.returnVariables().size(); i++) {
            declareVariable(fn.returnVariables().get(i), signature.returnTypes().get(i));
        }
        analyzeBlock(fn.body());
        scopes.pop();
        return null;
    }

    // ================= expressions =================

    @Override
    public List<String> visitFunctionCall(FunctionCall call) {
        String name = call.functionName().name();
        SourceLocation location = at(call);

        List<String> parameters = null;
        List<String> returns = null;
        BuiltinFunction builtin = dialect.builtin(name).orElse(null);
        if (builtin != null) {
            parameters = builtin.parameters();
            returns = builtin.returns();
        } else {
            Symbol sym = scopes.lookup(name);
            if (sym instanceof FuncSymbol fn) {
                parameters = fn.parameterTypes();
                returns = fn.returnTypes();
            } else if (sym instanceof VarSymbol) {
                reporter.typeError(at(call.functionName()), "Attempt to call variable instead of function.");
            } else {
                Optional<String> unavailable = dialect.unavailableBuiltinMessage(name);
                if (unavailable.isPresent()) {
                    reporter.typeError(at(call.functionName()), unavailable.get());
                } else {
                    reporter.declarationError(at(call.functionName()), "Function \"" + name + "\" not found.");
                }
            }
        }

        List<Expression> arguments = call.arguments();
        if (parameters != null && parameters.size() != arguments.size()) {
            reporter.typeError(location, "Function \"" + name + "\" expects " + parameters.size()
                    + " arguments but got " + arguments.size() + ".");
        }

        for (int i = 0; i < arguments.size(); i++) {
            Expression argument = arguments.get(i);
            LiteralKind literalKind = builtin == null ? null : builtin.literalArgument(i);
            if (literalKind != null) {
                checkLiteralArgument(argument, literalKind);
                continue;
            }
            String given = expectSingleValue(argument);
            if (parameters != null && i < parameters.size()) {
                expectType(parameters.get(i), given, at(argument));
            }
        }

        if (returns != null) info.recordTypes(call, returns);
        return returns;
    }

    @Override
    public List<String> visitIdentifier(Identifier identifier) {
        Symbol sym = scopes.lookup(identifier.name());
        List<String> types;
        if (sym instanceof VarSymbol var) {
            types = Collections.singletonList(var.type());
        } else if (sym instanceof FuncSymbol) {
            reporter.typeError(at(identifier), "Function " + identifier.name() + " used without being called.");
            types = Collections.singletonList(null);
        } else {
            reporter.declarationError(at(identifier), "Identifier \"" + identifier.name() + "\" not found.");
            types = Collections.singletonList(null);
        }
        info.recordTypes(identifier, types);
        return types;
    }

    @Override
    public List<String> visitLiteral(Literal literal) {
        SourceLocation location = at(literal);
        String type = typeResolver.resolve(literal.type(), ValueKind.of(literal.kind()), location);

        switch (literal.kind()) {
            case NUMBER -> {
                BigInteger value = LiteralValues.valueOf(literal);
                if (value == null) {
                    reporter.typeError(location, "Invalid number literal \"" + literal.value() + "\".");
                } else if (value.compareTo(LiteralValues.MAX_U256) > 0) {
                    reporter.typeError(location, "Number literal too large (> 256 bits)");
                }
            }
            case STRING -> {
                if (literal.value().length() > 32) {
                    reporter.typeError(location, "String literal too long (" + literal.value().length() + " > 32)");
                }
            }
            case BOOLEAN -> { }
        }

        if (type != null && !dialect.validTypeForLiteral(literal.kind(), literal.value(), type)) {
            reporter.typeError(location, "Invalid type \"" + type + "\" for literal \"" + literal.value() + "\".");
        }

        List<String> types = Collections.singletonList(type);
        info.recordTypes(literal, types);
        return types;
    }

    // ================= helpers =================

    private void analyzeBlock(Block block) {
        SourceLocation saved = enter(block);
        visitBlock(block);
        currentLocation = saved;
    }

    private void analyzeStatements(Block block) {
        registerFunctions(block);
        for (Statement s : block.statements()) {
            SourceLocation saved = enter(s);
            s.accept(this);
            currentLocation = saved;
        }
    }

    // functions are visible in the whole block, before their definition too
    private void registerFunctions(Block block) {
        for (Statement s : block.statements()) {
            if (!(s instanceof FunctionDefinition fn)) continue;
            SourceLocation saved = enter(fn);
            FuncSymbol signature = signatureOf(fn);
            info.recordFunction(fn, signature);
            if (scopes.exists(fn.name())) {
                reporter.declarationError(at(fn), "Function name " + fn.name() + " already taken in this scope.");
            } else {
                scopes.define(signature);
            }
            currentLocation = saved;
        }
    }

    private FuncSymbol signatureOf(FunctionDefinition fn) {
        List<String> parameterTypes = new ArrayList<>();
        for (TypedName p : fn.parameters()) {
            parameterTypes.add(typeResolver.resolve(p.type(), ValueKind.VARIABLE, at(p)));
        }
        List<String> returnTypes = new ArrayList<>();
        for (TypedName r : fn.returnVariables()) {
            returnTypes.add(typeResolver.resolve(r.type(), ValueKind.VARIABLE, at(r)));
        }
        return new FuncSymbol(fn.name(), parameterTypes, returnTypes);
    }

    private void declareVariable(TypedName name, String type) {
        if (scopes.exists(name.name())) {
            reporter.declarationError(at(name), "Variable name " + name.name() + " already taken in this scope.");
        } else {
            scopes.define(new VarSymbol(name.name(), type));
        }
    }

    private void checkLiteralArgument(Expression argument, LiteralKind expected) {
        if (!(argument instanceof Literal literal)) {
            reporter.typeError(at(argument), "Function expects direct literals as arguments.");
            argument.accept(this);
            return;
        }
        if (literal.kind() != expected) {
            reporter.typeError(at(argument), "Function expects a "
                    + (expected == LiteralKind.STRING ? "string" : "number") + " literal as argument.");
        }
        // literal arguments name things, so no length or type limits apply
        info.recordTypes(literal, Collections.singletonList(literal.type()));
    }

    /** Type of the single value the expression yields, or null if unknown or untyped. */
    private String expectSingleValue(Expression expr) {
        List<String> types = expr.accept(this);
        if (types == null) return null;
        if (types.size() != 1) {
            reporter.typeError(at(expr), "Expected expression to evaluate to one value, but got "
                    + types.size() + " values instead.");
            return null;
        }
        return types.get(0);
    }

    private void expectBoolean(Expression condition) {
        String type = expectSingleValue(condition);
        String boolType = dialect.boolType().orElse(null);
        if (type != null && boolType != null && !type.equals(boolType)) {
            reporter.typeError(at(condition), "Expected a value of boolean type \"" + boolType
                    + "\" but got \"" + type + "\"");
        }
    }

    private void expectType(String expected, String given, SourceLocation location) {
        if (expected != null && given != null && !expected.equals(given)) {
            reporter.typeError(location, "Expected a value of type \"" + expected + "\" but got \"" + given + "\"");
        }
    }

    private SourceLocation enter(Node node) {
        SourceLocation saved = currentLocation;
        SourceLocation own = Ast.locationOf(node);
        if (own != null) currentLocation = own;
        return saved;
    }

    private SourceLocation at(Node node) {
        SourceLocation own = Ast.locationOf(node);
        return own != null ? own : currentLocation;
    }

    private static String joinNames(List<String> names) {
        return String.join(", ", names);
    }
}
